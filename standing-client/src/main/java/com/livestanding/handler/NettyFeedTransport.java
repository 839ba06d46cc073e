package com.livestanding.handler;

import com.livestanding.connection.FeedTransport;
import com.livestanding.connection.TransportConnection;
import com.livestanding.connection.TransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket client transport on Netty's NIO event loop.
 *
 * Threading Model:
 * - One I/O thread is enough: the client holds a single connection at a time
 * - Listener callbacks run on that I/O thread and must not block
 *
 * Pipeline per connection:
 * [ssl] -> idle detection -> HTTP codec -> aggregator -> compression ->
 * WebSocket handshake -> {@link FeedFrameHandler}
 */
public class NettyFeedTransport implements FeedTransport {

    private static final Logger logger = LoggerFactory.getLogger(NettyFeedTransport.class);

    private static final int MAX_FRAME_SIZE = 1 << 20;
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final EventLoopGroup group;
    private final int readerIdleSeconds;

    public NettyFeedTransport(int readerIdleSeconds) {
        this.group = new NioEventLoopGroup(1);
        this.readerIdleSeconds = readerIdleSeconds;
    }

    @Override
    public void open(URI endpoint, TransportListener listener) {
        String scheme = endpoint.getScheme() == null ? "ws" : endpoint.getScheme();
        boolean secure = "wss".equalsIgnoreCase(scheme);
        String host = endpoint.getHost();
        int port = endpoint.getPort() > 0 ? endpoint.getPort() : (secure ? 443 : 80);

        SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            listener.onError(e);
            return;
        }

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true) // Disable Nagle for low latency
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }

                        // A silent server counts as a lost connection
                        if (readerIdleSeconds > 0) {
                            pipeline.addLast(new IdleStateHandler(readerIdleSeconds, 0, 0, TimeUnit.SECONDS));
                        }

                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                        pipeline.addLast(new WebSocketClientProtocolHandler(
                                WebSocketClientHandshakerFactory.newHandshaker(
                                        endpoint,
                                        WebSocketVersion.V13,
                                        null,      // subprotocols
                                        true,      // allow extensions
                                        new DefaultHttpHeaders(),
                                        MAX_FRAME_SIZE)));
                        pipeline.addLast(new FeedFrameHandler(listener));
                    }
                });

        logger.debug("Opening {}", endpoint);

        ChannelFuture connectFuture = bootstrap.connect(host, port);
        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                listener.onError(future.cause());
            }
        });
    }

    @Override
    public void shutdown() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        logger.info("Transport shut down");
    }

    /**
     * Open WebSocket backed by a Netty channel.
     */
    static class ChannelConnection implements TransportConnection {

        private final Channel channel;

        ChannelConnection(Channel channel) {
            this.channel = channel;
        }

        @Override
        public void send(String text) {
            if (!channel.isActive()) {
                throw new IllegalStateException("Connection is not open");
            }
            channel.writeAndFlush(new TextWebSocketFrame(text));
        }

        @Override
        public void close() {
            channel.close();
        }

        @Override
        public boolean isActive() {
            return channel.isActive();
        }
    }
}

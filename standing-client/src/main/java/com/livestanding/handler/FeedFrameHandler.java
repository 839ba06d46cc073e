package com.livestanding.handler;

import com.livestanding.connection.TransportListener;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last handler in the client pipeline: turns channel events into
 * {@link TransportListener} callbacks.
 *
 * - handshake complete: onOpen
 * - text frame: onText
 * - channel inactive after open: onClosed
 * - exception, or inactive before the handshake finished: onError
 *
 * Exactly one terminal event (onClosed or onError) is raised per channel.
 *
 * Important: Never block in this handler! It runs on the I/O thread.
 */
public class FeedFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(FeedFrameHandler.class);

    private final TransportListener listener;
    private boolean opened;
    private boolean terminated;

    public FeedFrameHandler(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            opened = true;
            logger.info("WebSocket handshake complete: {}", ctx.channel().remoteAddress());
            listener.onOpen(new NettyFeedTransport.ChannelConnection(ctx.channel()));
        } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            fail(ctx, new IllegalStateException("WebSocket handshake timed out"));
        } else if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        // The broadcast protocol is text only
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.warn("Unsupported frame type: {}", frame.getClass().getName());
            return;
        }
        listener.onText(((TextWebSocketFrame) frame).text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!terminated) {
            terminated = true;
            if (opened) {
                logger.info("WebSocket connection closed");
                listener.onClosed();
            } else {
                listener.onError(new IllegalStateException("Connection closed before handshake completed"));
            }
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        fail(ctx, cause);
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause) {
        if (!terminated) {
            terminated = true;
            logger.error("WebSocket error", cause);
            listener.onError(cause);
        }
        ctx.close();
    }
}

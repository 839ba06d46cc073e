package com.livestanding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livestanding.config.FeedConfig;
import com.livestanding.connection.ConnectionListener;
import com.livestanding.connection.ConnectionManager;
import com.livestanding.handler.NettyFeedTransport;
import com.livestanding.protocol.Envelope;
import com.livestanding.protocol.EnvelopeSerializer;
import io.netty.util.HashedWheelTimer;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.junit.jupiter.api.*;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.concurrent.*;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Networking Requirements:
 * - WebSocket handshake and authentication against a real server
 * - payload frames reach the listener
 * - reconnection over real sockets
 */
@DisplayName("Networking Tests")
class NetworkingTest {

    private static final String TOKEN = "token-1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FeedServer server;
    private HashedWheelTimer timer;
    private NettyFeedTransport transport;
    private ConnectionManager manager;
    private final BlockingQueue<String> payloads = new LinkedBlockingQueue<>();
    private final BlockingQueue<Boolean> reconnectTags = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> connectResults = new LinkedBlockingQueue<>();

    /**
     * Minimal broadcast server: answers the credential, pushes payloads on demand.
     */
    private static class FeedServer extends WebSocketServer {

        private final EnvelopeSerializer serializer = new EnvelopeSerializer();
        private final ObjectMapper objectMapper = new ObjectMapper();
        final CountDownLatch started = new CountDownLatch(1);
        final BlockingQueue<String> authFrames = new LinkedBlockingQueue<>();
        final List<WebSocket> clients = new CopyOnWriteArrayList<>();

        FeedServer() {
            super(new InetSocketAddress("127.0.0.1", 0));
            setReuseAddr(true);
        }

        @Override
        public void onOpen(WebSocket conn, ClientHandshake handshake) {
            clients.add(conn);
        }

        @Override
        public void onClose(WebSocket conn, int code, String reason, boolean remote) {
            clients.remove(conn);
        }

        @Override
        public void onMessage(WebSocket conn, String message) {
            authFrames.add(message);
            try {
                JsonNode auth = objectMapper.readTree(message);
                if (TOKEN.equals(auth.path("access_token").asText())) {
                    conn.send(serializer.serialize(Envelope.authenticated(201)));
                } else {
                    conn.send(serializer.serialize(Envelope.error(401, "invalid token")));
                }
            } catch (Exception e) {
                conn.send(serializer.serialize(Envelope.error(400, "bad request")));
            }
        }

        @Override
        public void onError(WebSocket conn, Exception ex) {
        }

        @Override
        public void onStart() {
            started.countDown();
        }

        void push(String data) {
            String frame = serializer.serialize(Envelope.payload(200, data));
            for (WebSocket client : clients) {
                if (client.isOpen()) {
                    client.send(frame);
                }
            }
        }

        void dropClients() {
            clients.forEach(WebSocket::close);
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        server = new FeedServer();
        server.start();
        assertTrue(server.started.await(5, TimeUnit.SECONDS), "Server should start");

        timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        transport = new NettyFeedTransport(60);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (manager != null) {
            manager.close();
        }
        transport.shutdown();
        timer.stop();
        server.stop(1000);
    }

    private ConnectionManager connect(int port, String token) {
        FeedConfig config = FeedConfig.defaults();
        config.setHost("127.0.0.1");
        config.setPort(port);
        config.setReconnectDelayMs(200);

        manager = new ConnectionManager(config, transport, timer);
        manager.addListener(new ConnectionListener() {
            @Override
            public void onConnect(boolean succeeded, boolean reconnect, String message) {
                connectResults.add(succeeded + ":" + reconnect);
            }

            @Override
            public void onMessage(String payload, boolean reconnecting) {
                payloads.add(payload);
                reconnectTags.add(reconnecting);
            }
        });
        manager.connect(token);
        return manager;
    }

    private static void awaitCondition(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    // ==========================================
    // Test: Handshake & Authentication
    // ==========================================

    @Test
    @DisplayName("Should open the WebSocket and authenticate")
    void testAuthenticate() throws Exception {
        connect(server.getPort(), TOKEN);

        String auth = server.authFrames.poll(5, TimeUnit.SECONDS);
        assertNotNull(auth, "Server should receive the credential");
        assertEquals(TOKEN, objectMapper.readTree(auth).get("access_token").asText());

        assertEquals("true:false", connectResults.poll(5, TimeUnit.SECONDS));
        assertTrue(manager.isConnected());

        System.out.println("✓ Authenticated against " + manager.getEndpoint());
    }

    @Test
    @DisplayName("Should deliver payload frames to the listener")
    void testPayloadDelivery() throws Exception {
        connect(server.getPort(), TOKEN);
        assertEquals("true:false", connectResults.poll(5, TimeUnit.SECONDS));

        String snapshot = Payloads.match("A").team("Alpha", 1, 1).build();
        server.push(snapshot);

        assertEquals(snapshot, payloads.poll(5, TimeUnit.SECONDS));
        assertEquals(Boolean.FALSE, reconnectTags.poll(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Rejected credential should be retried, never connected")
    void testRejectedCredential() throws Exception {
        connect(server.getPort(), "wrong");

        assertNotNull(server.authFrames.poll(5, TimeUnit.SECONDS));
        assertNotNull(server.authFrames.poll(5, TimeUnit.SECONDS), "Client should retry after the error code");
        assertFalse(manager.isConnected());
        assertEquals("false:false", connectResults.poll(5, TimeUnit.SECONDS), "Rejection reported as a failed connect");
        assertFalse(connectResults.contains("true:false"));
        assertFalse(connectResults.contains("true:true"));
    }

    // ==========================================
    // Test: Reconnection
    // ==========================================

    @Test
    @DisplayName("Should reconnect after the server drops the connection")
    void testReconnectAfterServerDrop() throws Exception {
        connect(server.getPort(), TOKEN);
        assertEquals("true:false", connectResults.poll(5, TimeUnit.SECONDS));
        server.authFrames.clear();

        server.dropClients();

        assertNotNull(server.authFrames.poll(5, TimeUnit.SECONDS), "Credential sent again");
        assertEquals("true:true", connectResults.poll(5, TimeUnit.SECONDS));
        awaitCondition(() -> !server.clients.isEmpty(), "Client should be back");

        server.push("after-reconnect");
        assertEquals("after-reconnect", payloads.poll(5, TimeUnit.SECONDS));
        assertEquals(Boolean.TRUE, reconnectTags.poll(1, TimeUnit.SECONDS));

        System.out.println("✓ Reconnected and resumed delivery");
    }

    @Test
    @DisplayName("Refused connection should be reported as a failed connect")
    void testConnectionRefused() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        connect(closedPort, TOKEN);

        assertEquals("false:false", connectResults.poll(5, TimeUnit.SECONDS));
        assertFalse(manager.isConnected());
    }

    @Test
    @DisplayName("Closing the manager should close the socket")
    void testCloseClosesSocket() throws Exception {
        connect(server.getPort(), TOKEN);
        assertEquals("true:false", connectResults.poll(5, TimeUnit.SECONDS));
        awaitCondition(() -> server.clients.size() == 1, "Client should be registered");

        manager.close();

        awaitCondition(() -> server.clients.isEmpty(), "Server should see the close");
        Thread.sleep(500);
        assertTrue(server.authFrames.size() <= 1, "No reconnect after close");
    }
}

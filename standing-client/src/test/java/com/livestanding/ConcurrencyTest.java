package com.livestanding;

import com.livestanding.config.FeedConfig;
import com.livestanding.connection.ConnectionListener;
import com.livestanding.connection.ConnectionManager;
import com.livestanding.dispatch.DispatchQueue;
import com.livestanding.dispatch.QueuedMessage;
import com.livestanding.snapshot.SnapshotDecoder;
import com.livestanding.state.MatchStateTracker;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.*;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Concurrency Requirements:
 * - enqueue from I/O threads while the timer delivers
 * - single-flight delivery
 * - close racing with inbound frames
 */
@DisplayName("Concurrency Tests")
class ConcurrencyTest {

    private HashedWheelTimer timer;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        timer = new HashedWheelTimer(5, TimeUnit.MILLISECONDS);
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        timer.stop();
    }

    // ==========================================
    // Test: Dispatch Under Contention
    // ==========================================

    @Test
    @DisplayName("Concurrent enqueue should never overlap deliveries")
    void testConcurrentEnqueueSingleFlight() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger delivered = new AtomicInteger();

        DispatchQueue dispatcher = new DispatchQueue(new SnapshotDecoder(), (snapshot, reconnecting) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.incrementAndGet();
            inFlight.decrementAndGet();
        }, timer, System::currentTimeMillis, 20, 5);
        dispatcher.start();

        int producers = 8;
        int perProducer = 200;
        String payload = Payloads.match("A").team("Alpha", 1, 1).build();
        CountDownLatch done = new CountDownLatch(producers);

        for (int p = 0; p < producers; p++) {
            executor.submit(() -> {
                for (int i = 0; i < perProducer; i++) {
                    dispatcher.enqueue(new QueuedMessage(false, payload));
                    if (i % 20 == 0) {
                        Thread.yield();
                    }
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS), "Producers should finish");

        long deadline = System.currentTimeMillis() + 5000;
        while (dispatcher.getQueueSize() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        dispatcher.stop();

        assertEquals(0, dispatcher.getQueueSize(), "Buffer fully drained");
        assertEquals(1, maxInFlight.get(), "Deliveries must never overlap");
        assertTrue(delivered.get() >= 1);
        assertTrue(delivered.get() < producers * perProducer, "Stale messages are coalesced");

        System.out.println("✓ " + (producers * perProducer) + " enqueued, " + delivered.get() + " delivered");
    }

    @Test
    @DisplayName("Tracker should stay consistent under concurrent updates")
    void testTrackerConsistency() throws Exception {
        MatchStateTracker tracker = new MatchStateTracker();
        List<byte[]> ids = List.of(Payloads.matchBytes("A"), Payloads.matchBytes("B"), Payloads.matchBytes("C"));
        CountDownLatch done = new CountDownLatch(8);

        for (int t = 0; t < 8; t++) {
            int offset = t;
            executor.submit(() -> {
                for (int i = 0; i < 1000; i++) {
                    byte[] id = ids.get((i + offset) % ids.size());
                    tracker.shouldRefresh(id);
                    tracker.updateState(id, "t");
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        byte[] last = tracker.getCurrentState().getMatchId();
        assertTrue(ids.stream().anyMatch(id -> Arrays.equals(id, last)), "State holds a whole id");
        assertFalse(tracker.shouldRefresh(last));
    }

    // ==========================================
    // Test: Close Racing With I/O
    // ==========================================

    @Test
    @DisplayName("No payload should be delivered after close() returns")
    void testCloseRacingWithFrames() throws Exception {
        FakeTransport transport = new FakeTransport();
        ConnectionManager manager = new ConnectionManager(FeedConfig.defaults(), transport, timer);
        AtomicInteger received = new AtomicInteger();
        manager.addListener(new ConnectionListener() {
            @Override
            public void onMessage(String payload, boolean reconnecting) {
                received.incrementAndGet();
            }
        });

        manager.connect("token");
        FakeTransport.Attempt attempt = transport.last();
        attempt.openAndAuthenticate();

        CountDownLatch started = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                started.countDown();
                for (int i = 0; i < 5000; i++) {
                    attempt.payload("p" + i);
                }
            });
        }

        assertTrue(started.await(5, TimeUnit.SECONDS));
        Thread.sleep(5);
        manager.close();
        int atClose = received.get();

        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(atClose, received.get(), "Frames after close are discarded");
        assertEquals(1, transport.openCount(), "No reconnect after close");
    }
}

package com.livestanding.dispatch;

import com.livestanding.config.FeedConfig;
import com.livestanding.snapshot.MatchSnapshot;
import com.livestanding.snapshot.SnapshotDecoder;
import com.livestanding.snapshot.SnapshotValidationException;

import io.netty.util.Timeout;
import io.netty.util.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Paces inbound payloads so the renderer gets at most one update per interval.
 *
 * How it works:
 * - enqueue() appends to an unbounded FIFO (no backpressure towards the socket)
 * - a check runs every {@code checkMs}; once {@code intervalMs} has passed since
 *   the last delivery and something is pending, the buffer is drained and only
 *   the newest payload is delivered. Older ones are stale and dropped.
 * - the payload is decoded at delivery time; a bad payload is logged and
 *   skipped, the queue keeps running
 *
 * Single-flight: the next check is armed only after the current delivery has
 * returned, so two deliveries never overlap even on a multi-threaded timer.
 * Each start() begins a new run; checks left over from an earlier run do nothing.
 *
 * Thread Safety: enqueue() is called from I/O threads, checks run on the timer
 * thread. The buffer is guarded by this object's monitor; decoding and the
 * handler run outside of it.
 */
public class DispatchQueue {

    private static final Logger logger = LoggerFactory.getLogger(DispatchQueue.class);

    private final SnapshotDecoder decoder;
    private final SnapshotHandler handler;
    private final Timer timer;
    private final LongSupplier clock;
    private final long intervalMs;
    private final long checkMs;

    // Guarded by this
    private final Deque<QueuedMessage> buffer;
    private boolean running;
    private long generation;
    private long latestProcessTime;
    private Timeout checkTimeout;

    public DispatchQueue(FeedConfig config, SnapshotDecoder decoder, SnapshotHandler handler,
                         Timer timer, LongSupplier clock) {
        this(decoder, handler, timer, clock, config.getPacingIntervalMs(), config.getPacingCheckMs());
    }

    public DispatchQueue(SnapshotDecoder decoder, SnapshotHandler handler, Timer timer,
                         LongSupplier clock, long intervalMs, long checkMs) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.intervalMs = intervalMs;
        this.checkMs = checkMs;
        this.buffer = new ArrayDeque<>();
    }

    /**
     * Starts the periodic check. The first delivery happens one full interval
     * after start at the earliest.
     */
    public synchronized void start() {
        if (running) {
            logger.warn("DispatchQueue already started");
            return;
        }
        running = true;
        generation++;
        latestProcessTime = clock.getAsLong();
        scheduleCheck(generation);
        logger.info("DispatchQueue started (interval {} ms, check every {} ms)", intervalMs, checkMs);
    }

    /**
     * Halts the periodic check and drops pending payloads. Idempotent.
     */
    public synchronized void stop() {
        int dropped = buffer.size();
        buffer.clear();

        if (!running) {
            return;
        }
        running = false;
        if (checkTimeout != null) {
            checkTimeout.cancel();
            checkTimeout = null;
        }
        logger.info("DispatchQueue stopped, {} pending message(s) dropped", dropped);
    }

    public synchronized void enqueue(QueuedMessage message) {
        buffer.addLast(Objects.requireNonNull(message, "message"));
        logger.debug("Message enqueued. Queue size: {}", buffer.size());
    }

    public synchronized void clear() {
        buffer.clear();
        logger.info("Message queue cleared");
    }

    public synchronized int getQueueSize() {
        return buffer.size();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    // === Pacing ===

    private void scheduleCheck(long run) {
        try {
            checkTimeout = timer.newTimeout(timeout -> onCheck(run), checkMs, TimeUnit.MILLISECONDS);
        } catch (IllegalStateException e) {
            logger.warn("Dispatch timer is unavailable, stopping: {}", e.getMessage());
            running = false;
        }
    }

    private void onCheck(long run) {
        QueuedMessage next;
        synchronized (this) {
            if (!running || run != generation) {
                return;
            }
            next = takeIfDue();
        }

        try {
            if (next != null) {
                deliver(next);
            }
        } finally {
            synchronized (this) {
                // A stop() and start() during delivery has already armed a new chain
                if (running && run == generation) {
                    if (next != null) {
                        latestProcessTime = clock.getAsLong();
                    }
                    scheduleCheck(run);
                }
            }
        }
    }

    /**
     * Drains the buffer if an interval has passed. The newest payload wins; it
     * keeps the reconnect tag of any message it replaces so that tag is not lost.
     */
    private QueuedMessage takeIfDue() {
        long now = clock.getAsLong();
        if (now - latestProcessTime < intervalMs || buffer.isEmpty()) {
            return null;
        }

        QueuedMessage newest = buffer.peekLast();
        boolean reconnecting = false;
        for (QueuedMessage message : buffer) {
            reconnecting |= message.isReconnecting();
        }
        int dropped = buffer.size() - 1;
        buffer.clear();

        if (dropped > 0) {
            logger.debug("Dropped {} stale message(s)", dropped);
        }
        return reconnecting == newest.isReconnecting()
                ? newest
                : new QueuedMessage(true, newest.getPayload());
    }

    private void deliver(QueuedMessage message) {
        try {
            MatchSnapshot snapshot = decoder.decode(message.getPayload());

            logger.info("Dequeued message: reconnecting={}, matchId={}, tournamentId={}, teams={}, players={}, refresh={}",
                    message.isReconnecting(),
                    snapshot.matchIdHex(),
                    snapshot.getTournamentId(),
                    snapshot.getRoster().size(),
                    snapshot.getTotalPlayers().size(),
                    snapshot.isRefresh());

            handler.onSnapshot(snapshot, message.isReconnecting());
        } catch (SnapshotValidationException e) {
            logger.error("Failed to decode message, dropping it: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.error("Failed to process message", e);
        }
    }
}

package com.livestanding;

import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Netty Timer driven by hand. Time only moves in advance(); tasks run on the
 * calling thread, in deadline order, including tasks scheduled while advancing.
 */
class ManualTimer implements Timer {

    private final List<ManualTimeout> pending = new ArrayList<>();
    private long now;
    private long sequence;
    private boolean stopped;

    synchronized long now() {
        return now;
    }

    LongSupplier clock() {
        return this::now;
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Moves the clock forward, firing every task that falls due on the way.
     */
    void advance(long millis) {
        long target;
        synchronized (this) {
            target = now + millis;
        }
        while (true) {
            ManualTimeout next;
            synchronized (this) {
                next = pending.stream()
                        .filter(t -> t.deadline <= target)
                        .min(Comparator.comparingLong((ManualTimeout t) -> t.deadline).thenComparingLong(t -> t.order))
                        .orElse(null);
                if (next == null) {
                    now = target;
                    return;
                }
                pending.remove(next);
                now = Math.max(now, next.deadline);
                next.expired = true;
            }
            try {
                next.task.run(next);
            } catch (Exception e) {
                throw new AssertionError("Timer task failed", e);
            }
        }
    }

    @Override
    public synchronized Timeout newTimeout(TimerTask task, long delay, TimeUnit unit) {
        if (stopped) {
            throw new IllegalStateException("cannot be started once stopped");
        }
        ManualTimeout timeout = new ManualTimeout(task, now + unit.toMillis(delay), sequence++);
        pending.add(timeout);
        return timeout;
    }

    @Override
    public synchronized Set<Timeout> stop() {
        stopped = true;
        Set<Timeout> unprocessed = new HashSet<>(pending);
        pending.clear();
        return unprocessed;
    }

    private class ManualTimeout implements Timeout {

        private final TimerTask task;
        private final long deadline;
        private final long order;
        private boolean expired;
        private boolean cancelled;

        ManualTimeout(TimerTask task, long deadline, long order) {
            this.task = task;
            this.deadline = deadline;
            this.order = order;
        }

        @Override
        public Timer timer() {
            return ManualTimer.this;
        }

        @Override
        public TimerTask task() {
            return task;
        }

        @Override
        public boolean isExpired() {
            synchronized (ManualTimer.this) {
                return expired;
            }
        }

        @Override
        public boolean isCancelled() {
            synchronized (ManualTimer.this) {
                return cancelled;
            }
        }

        @Override
        public boolean cancel() {
            synchronized (ManualTimer.this) {
                if (expired || cancelled) {
                    return false;
                }
                cancelled = true;
                pending.remove(this);
                return true;
            }
        }
    }
}

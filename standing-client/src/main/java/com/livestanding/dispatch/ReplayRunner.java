package com.livestanding.dispatch;

import io.netty.util.Timeout;
import io.netty.util.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Feeds a recorded session into a {@link DispatchQueue} for offline rehearsal.
 *
 * The recording holds one snapshot payload per line, blank lines are skipped.
 * The next line is enqueued only once the dispatcher has taken the previous
 * one, so every recorded snapshot is delivered, one per pacing interval.
 * Feeding stops by itself at the end of the file, then the completion
 * callback runs once.
 */
public class ReplayRunner {

    private static final Logger logger = LoggerFactory.getLogger(ReplayRunner.class);

    private final DispatchQueue dispatcher;
    private final Timer timer;
    private final long checkMs;
    private volatile Runnable onFinished = () -> { };

    // Guarded by this
    private List<String> lines = List.of();
    private int position;
    private boolean running;
    private Timeout feedTimeout;

    /**
     * @param checkMs how often to look whether the dispatcher is ready for the next line
     */
    public ReplayRunner(DispatchQueue dispatcher, Timer timer, long checkMs) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.checkMs = checkMs;
    }

    /**
     * Loads the recording and starts feeding it. The dispatcher is started too.
     *
     * @return number of payloads that will be fed
     * @throws IOException if the recording cannot be read
     */
    public synchronized int start(Path recording) throws IOException {
        if (running) {
            throw new IllegalStateException("Replay already running");
        }

        List<String> loaded = new ArrayList<>();
        for (String line : Files.readAllLines(recording, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                loaded.add(line.trim());
            }
        }

        lines = loaded;
        position = 0;
        running = true;
        logger.info("Replaying {} payload(s) from {}", loaded.size(), recording);

        dispatcher.start();
        feedNext();
        return loaded.size();
    }

    /**
     * Halts feeding and stops the dispatcher. Idempotent.
     */
    public synchronized void stop() {
        if (feedTimeout != null) {
            feedTimeout.cancel();
            feedTimeout = null;
        }
        if (running) {
            running = false;
            logger.info("Replay stopped at {}/{}", position, lines.size());
        }
        dispatcher.stop();
    }

    /**
     * Called on the timer thread once the last line has been taken by the
     * dispatcher. Must not block or stop the timer.
     */
    public void setOnFinished(Runnable onFinished) {
        this.onFinished = Objects.requireNonNull(onFinished, "onFinished");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized int getPosition() {
        return position;
    }

    public synchronized int getTotal() {
        return lines.size();
    }

    private synchronized void feedNext() {
        feedTimeout = null;
        if (!running) {
            return;
        }

        if (dispatcher.getQueueSize() == 0) {
            if (position >= lines.size()) {
                running = false;
                logger.info("Replay finished, {} payload(s) fed", lines.size());
                onFinished.run();
                return;
            }
            dispatcher.enqueue(new QueuedMessage(false, lines.get(position)));
            position++;
            logger.debug("Fed replay payload {}/{}", position, lines.size());
        }

        try {
            feedTimeout = timer.newTimeout(timeout -> feedNext(), checkMs, TimeUnit.MILLISECONDS);
        } catch (IllegalStateException e) {
            logger.warn("Replay timer is unavailable, stopping: {}", e.getMessage());
            running = false;
        }
    }
}

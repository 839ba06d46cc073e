package com.livestanding;

import com.livestanding.config.FeedConfig;
import com.livestanding.config.FeedConfigLoader;
import com.livestanding.connection.ConnectionManager;
import com.livestanding.dispatch.ReplayRunner;
import com.livestanding.handler.NettyFeedTransport;
import com.livestanding.pipeline.StandingPipeline;
import com.livestanding.render.LoggingRendererSink;

import io.netty.util.HashedWheelTimer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the live standing client.
 *
 * Usage: Main [config.json] [--replay recording.jsonl]
 *
 * Without --replay the client connects to the configured feed and keeps
 * reconnecting until it is stopped. With --replay it plays a recorded session
 * instead of connecting and exits once the recording has been delivered.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);
    private static final String REPLAY_FLAG = "--replay";

    public static void main(String[] args) throws InterruptedException {
        Path configPath = null;
        Path replayPath = null;

        for (int i = 0; i < args.length; i++) {
            if (REPLAY_FLAG.equals(args[i])) {
                if (i + 1 < args.length) {
                    replayPath = Path.of(args[++i]);
                } else {
                    logger.warn("{} needs a file argument, ignoring it", REPLAY_FLAG);
                }
            } else if (configPath == null) {
                configPath = Path.of(args[i]);
            } else {
                logger.warn("Ignoring unexpected argument '{}'", args[i]);
            }
        }

        FeedConfig config = new FeedConfigLoader().load(configPath);

        logger.info("===========================================");
        logger.info("  Live Standing Client");
        logger.info("  {}", replayPath != null ? "Replaying " + replayPath : "Feed " + config.endpoint());
        logger.info("===========================================");

        HashedWheelTimer timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        StandingPipeline pipeline = new StandingPipeline(config, timer, new LoggingRendererSink());
        CountDownLatch stopped = new CountDownLatch(1);

        if (replayPath != null) {
            ReplayRunner replay = new ReplayRunner(pipeline.getDispatcher(), timer, config.getPacingCheckMs());

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received, stopping replay...");
                replay.stop();
                timer.stop();
                stopped.countDown();
            }));

            replay.setOnFinished(stopped::countDown);

            try {
                replay.start(replayPath);
            } catch (IOException e) {
                logger.error("Failed to read recording {}", replayPath, e);
                timer.stop();
                System.exit(1);
            }

            stopped.await();
            // The timer cannot be stopped from its own thread, so cleanup happens here
            replay.stop();
            timer.stop();
            logger.info("Replay complete, exiting");
        } else {
            NettyFeedTransport transport = new NettyFeedTransport(config.getReaderIdleSeconds());
            ConnectionManager connection = new ConnectionManager(config, transport, timer);
            connection.addListener(pipeline);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received, closing feed...");
                connection.close();
                pipeline.stop();
                transport.shutdown();
                timer.stop();
                stopped.countDown();
            }));

            pipeline.start();
            connection.connect(config.getAccessToken());
            stopped.await();
        }
    }
}

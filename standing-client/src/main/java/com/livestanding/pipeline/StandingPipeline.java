package com.livestanding.pipeline;

import com.livestanding.config.FeedConfig;
import com.livestanding.connection.ConnectionListener;
import com.livestanding.connection.ConnectionStatus;
import com.livestanding.dispatch.DispatchQueue;
import com.livestanding.dispatch.QueuedMessage;
import com.livestanding.dispatch.SnapshotHandler;
import com.livestanding.reconcile.PanelRegistry;
import com.livestanding.reconcile.ReconcileResult;
import com.livestanding.reconcile.SnapshotReconciler;
import com.livestanding.render.RendererSink;
import com.livestanding.snapshot.MatchSnapshot;
import com.livestanding.snapshot.SnapshotDecoder;
import com.livestanding.state.MatchStateTracker;

import io.netty.util.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Wires the stages between the feed connection and the renderer:
 *
 *   ConnectionManager --onMessage--> DispatchQueue --paced--> MatchStateTracker
 *                                                          --> SnapshotReconciler --> RendererSink
 *
 * Register it on a ConnectionManager with addListener(), or feed its
 * dispatcher directly (replay). Deliveries are serialized by the dispatcher,
 * so tracker and registry updates never overlap.
 */
public class StandingPipeline implements ConnectionListener, SnapshotHandler {

    private static final Logger logger = LoggerFactory.getLogger(StandingPipeline.class);

    private final MatchStateTracker tracker;
    private final SnapshotReconciler reconciler;
    private final PanelRegistry registry;
    private final RendererSink sink;
    private final DispatchQueue dispatcher;

    public StandingPipeline(FeedConfig config, Timer timer, RendererSink sink) {
        this(config, timer, System::currentTimeMillis, sink);
    }

    public StandingPipeline(FeedConfig config, Timer timer, LongSupplier clock, RendererSink sink) {
        this.tracker = new MatchStateTracker(clock);
        this.reconciler = new SnapshotReconciler(config.getMaxDisplayedTeams(), config.getMinSquadSize());
        this.registry = new PanelRegistry();
        this.sink = Objects.requireNonNull(sink, "sink");
        this.dispatcher = new DispatchQueue(config, new SnapshotDecoder(), this, timer, clock);
    }

    public void start() {
        dispatcher.start();
    }

    public void stop() {
        dispatcher.stop();
    }

    // === Connection events ===

    @Override
    public void onConnect(boolean succeeded, boolean reconnect, String message) {
        if (succeeded) {
            logger.info("Feed {} ({})", reconnect ? "reconnected" : "connected", message);
        } else {
            logger.warn("Feed connection failed: {}", message);
        }
    }

    @Override
    public void onDisconnect(boolean closedByUser) {
        if (closedByUser) {
            // A later session starts from a blank match
            tracker.clear();
        }
    }

    @Override
    public void onMessage(String payload, boolean reconnecting) {
        dispatcher.enqueue(new QueuedMessage(reconnecting, payload));
    }

    @Override
    public void onStatusChange(ConnectionStatus status) {
        logger.debug("Feed status: {}", status);
    }

    // === Delivery ===

    @Override
    public void onSnapshot(MatchSnapshot snapshot, boolean reconnecting) {
        boolean matchChanged = tracker.shouldRefresh(snapshot.getMatchId());
        boolean refresh = matchChanged || snapshot.isRefresh();

        if (reconnecting && !matchChanged) {
            logger.info("Reconnected to the same match {}, keeping standings", snapshot.matchIdHex());
        } else if (matchChanged) {
            logger.info("Match changed to {}, rebuilding standings", snapshot.matchIdHex());
        }

        tracker.updateState(snapshot.getMatchId(), snapshot.getTournamentId());

        ReconcileResult result = reconciler.reconcile(snapshot, registry, refresh);
        sink.apply(result);
    }

    public MatchStateTracker getTracker() {
        return tracker;
    }

    public PanelRegistry getRegistry() {
        return registry;
    }

    public DispatchQueue getDispatcher() {
        return dispatcher;
    }
}

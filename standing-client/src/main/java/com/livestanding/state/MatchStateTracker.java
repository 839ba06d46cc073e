package com.livestanding.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Decides whether a delivery belongs to the match on screen or starts a new one.
 *
 * Rules:
 * - the very first match id never triggers a rebuild
 * - afterwards, a rebuild is needed iff the id differs byte for byte from the
 *   last id passed to {@link #updateState}
 * - reconnecting has no say in the decision: the same id after a reconnect is
 *   an ordinary update
 *
 * Thread Safety: all methods synchronize on the tracker; the state itself is an
 * immutable {@link MatchState} swapped on every update.
 */
public class MatchStateTracker {

    private static final Logger logger = LoggerFactory.getLogger(MatchStateTracker.class);
    private static final HexFormat HEX = HexFormat.ofDelimiter("-");

    private final LongSupplier clock;
    private MatchState currentState;

    public MatchStateTracker() {
        this(System::currentTimeMillis);
    }

    public MatchStateTracker(LongSupplier clock) {
        this.clock = clock;
        this.currentState = MatchState.empty();
    }

    /**
     * @param newMatchId match id of the incoming snapshot
     * @return true if the match changed and the display must be rebuilt
     */
    public synchronized boolean shouldRefresh(byte[] newMatchId) {
        Objects.requireNonNull(newMatchId, "newMatchId");

        if (!currentState.hasMatch()) {
            logger.info("First match ID received - no refresh needed");
            return false;
        }

        boolean changed = !Arrays.equals(currentState.matchIdRef(), newMatchId);
        if (changed) {
            logger.info("Match ID changed - refresh needed");
            logger.debug("Old match ID: {}", HEX.formatHex(currentState.matchIdRef()));
            logger.debug("New match ID: {}", HEX.formatHex(newMatchId));
        } else {
            logger.debug("Match ID unchanged - no refresh needed");
        }
        return changed;
    }

    /**
     * Records the match of a processed snapshot. Must run after every delivery,
     * whatever {@link #shouldRefresh} returned. The id is copied.
     */
    public synchronized void updateState(byte[] matchId, String tournamentId) {
        Objects.requireNonNull(matchId, "matchId");
        currentState = new MatchState(matchId, tournamentId, clock.getAsLong());
        logger.debug("Match state updated: matchId={}, tournamentId={}", HEX.formatHex(matchId), tournamentId);
    }

    public synchronized MatchState getCurrentState() {
        return currentState;
    }

    /**
     * Forgets the current match, e.g. on manual disconnect.
     */
    public synchronized void clear() {
        logger.info("Match state cleared");
        currentState = MatchState.empty();
    }
}

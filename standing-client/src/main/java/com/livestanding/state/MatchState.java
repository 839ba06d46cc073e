package com.livestanding.state;

import java.util.HexFormat;

/**
 * Last observed match, immutable.
 *
 * A null match id means no snapshot has been processed since start or the last
 * clear.
 */
public class MatchState {

    private static final MatchState EMPTY = new MatchState(null, "", 0);

    private final byte[] matchId;
    private final String tournamentId;
    private final long lastUpdateTime;

    MatchState(byte[] matchId, String tournamentId, long lastUpdateTime) {
        this.matchId = matchId != null ? matchId.clone() : null;
        this.tournamentId = tournamentId;
        this.lastUpdateTime = lastUpdateTime;
    }

    static MatchState empty() {
        return EMPTY;
    }

    /**
     * @return a copy of the match id, or null if none was observed
     */
    public byte[] getMatchId() {
        return matchId != null ? matchId.clone() : null;
    }

    public String getTournamentId() {
        return tournamentId;
    }

    public long getLastUpdateTime() {
        return lastUpdateTime;
    }

    public boolean hasMatch() {
        return matchId != null;
    }

    byte[] matchIdRef() {
        return matchId;
    }

    @Override
    public String toString() {
        return "MatchState{" +
                "matchId=" + (matchId != null ? HexFormat.ofDelimiter("-").formatHex(matchId) : "none") +
                ", tournamentId='" + tournamentId + '\'' +
                '}';
    }
}

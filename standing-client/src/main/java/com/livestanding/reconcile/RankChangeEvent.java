package com.livestanding.reconcile;

/**
 * A displayed team moved in the standings since the previous pass.
 */
public class RankChangeEvent {

    private final long teamId;
    private final String teamName;
    private final int fromRank;
    private final int toRank;

    public RankChangeEvent(long teamId, String teamName, int fromRank, int toRank) {
        if (fromRank == toRank) {
            throw new IllegalArgumentException("Rank did not change: " + fromRank);
        }
        this.teamId = teamId;
        this.teamName = teamName;
        this.fromRank = fromRank;
        this.toRank = toRank;
    }

    public long getTeamId() {
        return teamId;
    }

    public String getTeamName() {
        return teamName;
    }

    public int getFromRank() {
        return fromRank;
    }

    public int getToRank() {
        return toRank;
    }

    public RankDirection getDirection() {
        return toRank < fromRank ? RankDirection.UP : RankDirection.DOWN;
    }

    @Override
    public String toString() {
        return "RankChangeEvent{" +
                "teamName='" + teamName + '\'' +
                ", " + fromRank + " -> " + toRank +
                ", direction=" + getDirection() +
                '}';
    }
}

package com.livestanding.reconcile;

public class EliminationEvent {

    private final long teamId;
    private final String teamName;
    private final int placementRank;
    private final int rank;

    public EliminationEvent(long teamId, String teamName, int placementRank, int rank) {
        this.teamId = teamId;
        this.teamName = teamName;
        this.placementRank = placementRank;
        this.rank = rank;
    }

    public long getTeamId() {
        return teamId;
    }

    public String getTeamName() {
        return teamName;
    }

    /** Finishing place within the current match. */
    public int getPlacementRank() {
        return placementRank;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public String toString() {
        return "EliminationEvent{" +
                "teamName='" + teamName + '\'' +
                ", placementRank=" + placementRank +
                ", rank=" + rank +
                '}';
    }
}

package com.livestanding.snapshot;

/**
 * One team row of a snapshot, immutable.
 *
 * The same type is used for the current-match team list and the cumulative
 * tournament roster; the name is the key that joins them.
 */
public class TeamRecord {

    private final String name;
    private final long id;
    private final int rank;
    private final int placementRank;
    private final int totalKills;
    private final double totalScore;
    private final boolean eliminated;

    public TeamRecord(String name, long id, int rank, int placementRank,
                      int totalKills, double totalScore, boolean eliminated) {
        this.name = name;
        this.id = id;
        this.rank = rank;
        this.placementRank = placementRank;
        this.totalKills = totalKills;
        this.totalScore = totalScore;
        this.eliminated = eliminated;
    }

    public String getName() {
        return name;
    }

    public long getId() {
        return id;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Finishing order within the match, meaningful once the team is out.
     */
    public int getPlacementRank() {
        return placementRank;
    }

    public int getTotalKills() {
        return totalKills;
    }

    public double getTotalScore() {
        return totalScore;
    }

    public boolean isEliminated() {
        return eliminated;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private long id;
        private int rank;
        private int placementRank;
        private int totalKills;
        private double totalScore;
        private boolean eliminated;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public Builder placementRank(int placementRank) {
            this.placementRank = placementRank;
            return this;
        }

        public Builder totalKills(int totalKills) {
            this.totalKills = totalKills;
            return this;
        }

        public Builder totalScore(double totalScore) {
            this.totalScore = totalScore;
            return this;
        }

        public Builder eliminated(boolean eliminated) {
            this.eliminated = eliminated;
            return this;
        }

        public TeamRecord build() {
            return new TeamRecord(name, id, rank, placementRank, totalKills, totalScore, eliminated);
        }
    }

    @Override
    public String toString() {
        return "TeamRecord{" +
                "name='" + name + '\'' +
                ", id=" + id +
                ", rank=" + rank +
                ", placementRank=" + placementRank +
                '}';
    }
}

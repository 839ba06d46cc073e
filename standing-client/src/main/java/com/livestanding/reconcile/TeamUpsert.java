package com.livestanding.reconcile;

/**
 * Instruction to create or refresh one team's panel at a display slot.
 *
 * Standings fields (rank, score) come from the tournament roster, kills from
 * the current match.
 */
public class TeamUpsert {

    private final long teamId;
    private final String teamName;
    private final int displayIndex;
    private final int rank;
    private final String rankText;
    private final double totalScore;
    private final int matchKills;
    private final int killDelta;
    private final SquadStatus squad;
    private final boolean inMatch;
    private final boolean eliminated;
    private final boolean justEliminated;
    private final boolean created;

    private TeamUpsert(Builder builder) {
        this.teamId = builder.teamId;
        this.teamName = builder.teamName;
        this.displayIndex = builder.displayIndex;
        this.rank = builder.rank;
        this.rankText = builder.totalScore == 0 ? "-" : Integer.toString(builder.rank);
        this.totalScore = builder.totalScore;
        this.matchKills = builder.matchKills;
        this.killDelta = builder.killDelta;
        this.squad = builder.squad;
        this.inMatch = builder.inMatch;
        this.eliminated = builder.eliminated;
        this.justEliminated = builder.justEliminated;
        this.created = builder.created;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getTeamId() {
        return teamId;
    }

    public String getTeamName() {
        return teamName;
    }

    public int getDisplayIndex() {
        return displayIndex;
    }

    public int getRank() {
        return rank;
    }

    /** "-" while the team has not scored yet. */
    public String getRankText() {
        return rankText;
    }

    public double getTotalScore() {
        return totalScore;
    }

    public int getMatchKills() {
        return matchKills;
    }

    public int getKillDelta() {
        return killDelta;
    }

    public SquadStatus getSquad() {
        return squad;
    }

    public boolean isInMatch() {
        return inMatch;
    }

    public boolean isEliminated() {
        return eliminated;
    }

    public boolean isJustEliminated() {
        return justEliminated;
    }

    public boolean isCreated() {
        return created;
    }

    @Override
    public String toString() {
        return "TeamUpsert{" +
                "teamName='" + teamName + '\'' +
                ", displayIndex=" + displayIndex +
                ", rank=" + rankText +
                ", kills=" + matchKills +
                ", squad=" + squad +
                ", eliminated=" + eliminated +
                (justEliminated ? ", justEliminated" : "") +
                '}';
    }

    public static class Builder {
        private long teamId;
        private String teamName;
        private int displayIndex;
        private int rank;
        private double totalScore;
        private int matchKills;
        private int killDelta;
        private SquadStatus squad;
        private boolean inMatch;
        private boolean eliminated;
        private boolean justEliminated;
        private boolean created;

        public Builder teamId(long teamId) {
            this.teamId = teamId;
            return this;
        }

        public Builder teamName(String teamName) {
            this.teamName = teamName;
            return this;
        }

        public Builder displayIndex(int displayIndex) {
            this.displayIndex = displayIndex;
            return this;
        }

        public Builder rank(int rank) {
            this.rank = rank;
            return this;
        }

        public Builder totalScore(double totalScore) {
            this.totalScore = totalScore;
            return this;
        }

        public Builder matchKills(int matchKills) {
            this.matchKills = matchKills;
            return this;
        }

        public Builder killDelta(int killDelta) {
            this.killDelta = killDelta;
            return this;
        }

        public Builder squad(SquadStatus squad) {
            this.squad = squad;
            return this;
        }

        public Builder inMatch(boolean inMatch) {
            this.inMatch = inMatch;
            return this;
        }

        public Builder eliminated(boolean eliminated) {
            this.eliminated = eliminated;
            return this;
        }

        public Builder justEliminated(boolean justEliminated) {
            this.justEliminated = justEliminated;
            return this;
        }

        public Builder created(boolean created) {
            this.created = created;
            return this;
        }

        public TeamUpsert build() {
            return new TeamUpsert(this);
        }
    }
}

package com.livestanding.reconcile;

import com.livestanding.snapshot.TeamRecord;

/**
 * What the reconciler remembers about one rendered team between passes.
 *
 * Mutated only by {@link SnapshotReconciler}; callers read it.
 */
public class TeamPanel {

    private final String teamName;
    private TeamRecord team;
    private SquadStatus squad;
    private int displayIndex;
    private int previousRank;
    private int previousKills;
    private boolean eliminated;
    private boolean inMatch;

    TeamPanel(TeamRecord team, int displayIndex) {
        this.teamName = team.getName();
        this.team = team;
        this.displayIndex = displayIndex;
        this.previousRank = team.getRank();
        this.inMatch = true;
    }

    public String getTeamName() {
        return teamName;
    }

    public TeamRecord getTeam() {
        return team;
    }

    public SquadStatus getSquad() {
        return squad;
    }

    /** 1-based slot in the standings. */
    public int getDisplayIndex() {
        return displayIndex;
    }

    public int getPreviousRank() {
        return previousRank;
    }

    public int getPreviousKills() {
        return previousKills;
    }

    public boolean isEliminated() {
        return eliminated;
    }

    public boolean isInMatch() {
        return inMatch;
    }

    void update(TeamRecord team, SquadStatus squad, int displayIndex, int kills, boolean inMatch) {
        this.team = team;
        this.squad = squad;
        this.displayIndex = displayIndex;
        this.previousRank = team.getRank();
        this.previousKills = kills;
        this.inMatch = inMatch;
    }

    void setEliminated(boolean eliminated) {
        this.eliminated = eliminated;
    }

    @Override
    public String toString() {
        return "TeamPanel{" +
                "teamName='" + teamName + '\'' +
                ", displayIndex=" + displayIndex +
                ", previousRank=" + previousRank +
                ", eliminated=" + eliminated +
                ", inMatch=" + inMatch +
                '}';
    }
}

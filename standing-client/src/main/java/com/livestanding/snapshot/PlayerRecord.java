package com.livestanding.snapshot;

/**
 * One player row of a snapshot, immutable.
 *
 * A team id of 0 means the producer did not send one; the team name is then
 * the only join key.
 */
public class PlayerRecord {

    private final String name;
    private final long teamId;
    private final String teamName;
    private final PlayerStatus status;

    public PlayerRecord(String name, long teamId, String teamName, PlayerStatus status) {
        this.name = name;
        this.teamId = teamId;
        this.teamName = teamName;
        this.status = status;
    }

    public String getName() {
        return name;
    }

    public long getTeamId() {
        return teamId;
    }

    public String getTeamName() {
        return teamName;
    }

    public PlayerStatus getStatus() {
        return status;
    }

    public boolean isAlive() {
        return status == PlayerStatus.ALIVE;
    }

    @Override
    public String toString() {
        return "PlayerRecord{" +
                "name='" + name + '\'' +
                ", teamId=" + teamId +
                ", teamName='" + teamName + '\'' +
                ", status=" + status +
                '}';
    }
}

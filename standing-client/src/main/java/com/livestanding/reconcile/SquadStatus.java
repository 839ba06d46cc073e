package com.livestanding.reconcile;

import com.livestanding.snapshot.PlayerRecord;

import java.util.List;

/**
 * Alive/groggy/dead counts of one team's current-match players.
 *
 * {@code total} never drops below the minimum squad size, so a short-handed
 * team still shows its empty slots. A team with no players at all is shown as
 * a full squad of alive players.
 */
public class SquadStatus {

    private final int alive;
    private final int groggy;
    private final int dead;
    private final int total;

    public SquadStatus(int alive, int groggy, int dead, int total) {
        this.alive = alive;
        this.groggy = groggy;
        this.dead = dead;
        this.total = total;
    }

    public static SquadStatus of(List<PlayerRecord> players, int minSquadSize) {
        if (players.isEmpty()) {
            return new SquadStatus(minSquadSize, 0, 0, minSquadSize);
        }

        int alive = 0;
        int groggy = 0;
        int dead = 0;
        for (PlayerRecord player : players) {
            switch (player.getStatus()) {
                case ALIVE -> alive++;
                case GROGGY -> groggy++;
                default -> dead++;
            }
        }
        return new SquadStatus(alive, groggy, dead, Math.max(players.size(), minSquadSize));
    }

    public int getAlive() {
        return alive;
    }

    public int getGroggy() {
        return groggy;
    }

    public int getDead() {
        return dead;
    }

    public int getTotal() {
        return total;
    }

    @Override
    public String toString() {
        return "SquadStatus{" +
                "alive=" + alive +
                ", groggy=" + groggy +
                ", dead=" + dead +
                ", total=" + total +
                '}';
    }
}

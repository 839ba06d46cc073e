package com.livestanding.snapshot;

/**
 * Life state of one player as shown in the squad indicator.
 */
public enum PlayerStatus {
    ALIVE,
    GROGGY,
    DEAD;

    /**
     * Maps the post-match death type: "alive", "groggy", anything else is dead.
     */
    public static PlayerStatus fromDeathType(String deathType) {
        if ("alive".equals(deathType)) {
            return ALIVE;
        }
        if ("groggy".equals(deathType)) {
            return GROGGY;
        }
        return DEAD;
    }

    /**
     * Maps live telemetry flags, used when no death type was reported.
     */
    public static PlayerStatus fromTelemetry(boolean isAlive, boolean isGroggy) {
        if (!isAlive) {
            return DEAD;
        }
        return isGroggy ? GROGGY : ALIVE;
    }
}

package com.livestanding.reconcile;

public enum RankDirection {
    /** Rank number went down, e.g. 5th to 3rd. */
    UP,
    /** Rank number went up, e.g. 3rd to 5th. */
    DOWN
}

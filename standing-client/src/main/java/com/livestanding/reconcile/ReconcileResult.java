package com.livestanding.reconcile;

import java.util.List;

/**
 * Everything one reconciliation pass asks the renderer to do.
 *
 * Upserts are in display order. Eliminations are ordered worst placement first
 * and are empty when the pass ended the match.
 */
public class ReconcileResult {

    private final boolean fullRebuild;
    private final List<TeamUpsert> upserts;
    private final List<RankChangeEvent> rankChanges;
    private final List<EliminationEvent> eliminations;
    private final boolean matchEnded;
    private final boolean snapToPosition;

    public ReconcileResult(boolean fullRebuild, List<TeamUpsert> upserts, List<RankChangeEvent> rankChanges,
                           List<EliminationEvent> eliminations, boolean matchEnded, boolean snapToPosition) {
        this.fullRebuild = fullRebuild;
        this.upserts = List.copyOf(upserts);
        this.rankChanges = List.copyOf(rankChanges);
        this.eliminations = List.copyOf(eliminations);
        this.matchEnded = matchEnded;
        this.snapToPosition = snapToPosition;
    }

    public boolean isFullRebuild() {
        return fullRebuild;
    }

    public List<TeamUpsert> getUpserts() {
        return upserts;
    }

    public List<RankChangeEvent> getRankChanges() {
        return rankChanges;
    }

    public List<EliminationEvent> getEliminations() {
        return eliminations;
    }

    public boolean isMatchEnded() {
        return matchEnded;
    }

    public boolean isSnapToPosition() {
        return snapToPosition;
    }

    @Override
    public String toString() {
        return "ReconcileResult{" +
                "fullRebuild=" + fullRebuild +
                ", upserts=" + upserts.size() +
                ", rankChanges=" + rankChanges.size() +
                ", eliminations=" + eliminations.size() +
                ", matchEnded=" + matchEnded +
                ", snapToPosition=" + snapToPosition +
                '}';
    }
}

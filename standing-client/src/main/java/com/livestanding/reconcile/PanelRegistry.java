package com.livestanding.reconcile;

import com.livestanding.snapshot.TeamRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Panels currently on screen, keyed by team name, in creation order.
 *
 * Owned by the caller of the reconciler and cleared on a full rebuild.
 * Not thread-safe: one reconciliation pass runs at a time.
 */
public class PanelRegistry {

    private final Map<String, TeamPanel> panels = new LinkedHashMap<>();
    private boolean snappedAtFullSize;

    public TeamPanel get(String teamName) {
        return panels.get(teamName);
    }

    public boolean contains(String teamName) {
        return panels.containsKey(teamName);
    }

    public int size() {
        return panels.size();
    }

    public Collection<TeamPanel> panels() {
        return Collections.unmodifiableCollection(panels.values());
    }

    public void clear() {
        panels.clear();
        snappedAtFullSize = false;
    }

    TeamPanel create(TeamRecord team, int displayIndex) {
        TeamPanel panel = new TeamPanel(team, displayIndex);
        panels.put(team.getName(), panel);
        return panel;
    }

    boolean isSnappedAtFullSize() {
        return snappedAtFullSize;
    }

    void markSnappedAtFullSize() {
        snappedAtFullSize = true;
    }
}

package com.livestanding.dispatch;

import com.livestanding.snapshot.MatchSnapshot;

/**
 * Receives each snapshot released by the {@link DispatchQueue}.
 *
 * Calls never overlap: the next delivery starts only after this returns.
 */
@FunctionalInterface
public interface SnapshotHandler {

    void onSnapshot(MatchSnapshot snapshot, boolean reconnecting);
}

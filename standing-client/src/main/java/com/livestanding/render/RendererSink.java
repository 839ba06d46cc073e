package com.livestanding.render;

import com.livestanding.reconcile.ReconcileResult;

/**
 * Consumer of reconciliation output. Owns every presentation concern
 * (layout, easing, overlay timing); receives one call per delivered snapshot.
 */
@FunctionalInterface
public interface RendererSink {

    void apply(ReconcileResult result);
}

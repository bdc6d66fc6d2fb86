package com.mediasync.common.refresh.queue;

import java.util.List;

@FunctionalInterface
public interface RefreshSink<E extends RefreshTarget, T> {

    /**
     * Synchronizes one batch of distinct items with the target. Failures are thrown to the drain caller.
     */
    void refresh(List<T> batch, E target);
}

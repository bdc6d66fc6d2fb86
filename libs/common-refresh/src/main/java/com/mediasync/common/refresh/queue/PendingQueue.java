package com.mediasync.common.refresh.queue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending items of one endpoint, deduplicated by item identity, plus the draining flag.
 * Not thread-safe: every access happens under the owning queue's lock.
 */
public final class PendingQueue<T> {

    private final Map<Object, T> pending = new HashMap<>();
    private boolean draining;

    void upsert(Object id, T item) {
        pending.put(id, item);
    }

    List<T> takeAll() {
        List<T> batch = new ArrayList<>(pending.values());
        pending.clear();
        return batch;
    }

    boolean isEmpty() {
        return pending.isEmpty();
    }

    int size() {
        return pending.size();
    }

    boolean isDraining() {
        return draining;
    }

    void setDraining(boolean draining) {
        this.draining = draining;
    }
}

package com.mediasync.common.refresh.queue;

/**
 * An endpoint that pending changes are refreshed against.
 */
public interface RefreshTarget {

    /**
     * Identity that partitions queue state. Targets sharing a key share one queue.
     */
    String key();

    /**
     * Read on every enqueue and on every drain iteration.
     */
    boolean refreshEnabled();
}

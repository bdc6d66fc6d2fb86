package com.mediasync.common.refresh.queue;

import com.mediasync.common.refresh.store.ExpiringKeyedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Coalesces item changes per endpoint and hands them to a {@link RefreshSink} in batches,
 * with at most one drain in flight per endpoint key.
 *
 * <p>{@link #enqueue} is cheap and never waits on the sink. {@link #drain} is meant to be
 * called periodically; it keeps draining until no new item arrived during the last sink call.
 */
public class CoalescingRefreshQueue<E extends RefreshTarget, T> {

    private static final Logger log = LoggerFactory.getLogger(CoalescingRefreshQueue.class);

    private final String name;
    private final ExpiringKeyedStore<String, PendingQueue<T>> store;
    private final Function<? super T, ?> identity;
    private final RefreshSink<E, T> sink;
    private final Duration idleTtl;

    // guards pending and draining of every record in the store
    private final ReentrantLock lock = new ReentrantLock();

    public CoalescingRefreshQueue(String name,
                                  ExpiringKeyedStore<String, PendingQueue<T>> store,
                                  Function<? super T, ?> identity,
                                  RefreshSink<E, T> sink,
                                  Duration idleTtl) {
        this.name = name;
        this.store = store;
        this.identity = identity;
        this.sink = sink;
        this.idleTtl = idleTtl;
    }

    public void enqueue(E target, T item) {
        if (!target.refreshEnabled()) {
            return;
        }
        Object id = Objects.requireNonNull(identity.apply(item), "item identity");

        lock.lock();
        try {
            PendingQueue<T> queue = store.getOrCreate(target.key(), PendingQueue::new, idleTtl);
            queue.upsert(id, item);
        } finally {
            lock.unlock();
        }
    }

    public DrainResult drain(E target) {
        String key = target.key();
        PendingQueue<T> queue = null;
        boolean claimed = false;
        int batches = 0;
        int items = 0;
        int discarded = 0;
        try {
            lock.lock();
            try {
                queue = store.find(key).orElse(null);
                if (queue == null) {
                    return DrainResult.noQueue();
                }
                if (queue.isDraining()) {
                    log.debug("Drain already in progress queue={} key={}", name, key);
                    return DrainResult.busy();
                }
                queue.setDraining(true);
                claimed = true;
                store.put(key, queue, idleTtl);
            } finally {
                lock.unlock();
            }

            while (true) {
                List<T> batch;
                lock.lock();
                try {
                    if (queue.isEmpty()) {
                        return DrainResult.drained(batches, items, discarded);
                    }
                    batch = queue.takeAll();
                } finally {
                    lock.unlock();
                }

                if (target.refreshEnabled()) {
                    sink.refresh(batch, target);
                    batches++;
                    items += batch.size();
                    log.debug("Refreshed batch queue={} key={} size={}", name, key, batch.size());
                } else {
                    discarded += batch.size();
                    log.debug("Refresh disabled, discarded batch queue={} key={} size={}", name, key, batch.size());
                }
            }
        } finally {
            // only the record claimed above, even if the key now maps to a newer record
            if (claimed) {
                lock.lock();
                try {
                    queue.setDraining(false);
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    public int pendingCount(E target) {
        lock.lock();
        try {
            return store.find(target.key()).map(PendingQueue::size).orElse(0);
        } finally {
            lock.unlock();
        }
    }

    public boolean isDraining(E target) {
        lock.lock();
        try {
            return store.find(target.key()).map(PendingQueue::isDraining).orElse(false);
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }
}

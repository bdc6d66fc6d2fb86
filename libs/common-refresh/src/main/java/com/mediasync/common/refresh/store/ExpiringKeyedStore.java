package com.mediasync.common.refresh.store;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Key/value storage where every entry expires once it has not been written for its ttl.
 * Reads never extend an entry's lifetime.
 */
public interface ExpiringKeyedStore<K, V> {

    /**
     * Returns the live value for {@code key}, or stores and returns a new one from {@code factory}.
     * Concurrent callers racing on the same key observe a single created value.
     */
    V getOrCreate(K key, Supplier<? extends V> factory, Duration ttl);

    Optional<V> find(K key);

    /**
     * Inserts or replaces the value, restarting its ttl.
     */
    void put(K key, V value, Duration ttl);

    Set<K> keys();

    long size();
}

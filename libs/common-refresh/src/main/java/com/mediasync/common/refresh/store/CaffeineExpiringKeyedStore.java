package com.mediasync.common.refresh.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public class CaffeineExpiringKeyedStore<K, V> implements ExpiringKeyedStore<K, V> {

    private final Cache<K, Expiring<V>> cache;

    public CaffeineExpiringKeyedStore(Caffeine<Object, Object> builder) {
        this.cache = builder.expireAfter(new WriteExpiry<K, V>()).build();
    }

    @Override
    public V getOrCreate(K key, Supplier<? extends V> factory, Duration ttl) {
        requirePositive(ttl);
        Expiring<V> entry = cache.get(key, k -> new Expiring<>(Objects.requireNonNull(factory.get(), "created value"), ttl));
        return entry.value();
    }

    @Override
    public Optional<V> find(K key) {
        Expiring<V> entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        requirePositive(ttl);
        cache.put(key, new Expiring<>(Objects.requireNonNull(value, "value"), ttl));
    }

    @Override
    public Set<K> keys() {
        return Set.copyOf(cache.asMap().keySet());
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    public void cleanUp() {
        cache.cleanUp();
    }

    public Cache<K, ?> nativeCache() {
        return cache;
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    private record Expiring<V>(V value, Duration ttl) {
    }

    // writes restart the clock with the ttl carried by the new entry, reads keep it running
    private static final class WriteExpiry<K, V> implements Expiry<K, Expiring<V>> {

        @Override
        public long expireAfterCreate(K key, Expiring<V> value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(K key, Expiring<V> value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(K key, Expiring<V> value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

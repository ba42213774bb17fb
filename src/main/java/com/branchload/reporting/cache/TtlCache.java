package com.branchload.reporting.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Key/value cache whose entries expire after a time-to-live.
 */
public interface TtlCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value, Duration ttl);

    void put(K key, V value);

    void invalidate(K key);

    void invalidateAll();

    /**
     * Cached value, or the loader's result stored under the default TTL. Null results are not cached.
     */
    default V getOrLoad(K key, Supplier<V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V loaded = loader.get();
        if (loaded != null) {
            put(key, loaded);
        }
        return loaded;
    }
}

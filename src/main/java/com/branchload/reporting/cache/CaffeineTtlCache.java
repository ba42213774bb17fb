package com.branchload.reporting.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed {@link TtlCache}
 *
 * Each entry carries its own time-to-live through a variable {@link Expiry}; time is read
 * from the injected clock so expiry follows the application's notion of now. Maintenance
 * runs on the calling thread.
 */
@Slf4j
public class CaffeineTtlCache<K, V> implements TtlCache<K, V> {

    private record Entry<V>(V value, Duration ttl) {
    }

    private final Duration defaultTtl;
    private final Cache<K, Entry<V>> cache;

    public CaffeineTtlCache(String name, Clock clock, Duration defaultTtl, long maximumSize) {
        Objects.requireNonNull(clock, "clock");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry<K, V>())
                .ticker(() -> clock.millis() * 1_000_000L)
                .executor(Runnable::run)
                .removalListener((K key, Entry<V> entry, RemovalCause cause) ->
                        log.debug("Cache {}: entry {} removed ({})", name, key, cause))
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        Entry<V> entry = cache.getIfPresent(key);
        return entry != null ? Optional.of(entry.value()) : Optional.empty();
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        cache.put(key, new Entry<>(value, Objects.requireNonNull(ttl, "ttl")));
    }

    @Override
    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * Entry count after pending maintenance has evicted expired entries.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class EntryExpiry<K, V> implements Expiry<K, Entry<V>> {

        @Override
        public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

package com.tennis.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Time-bounded cache owned by a single component instance.
 * All access goes through one lock, so a read-through computation and the store that
 * follows it are atomic.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class TtlCache<K, V> {

    private final Map<K, CacheEntry<V>> entries = new HashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private long hits;
    private long misses;

    public TtlCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be zero or positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public TtlCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    /**
     * Returns the live entry for the key, computing and storing it when absent or expired.
     */
    public synchronized V getOrCompute(K key, Supplier<V> loader) {
        Instant now = clock.instant();
        CacheEntry<V> entry = entries.get(key);
        if (entry != null && now.isBefore(entry.expiresAt())) {
            hits++;
            return entry.value();
        }
        misses++;
        V value = loader.get();
        entries.put(key, new CacheEntry<>(value, now.plus(ttl)));
        return value;
    }

    /**
     * Live entry or null.
     */
    public synchronized V get(K key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) return null;
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            return null;
        }
        return entry.value();
    }

    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    /**
     * Drops expired entries.
     */
    public synchronized void prune() {
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), hits, misses, ttl.toSeconds());
    }

    private record CacheEntry<V>(V value, Instant expiresAt) {
    }
}

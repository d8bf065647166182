package org.qbitspark.filevaultbackend.globe_utils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Small in-process cache with a per-entry time-to-live and a hard cap on entries.
 * Expired entries are dropped on read and by {@link #evictExpired()}.
 */
public class TtlCache<K, V> {

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final ConcurrentHashMap<K, Entry<V>> store = new ConcurrentHashMap<>();

    public TtlCache(Duration ttl, int maxEntries, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache must allow at least one entry");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public Optional<V> get(K key) {
        Entry<V> entry = store.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    public void put(K key, V value) {
        if (!store.containsKey(key) && store.size() >= maxEntries) {
            evictExpired();
            if (store.size() >= maxEntries) {
                evictOldest();
            }
        }
        store.put(key, new Entry<>(value, clock.instant().plus(ttl)));
    }

    public V getOrCompute(K key, Supplier<V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = loader.get();
        put(key, value);
        return value;
    }

    public void invalidate(K key) {
        store.remove(key);
    }

    public void invalidateAll() {
        store.clear();
    }

    /**
     * @return number of entries removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<K, Entry<V>> entry : store.entrySet()) {
            if (entry.getValue().isExpired(now) && store.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return store.size();
    }

    private void evictOldest() {
        store.entrySet().stream()
                .min((a, b) -> a.getValue().expiresAt.compareTo(b.getValue().expiresAt))
                .ifPresent(oldest -> store.remove(oldest.getKey(), oldest.getValue()));
    }

    private static final class Entry<V> {
        private final V value;
        private final Instant expiresAt;

        private Entry(V value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}

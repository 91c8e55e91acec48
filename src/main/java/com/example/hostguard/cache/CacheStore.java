package com.example.hostguard.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Generic TTL + LRU key/value store.
 *
 * The map is kept in access order, so its head is always the least recently
 * accessed entry and eviction at capacity is O(1). Expired entries are dropped
 * lazily on read and in bulk by {@link #cleanupExpired()}. Every operation
 * runs under one lock.
 */
@Slf4j
public class CacheStore {

    private final int maxEntries;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final CacheStats stats = new CacheStats();

    public CacheStore(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * @param category only entries of this category count as hits; null accepts any
     */
    public Optional<Object> get(String key, CacheCategory category) {
        lock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry entry = entries.get(key);
            if (entry == null || (category != null && entry.getCategory() != category)) {
                stats.recordMiss();
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                stats.recordExpirations(1);
                stats.recordMiss();
                return Optional.empty();
            }
            entry.recordAccess(now);
            stats.recordHit();
            return Optional.ofNullable(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, Object value, CacheCategory category, long ttlSeconds) {
        lock.lock();
        try {
            putLocked(key, value, category, ttlSeconds);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store the value unless a live entry already exists for the key.
     *
     * @return the value now cached under the key: the existing one if it was
     *         live, otherwise the given one
     */
    public Object putIfAbsent(String key, Object value, CacheCategory category, long ttlSeconds) {
        lock.lock();
        try {
            CacheEntry existing = entries.get(key);
            if (existing != null && !existing.isExpired(clock.instant()) && existing.getCategory() == category) {
                return existing.getValue();
            }
            putLocked(key, value, category, ttlSeconds);
            return value;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public int removeIf(Predicate<CacheEntry> predicate) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (predicate.test(it.next())) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of expired entries removed
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            stats.recordExpirations(removed);
            stats.recordCleanup();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    boolean containsKey(String key) {
        lock.lock();
        try {
            // containsKey does not touch access order
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public CacheStatsSnapshot snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Map<String, Integer> byCategory = new TreeMap<>();
            double totalRemaining = 0;
            for (CacheEntry entry : entries.values()) {
                byCategory.merge(entry.getCategory().getTag(), 1, Integer::sum);
                totalRemaining += entry.remaining(now).toMillis() / 1000.0;
            }
            double average = entries.isEmpty() ? 0.0 : Math.round(totalRemaining / entries.size() * 10) / 10.0;
            return new CacheStatsSnapshot(entries.size(), maxEntries, byCategory, average,
                    stats.getHits(), stats.getMisses(), stats.getEvictions(), stats.getExpirations(),
                    stats.getCleanups(), Math.round(stats.getHitRate() * 1000) / 1000.0);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        return stats;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private void putLocked(String key, Object value, CacheCategory category, long ttlSeconds) {
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            evictLeastRecentlyUsedLocked();
        }
        entries.put(key, new CacheEntry(key, value, category, clock.instant(), ttlSeconds));
    }

    private void evictLeastRecentlyUsedLocked() {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            String evicted = it.next().getKey();
            it.remove();
            stats.recordEviction();
            log.debug("Evicted least recently used cache entry {}", evicted);
        }
    }
}

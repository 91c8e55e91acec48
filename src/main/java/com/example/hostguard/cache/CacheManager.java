package com.example.hostguard.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Category-aware cache in front of scans and inventory searches.
 *
 * TTLs come from {@link CacheCategory}, replaced by configured overrides,
 * replaced in turn by an explicit TTL on {@link #set(String, Object, CacheCategory, long)}.
 * Host scan data is written through to an optional {@link DurableCacheBacking};
 * failures of that tier are logged and never reach the caller.
 */
@Slf4j
public class CacheManager {

    static final long NO_DATA_TTL_SECONDS = 60;

    /** Marks "the durable tier has nothing for this key" so repeated misses stay in memory */
    private static final Object NO_DATA = new Object() {
        @Override
        public String toString() {
            return "NO_DATA";
        }
    };

    private final CacheStore store;
    private final Map<CacheCategory, Long> ttls = new EnumMap<>(CacheCategory.class);
    private final Duration cleanupInterval;
    private final DurableCacheBacking durable;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService cleanupScheduler;

    /**
     * @param ttlOverrides seconds keyed by category tag; unknown tags are ignored
     * @param durable      may be null when persistence is disabled
     */
    public CacheManager(CacheStore store, Map<String, Long> ttlOverrides, Duration cleanupInterval,
                        DurableCacheBacking durable) {
        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("cleanupInterval must be positive, got " + cleanupInterval);
        }
        this.store = store;
        this.cleanupInterval = cleanupInterval;
        this.durable = durable;
        for (CacheCategory category : CacheCategory.values()) {
            ttls.put(category, category.getDefaultTtlSeconds());
        }
        ttlOverrides.forEach((tag, seconds) -> {
            if (seconds == null || seconds < 0) {
                throw new IllegalArgumentException("TTL override for " + tag + " must not be negative, got " + seconds);
            }
            CacheCategory.fromTag(tag).ifPresentOrElse(
                    category -> ttls.put(category, seconds),
                    () -> log.warn("Ignoring TTL override for unknown cache category '{}'", tag));
        });
    }

    public long ttlFor(CacheCategory category) {
        return ttls.get(category);
    }

    public Optional<Object> get(String key, CacheCategory category) {
        return store.get(key, category);
    }

    public void set(String key, Object value, CacheCategory category) {
        store.put(key, value, category, ttlFor(category));
    }

    public void set(String key, Object value, CacheCategory category, long ttlSeconds) {
        if (ttlSeconds < 0) {
            log.warn("Negative TTL {} for cache key {}, storing as already expired", ttlSeconds, key);
            ttlSeconds = 0;
        }
        store.put(key, value, category, ttlSeconds);
    }

    public boolean delete(String key) {
        return store.remove(key);
    }

    public void clear() {
        store.clear();
        log.info("Cache cleared");
    }

    public int clear(CacheCategory category) {
        int removed = store.removeIf(entry -> entry.getCategory() == category);
        log.info("Cleared {} cache entries in category {}", removed, category.getTag());
        return removed;
    }

    /**
     * Return the cached value or compute, store and return it. The factory
     * runs without holding the cache lock; if another thread stored a live
     * value meanwhile, that value wins. A null result is returned but not cached.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrSet(String key, CacheCategory category, Supplier<T> factory) {
        Optional<Object> cached = store.get(key, category);
        if (cached.isPresent()) {
            return (T) cached.get();
        }
        T value = factory.get();
        if (value == null) {
            return null;
        }
        return (T) store.putIfAbsent(key, value, category, ttlFor(category));
    }

    public CacheStatsSnapshot getStats() {
        return store.snapshot();
    }

    // ── Host helpers ──

    public void cacheHostData(String hostname, Map<String, Object> data, CacheCategory category) {
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        set(hostKey(hostname, category), copy, category);
        if (durable == null) return;
        try {
            durable.set(hostname, category, copy, ttlFor(category));
        } catch (RuntimeException e) {
            log.warn("Failed to persist {} data for {}: {}", category.getTag(), hostname, e.getMessage());
        }
    }

    /**
     * Memory first, then the durable tier. A durable miss is remembered for
     * {@value #NO_DATA_TTL_SECONDS}s so the store is not queried on every call.
     */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getHostData(String hostname, CacheCategory category) {
        String key = hostKey(hostname, category);
        Optional<Object> cached = store.get(key, category);
        if (cached.isPresent()) {
            return cached.get() == NO_DATA ? Optional.empty() : Optional.of((Map<String, Object>) cached.get());
        }
        if (durable == null) {
            return Optional.empty();
        }
        try {
            Optional<DurableCacheEntry> stored = durable.get(hostname, category);
            if (stored.isPresent()) {
                Map<String, Object> data = Collections.unmodifiableMap(stored.get().getData());
                // promoted entries keep the durable row's expiry, not a fresh category TTL
                long remaining = Math.min(stored.get().getRemainingTtlSeconds(), ttlFor(category));
                if (remaining > 0) {
                    set(key, data, category, remaining);
                }
                log.debug("Loaded {} data for {} from durable cache ({}s left)", category.getTag(), hostname, remaining);
                return Optional.of(data);
            }
            set(key, NO_DATA, category, NO_DATA_TTL_SECONDS);
        } catch (RuntimeException e) {
            log.warn("Failed to read durable cache for {}: {}", hostname, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Expired-but-retained data from the durable tier, for reporting what a
     * host looked like when a fresh scan fails.
     */
    public Optional<Map<String, Object>> getLastKnownHostData(String hostname, CacheCategory category) {
        if (durable == null) {
            return Optional.empty();
        }
        try {
            return durable.getLastKnown(hostname, category);
        } catch (RuntimeException e) {
            log.warn("Failed to read last known data for {}: {}", hostname, e.getMessage());
            return Optional.empty();
        }
    }

    public int invalidateHost(String hostname) {
        String prefix = "host:" + hostname.toLowerCase(Locale.ROOT) + ":";
        int removed = store.removeIf(entry -> entry.getKey().startsWith(prefix));
        if (durable != null) {
            try {
                removed += durable.clearHost(hostname);
            } catch (RuntimeException e) {
                log.warn("Failed to clear durable cache for {}: {}", hostname, e.getMessage());
            }
        }
        log.debug("Invalidated {} cached entries for {}", removed, hostname);
        return removed;
    }

    public void cacheInventorySearch(String query, List<?> results) {
        set(searchKey(query), List.copyOf(results), CacheCategory.INVENTORY_SEARCH);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<List<T>> getInventorySearch(String query) {
        return store.get(searchKey(query), CacheCategory.INVENTORY_SEARCH).map(value -> (List<T>) value);
    }

    // ── Background sweep ──

    public void startCleanup() {
        synchronized (lifecycleLock) {
            if (cleanupScheduler != null) return;
            cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "cache-cleanup");
                thread.setDaemon(true);
                return thread;
            });
            long millis = cleanupInterval.toMillis();
            cleanupScheduler.scheduleWithFixedDelay(this::runCleanup, millis, millis, TimeUnit.MILLISECONDS);
            log.info("Cache cleanup started (every {}s)", cleanupInterval.toSeconds());
        }
    }

    public void stopCleanup() {
        ScheduledExecutorService scheduler;
        synchronized (lifecycleLock) {
            scheduler = cleanupScheduler;
            cleanupScheduler = null;
        }
        if (scheduler == null) return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Cache cleanup stopped");
    }

    public boolean isCleanupRunning() {
        synchronized (lifecycleLock) {
            return cleanupScheduler != null;
        }
    }

    /**
     * One sweep: expired memory entries, then durable rows past retention.
     *
     * @return number of memory entries removed
     */
    public int runCleanup() {
        int removed = store.cleanupExpired();
        if (removed > 0) {
            log.debug("Cache cleanup removed {} expired entries", removed);
        }
        if (durable != null) {
            try {
                durable.purgeExpired();
            } catch (RuntimeException e) {
                log.warn("Durable cache purge failed: {}", e.getMessage());
            }
        }
        return removed;
    }

    static String hostKey(String hostname, CacheCategory category) {
        return "host:" + hostname.toLowerCase(Locale.ROOT) + ":" + category.getTag();
    }

    private static String searchKey(String query) {
        return "inventory_search:" + query.toLowerCase(Locale.ROOT);
    }
}

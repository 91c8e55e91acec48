package com.example.hostguard.cache;

import java.util.Map;
import java.util.Optional;

/**
 * Persistent second tier behind the in-memory cache for host scan data.
 * Implementations may throw on storage failure; {@link CacheManager} absorbs it.
 */
public interface DurableCacheBacking {

    /**
     * @return data stored for the host and category if it has not expired yet,
     *         with the time it has left
     */
    Optional<DurableCacheEntry> get(String hostname, CacheCategory category);

    /**
     * @return the most recent data for the host and category, expired or not,
     *         as long as the row has not been purged
     */
    Optional<Map<String, Object>> getLastKnown(String hostname, CacheCategory category);

    void set(String hostname, CacheCategory category, Map<String, Object> data, long ttlSeconds);

    int clearHost(String hostname);

    /**
     * @return number of rows past their retention window that were removed
     */
    int purgeExpired();
}

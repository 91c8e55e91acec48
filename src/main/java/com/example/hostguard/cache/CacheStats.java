package com.example.hostguard.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate cache counters.
 */
public class CacheStats {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong cleanups = new AtomicLong();

    void recordHit() { hits.incrementAndGet(); }

    void recordMiss() { misses.incrementAndGet(); }

    void recordEviction() { evictions.incrementAndGet(); }

    void recordExpirations(long count) { expirations.addAndGet(count); }

    void recordCleanup() { cleanups.incrementAndGet(); }

    public long getHits() { return hits.get(); }

    public long getMisses() { return misses.get(); }

    public long getEvictions() { return evictions.get(); }

    public long getExpirations() { return expirations.get(); }

    public long getCleanups() { return cleanups.get(); }

    public double getHitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total > 0 ? (double) h / total : 0.0;
    }
}

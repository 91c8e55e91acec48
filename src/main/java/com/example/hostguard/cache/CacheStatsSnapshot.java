package com.example.hostguard.cache;

import java.util.Map;

public record CacheStatsSnapshot(
        int entries,
        int maxEntries,
        Map<String, Integer> entriesByCategory,
        double averageTtlRemainingSeconds,
        long hits,
        long misses,
        long evictions,
        long expirations,
        long cleanups,
        double hitRate) {
}

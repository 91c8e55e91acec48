package com.example.hostguard.cache;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of cached data and their default time-to-live. Fast-changing facts
 * get seconds, identity facts get tens of minutes.
 */
public enum CacheCategory {
    LOCAL_CONTEXT("local_context", 43200),
    LOCAL_SERVICES("local_services", 3600),
    LOCAL_PROCESSES("local_processes", 300),

    HOST_BASIC("host_basic", 300),
    HOST_SYSTEM("host_system", 1800),
    HOST_SERVICES("host_services", 900),
    HOST_PACKAGES("host_packages", 3600),
    HOST_METRICS("host_metrics", 60),
    HOST_FULL("host_full", 600),

    INVENTORY_LIST("inventory_list", 300),
    INVENTORY_SEARCH("inventory_search", 120),
    RELATIONS("relations", 3600),

    DEFAULT("default", 300);

    private final String tag;
    private final long defaultTtlSeconds;

    CacheCategory(String tag, long defaultTtlSeconds) {
        this.tag = tag;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public String getTag() {
        return tag;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public static Optional<CacheCategory> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.tag.equals(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}

package com.example.hostguard.scan;

import com.example.hostguard.cache.CacheCategory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * What a scan collects. BASIC stops at name resolution and the reachability
 * probe; the others log in and run read-only inspection commands.
 */
public enum ScanCategory {
    BASIC(CacheCategory.HOST_BASIC, false),
    SYSTEM(CacheCategory.HOST_SYSTEM, true),
    SERVICES(CacheCategory.HOST_SERVICES, true),
    METRICS(CacheCategory.HOST_METRICS, true),
    FULL(CacheCategory.HOST_FULL, true);

    private final CacheCategory cacheCategory;
    private final boolean remoteInspection;

    ScanCategory(CacheCategory cacheCategory, boolean remoteInspection) {
        this.cacheCategory = cacheCategory;
        this.remoteInspection = remoteInspection;
    }

    public CacheCategory getCacheCategory() {
        return cacheCategory;
    }

    public boolean needsRemoteInspection() {
        return remoteInspection;
    }

    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ScanCategory> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(c -> c.name().equalsIgnoreCase(tag.trim()))
                .findFirst();
    }
}

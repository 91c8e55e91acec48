package com.example.hostguard.cache;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached value. An entry is expired once its age reaches its TTL, so a
 * zero TTL is stale the moment it is written.
 */
@Getter
public class CacheEntry {

    private final String key;
    private final Object value;
    private final CacheCategory category;
    private final Instant createdAt;
    private final long ttlSeconds;
    private long accessCount;
    private Instant lastAccessed;

    CacheEntry(String key, Object value, CacheCategory category, Instant createdAt, long ttlSeconds) {
        this.key = key;
        this.value = value;
        this.category = category;
        this.createdAt = createdAt;
        this.ttlSeconds = ttlSeconds;
        this.lastAccessed = createdAt;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public boolean isExpired(Instant now) {
        return age(now).compareTo(Duration.ofSeconds(ttlSeconds)) >= 0;
    }

    public Duration remaining(Instant now) {
        Duration left = Duration.ofSeconds(ttlSeconds).minus(age(now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    void recordAccess(Instant now) {
        accessCount++;
        lastAccessed = now;
    }
}

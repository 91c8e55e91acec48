package com.example.hostguard.cache;

import lombok.Value;

import java.util.Map;

/**
 * Unexpired data read from the durable tier, with the whole seconds left
 * before the row's own expiry.
 */
@Value
public class DurableCacheEntry {
    Map<String, Object> data;
    long remainingTtlSeconds;
}

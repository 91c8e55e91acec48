package com.example.hostguard.scan;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of scanning one host. Failures are values: a failed scan carries
 * the last error, the failure kind and how many retries were spent.
 */
@Value
@Builder(toBuilder = true)
public class ScanResult {

    String hostname;
    ScanCategory category;
    boolean success;
    @Builder.Default
    Map<String, Object> data = Map.of();
    String error;
    ScanFailure failure;
    long durationMs;
    int retries;
    Instant scannedAt;
    boolean fromCache;

    public static ScanResult cached(String hostname, ScanCategory category, Map<String, Object> data, Instant now) {
        return ScanResult.builder()
                .hostname(hostname)
                .category(category)
                .success(true)
                .data(data)
                .scannedAt(now)
                .fromCache(true)
                .build();
    }

    public static ScanResult failed(String hostname, ScanCategory category, ScanFailure failure,
                                    String error, int retries, long durationMs, Instant now) {
        return ScanResult.builder()
                .hostname(hostname)
                .category(category)
                .success(false)
                .failure(failure)
                .error(error)
                .durationMs(durationMs)
                .retries(retries)
                .scannedAt(now)
                .build();
    }

    /**
     * @return a copy with the given entry added to {@code data}
     */
    public ScanResult withData(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(data);
        merged.put(key, value);
        return toBuilder().data(Collections.unmodifiableMap(merged)).build();
    }
}

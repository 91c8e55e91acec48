package com.example.hostguard.scan;

/**
 * A host to scan. {@code knownAddress} comes from the inventory and is tried
 * before DNS; it may be null.
 */
public record ScanTarget(String hostname, String knownAddress) {

    public ScanTarget {
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname must not be blank");
        }
    }

    public static ScanTarget of(String hostname) {
        return new ScanTarget(hostname, null);
    }
}

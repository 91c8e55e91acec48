package com.example.hostguard.registry;

/**
 * A known hostname close to an unknown query, with its similarity in [0, 1].
 */
public record HostSuggestion(String hostname, double score) {
}

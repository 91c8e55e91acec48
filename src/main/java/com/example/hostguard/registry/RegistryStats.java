package com.example.hostguard.registry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RegistryStats(
        int totalHosts,
        int totalAliases,
        List<String> loadedSources,
        Map<String, Integer> byEnvironment,
        Map<String, Integer> bySource,
        Instant lastRefresh) {
}

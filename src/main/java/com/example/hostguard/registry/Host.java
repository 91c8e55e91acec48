package com.example.hostguard.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A host known to the registry. Keyed by {@link #key()}; mutated only through
 * {@link #merge(Host)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Host {

    private String hostname;

    private String ipAddress;

    @Builder.Default
    private Set<String> aliases = new LinkedHashSet<>();

    @Builder.Default
    private HostSource source = HostSource.MANUAL;

    /** production, staging, development, or whatever the source says */
    private String environment;

    @Builder.Default
    private Set<String> groups = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    private Instant lastSeen;

    /** null until a probe has said otherwise */
    private Boolean accessible;

    public String key() {
        return hostname.toLowerCase(Locale.ROOT);
    }

    /**
     * Fold another record for the same key into this one. Aliases and groups
     * union, metadata overlays with the incoming value winning, IP and
     * environment are only filled when unset.
     */
    public Host merge(Host other) {
        aliases.addAll(other.getAliases());
        groups.addAll(other.getGroups());
        metadata.putAll(other.getMetadata());
        if (ipAddress == null && other.getIpAddress() != null) {
            ipAddress = other.getIpAddress();
        }
        if (environment == null && other.getEnvironment() != null) {
            environment = other.getEnvironment();
        }
        if (other.getLastSeen() != null && (lastSeen == null || other.getLastSeen().isAfter(lastSeen))) {
            lastSeen = other.getLastSeen();
        }
        if (accessible == null && other.getAccessible() != null) {
            accessible = other.getAccessible();
        }
        return this;
    }

    public Host copy() {
        return Host.builder()
                .hostname(hostname)
                .ipAddress(ipAddress)
                .aliases(new LinkedHashSet<>(aliases))
                .source(source)
                .environment(environment)
                .groups(new LinkedHashSet<>(groups))
                .metadata(new LinkedHashMap<>(metadata))
                .lastSeen(lastSeen)
                .accessible(accessible)
                .build();
    }
}

package com.example.hostguard.registry;

import com.example.hostguard.registry.source.InventorySource;
import com.example.hostguard.registry.source.RawHostRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Single source of truth for which hosts exist.
 *
 * Only hosts registered here are valid targets. A name the agent made up
 * resolves to an invalid {@link HostValidationResult} with the closest real
 * hostnames as suggestions, never to a host.
 *
 * Reads share a read lock; merges during load take the write lock.
 */
@Slf4j
public class HostRegistry {

    static final double SUGGESTION_THRESHOLD = 0.4;
    static final int MAX_SUGGESTIONS = 5;

    private static final Set<String> LOCAL_NAMES = Set.of("local", "localhost", "127.0.0.1", "::1");

    private final List<InventorySource> sources;
    private final Duration reloadTtl;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Host> hosts = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final Set<String> loadedSources = new LinkedHashSet<>();
    private Instant lastRefresh;

    public HostRegistry(List<InventorySource> sources, Duration reloadTtl, Clock clock) {
        if (reloadTtl.isNegative()) {
            throw new IllegalArgumentException("reloadTtl must not be negative, got " + reloadTtl);
        }
        this.sources = List.copyOf(sources);
        this.reloadTtl = reloadTtl;
        this.clock = clock;
    }

    /**
     * Load hosts from every configured source.
     *
     * @param force reload even if the last refresh is inside the reload window
     * @return number of hosts in the registry afterwards
     */
    public int loadAllSources(boolean force) {
        lock.readLock().lock();
        try {
            if (!force && lastRefresh != null
                    && Duration.between(lastRefresh, clock.instant()).compareTo(reloadTtl) < 0) {
                log.debug("Host registry still fresh, skipping reload");
                return hosts.size();
            }
        } finally {
            lock.readLock().unlock();
        }

        // parse outside the lock, sources may do I/O
        Map<InventorySource, List<RawHostRecord>> parsed = new LinkedHashMap<>();
        for (InventorySource source : sources) {
            try {
                parsed.put(source, source.parse());
            } catch (RuntimeException e) {
                log.warn("Inventory source {} failed, skipping: {}", source.name(), e.getMessage());
            }
        }

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            parsed.forEach((source, records) -> {
                int registered = 0;
                for (RawHostRecord record : records) {
                    if (record.getName() == null || record.getName().isBlank()) continue;
                    registerLocked(toHost(record, source, now));
                    registered++;
                }
                if (registered > 0) {
                    loadedSources.add(source.name());
                }
            });
            lastRefresh = now;
            log.info("Host registry loaded: {} hosts from {} sources", hosts.size(), loadedSources.size());
            return hosts.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Validate a hostname the agent wants to act on. Never throws; an unknown
     * host is a normal, invalid result.
     */
    public HostValidationResult validate(String query) {
        if (query == null || query.isBlank()) {
            return HostValidationResult.invalid(query == null ? "" : query, List.of(), "Empty hostname provided");
        }
        String trimmed = query.trim();
        String key = trimmed.toLowerCase(Locale.ROOT);
        if (LOCAL_NAMES.contains(key)) {
            return HostValidationResult.valid(localhost(), query);
        }

        if (isEmpty()) {
            loadAllSources(false);
        }

        lock.readLock().lock();
        try {
            Host host = hosts.get(key);
            if (host == null) {
                String canonical = aliases.get(key);
                host = canonical != null ? hosts.get(canonical) : null;
            }
            if (host != null) {
                return HostValidationResult.valid(host.copy(), query);
            }
            List<HostSuggestion> suggestions = findSimilarLocked(key);
            log.debug("Rejected unknown host '{}' ({} suggestions)", query, suggestions.size());
            return HostValidationResult.invalid(query, suggestions,
                    String.format("Host '%s' not found in inventory", query));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Host> get(String query) {
        HostValidationResult result = validate(query);
        return result.isValid() ? Optional.of(result.getHost()) : Optional.empty();
    }

    /**
     * Strict lookup for paths that must not continue with an unknown host.
     *
     * @throws InvalidTargetException carrying the suggestions
     */
    public Host require(String query) {
        HostValidationResult result = validate(query);
        if (!result.isValid()) {
            throw new InvalidTargetException(result);
        }
        return result.getHost();
    }

    public List<Host> filter(HostFilter filter) {
        var predicate = filter.toPredicate();
        lock.readLock().lock();
        try {
            return hosts.values().stream()
                    .filter(predicate)
                    .sorted(Comparator.comparing(Host::key))
                    .map(Host::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Operator override: declare a host real. Merges like any other record, so
     * it fills an IP that no source provided but never replaces one.
     */
    public Host registerManualHost(String hostname, String ipAddress, String environment) {
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname must not be blank");
        }
        Host host = Host.builder()
                .hostname(hostname.trim())
                .ipAddress(ipAddress)
                .environment(environment)
                .source(HostSource.MANUAL)
                .lastSeen(clock.instant())
                .build();
        lock.writeLock().lock();
        try {
            Host merged = registerLocked(host);
            log.info("Manually registered host: {}", hostname);
            return merged.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RegistryStats getStats() {
        lock.readLock().lock();
        try {
            Map<String, Integer> byEnvironment = new TreeMap<>();
            Map<String, Integer> bySource = new TreeMap<>();
            for (Host host : hosts.values()) {
                byEnvironment.merge(host.getEnvironment() != null ? host.getEnvironment() : "unknown", 1, Integer::sum);
                bySource.merge(host.getSource().getTag(), 1, Integer::sum);
            }
            return new RegistryStats(hosts.size(), aliases.size(), List.copyOf(loadedSources),
                    byEnvironment, bySource, lastRefresh);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> hostnames() {
        lock.readLock().lock();
        try {
            return hosts.values().stream().map(Host::getHostname).sorted().collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return hosts.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop every host and alias. The only way stale entries leave the registry.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            hosts.clear();
            aliases.clear();
            loadedSources.clear();
            lastRefresh = null;
            log.info("Host registry reset");
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Host registerLocked(Host host) {
        String key = host.key();
        Host existing = hosts.get(key);
        Host merged;
        if (existing != null) {
            merged = existing.merge(host);
        } else {
            merged = host.copy();
            hosts.put(key, merged);
            // a canonical name beats an alias that happened to claim it first
            aliases.remove(key);
        }
        for (String alias : host.getAliases()) {
            String aliasKey = alias.toLowerCase(Locale.ROOT);
            if (aliasKey.equals(key) || hosts.containsKey(aliasKey)) continue;
            String owner = aliases.putIfAbsent(aliasKey, key);
            if (owner != null && !owner.equals(key)) {
                log.warn("Alias '{}' of {} already points to {}, ignoring", alias, key, owner);
            }
        }
        return merged;
    }

    private List<HostSuggestion> findSimilarLocked(String query) {
        List<HostSuggestion> matches = new ArrayList<>();
        for (Host host : hosts.values()) {
            double score = StringSimilarity.ratio(query, host.key());
            for (String alias : host.getAliases()) {
                score = Math.max(score, StringSimilarity.ratio(query, alias.toLowerCase(Locale.ROOT)));
            }
            if (score > SUGGESTION_THRESHOLD) {
                matches.add(new HostSuggestion(host.getHostname(), score));
            }
        }
        matches.sort(Comparator.comparingDouble(HostSuggestion::score).reversed()
                .thenComparing(HostSuggestion::hostname));
        return matches.size() > MAX_SUGGESTIONS ? new ArrayList<>(matches.subList(0, MAX_SUGGESTIONS)) : matches;
    }

    private static Host toHost(RawHostRecord record, InventorySource source, Instant now) {
        return Host.builder()
                .hostname(record.getName().trim())
                .ipAddress(record.getAddress())
                .aliases(new LinkedHashSet<>(record.getAliases()))
                .groups(new LinkedHashSet<>(record.getGroups()))
                .environment(record.getEnvironment())
                .metadata(new LinkedHashMap<>(record.getMetadata()))
                .source(source.type())
                .lastSeen(now)
                .build();
    }

    private static Host localhost() {
        return Host.builder()
                .hostname("localhost")
                .ipAddress("127.0.0.1")
                .source(HostSource.MANUAL)
                .metadata(new LinkedHashMap<>(Map.of("local", "true")))
                .accessible(true)
                .build();
    }
}

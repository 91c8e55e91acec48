package com.example.hostguard.service;

import com.example.hostguard.cache.CacheCategory;
import com.example.hostguard.cache.CacheManager;
import com.example.hostguard.registry.Host;
import com.example.hostguard.registry.HostFilter;
import com.example.hostguard.registry.HostRegistry;
import com.example.hostguard.registry.HostValidationResult;
import com.example.hostguard.scan.ProgressListener;
import com.example.hostguard.scan.ScanCategory;
import com.example.hostguard.scan.ScanOrchestrator;
import com.example.hostguard.scan.ScanResult;
import com.example.hostguard.scan.ScanTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for the agent layer: validate, maybe scan, serve from cache.
 *
 * A name that fails validation is reported back with suggestions and never
 * reaches the scanner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HostIntelligenceService {

    private final HostRegistry registry;
    private final ScanOrchestrator scanOrchestrator;
    private final CacheManager cacheManager;

    @EventListener(ApplicationReadyEvent.class)
    public void loadInventory() {
        int count = registry.loadAllSources(false);
        log.info("Host inventory ready: {} hosts", count);
    }

    public int reloadInventory(boolean force) {
        int count = registry.loadAllSources(force);
        cacheManager.clear(CacheCategory.INVENTORY_SEARCH);
        return count;
    }

    public HostValidationResult validateTarget(String query) {
        return registry.validate(query);
    }

    public Host registerManualHost(String hostname, String ipAddress, String environment) {
        Host host = registry.registerManualHost(hostname, ipAddress, environment);
        cacheManager.clear(CacheCategory.INVENTORY_SEARCH);
        return host;
    }

    public TargetScanReport scanTarget(String query, ScanCategory category, boolean force) {
        HostValidationResult validation = registry.validate(query);
        if (!validation.isValid()) {
            log.info("Refusing to scan unknown host '{}'", query);
            return TargetScanReport.rejected(query, validation);
        }
        ScanResult scan = scanOrchestrator.scanHost(toTarget(validation.getHost()), category, force);
        return TargetScanReport.builder().query(query).validation(validation).scan(scan).build();
    }

    /**
     * Batch variant of {@link #scanTarget}. Reports come back in input order;
     * the listener only sees the targets that passed validation.
     */
    public List<TargetScanReport> scanTargets(List<String> queries, ScanCategory category, boolean force,
                                              ProgressListener listener) {
        List<HostValidationResult> validations = queries.stream()
                .map(registry::validate)
                .collect(Collectors.toList());
        List<ScanTarget> targets = validations.stream()
                .filter(HostValidationResult::isValid)
                .map(v -> toTarget(v.getHost()))
                .collect(Collectors.toList());

        List<ScanResult> scans = targets.isEmpty()
                ? List.of()
                : scanOrchestrator.scanHosts(targets, category, force, listener);

        List<TargetScanReport> reports = new ArrayList<>(queries.size());
        int next = 0;
        for (int i = 0; i < queries.size(); i++) {
            HostValidationResult validation = validations.get(i);
            if (validation.isValid()) {
                reports.add(TargetScanReport.builder()
                        .query(queries.get(i))
                        .validation(validation)
                        .scan(scans.get(next++))
                        .build());
            } else {
                reports.add(TargetScanReport.rejected(queries.get(i), validation));
            }
        }
        return reports;
    }

    public List<Host> searchHosts(HostFilter filter) {
        String key = filter.cacheKey();
        Optional<List<Host>> cached = cacheManager.getInventorySearch(key);
        if (cached.isPresent()) {
            return cached.get().stream().map(Host::copy).collect(Collectors.toList());
        }
        List<Host> hosts = registry.filter(filter);
        cacheManager.cacheInventorySearch(key, hosts);
        return hosts.stream().map(Host::copy).collect(Collectors.toList());
    }

    private static ScanTarget toTarget(Host host) {
        return new ScanTarget(host.getHostname(), host.getIpAddress());
    }
}

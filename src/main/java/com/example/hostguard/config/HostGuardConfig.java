package com.example.hostguard.config;

import com.example.hostguard.cache.CacheManager;
import com.example.hostguard.cache.CacheStore;
import com.example.hostguard.cache.DurableCacheBacking;
import com.example.hostguard.cache.JpaDurableCacheBacking;
import com.example.hostguard.registry.HostRegistry;
import com.example.hostguard.registry.source.InventorySourceFactory;
import com.example.hostguard.repository.ScanCacheRecordRepository;
import com.example.hostguard.scan.AddressResolver;
import com.example.hostguard.scan.ConnectivityProbe;
import com.example.hostguard.scan.DnsAddressResolver;
import com.example.hostguard.scan.HostInspector;
import com.example.hostguard.scan.JschRemoteExecutor;
import com.example.hostguard.scan.RateLimiter;
import com.example.hostguard.scan.RemoteExecutor;
import com.example.hostguard.scan.ScanOrchestrator;
import com.example.hostguard.scan.TcpConnectivityProbe;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * One instance per process of every stateful engine component. The rate
 * limiter in particular must be shared by all scans or the limit means nothing.
 */
@Configuration
public class HostGuardConfig {

    @Bean
    public HostRegistry hostRegistry(InventorySourceFactory sourceFactory, HostGuardProperties properties, Clock clock) {
        return new HostRegistry(sourceFactory.createSources(),
                Duration.ofMinutes(properties.getRegistry().getCacheTtlMinutes()), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "host-guard.cache", name = "persistence-enabled", havingValue = "true", matchIfMissing = true)
    public DurableCacheBacking durableCacheBacking(ScanCacheRecordRepository repository, ObjectMapper objectMapper,
                                                   HostGuardProperties properties, Clock clock) {
        return new JpaDurableCacheBacking(repository, objectMapper, clock, properties.getCache().getStaleMultiplier());
    }

    @Bean(initMethod = "startCleanup", destroyMethod = "stopCleanup")
    public CacheManager cacheManager(HostGuardProperties properties, Clock clock,
                                     ObjectProvider<DurableCacheBacking> durableBacking) {
        HostGuardProperties.CacheConfig cache = properties.getCache();
        return new CacheManager(new CacheStore(cache.getMaxEntries(), clock), cache.getTtlOverrides(),
                Duration.ofSeconds(cache.getCleanupIntervalSeconds()), durableBacking.getIfAvailable());
    }

    @Bean
    public RateLimiter scanRateLimiter(HostGuardProperties properties) {
        HostGuardProperties.ScanConfig scan = properties.getScan();
        return new RateLimiter(scan.getRequestsPerSecond(), scan.getBurstSize());
    }

    @Bean
    public AddressResolver addressResolver() {
        return new DnsAddressResolver(Duration.ofSeconds(30));
    }

    @Bean
    public ConnectivityProbe connectivityProbe() {
        return new TcpConnectivityProbe();
    }

    @Bean
    public RemoteExecutor remoteExecutor(HostGuardProperties properties) {
        HostGuardProperties.SshConfig ssh = properties.getSsh();
        return new JschRemoteExecutor(ssh.getUser(), ssh.getKeyPath(), ssh.getKnownHostsPath(),
                properties.getScan().getManagementPort(),
                Duration.ofMillis(properties.getScan().getConnectTimeoutMs()),
                JschRemoteExecutor.HostKeyPolicy.parse(ssh.getHostKeyPolicy()));
    }

    @Bean
    public HostInspector hostInspector(RemoteExecutor remoteExecutor, HostGuardProperties properties) {
        return new HostInspector(remoteExecutor, Duration.ofMillis(properties.getScan().getCommandTimeoutMs()));
    }

    @Bean
    public ScanOrchestrator scanOrchestrator(RateLimiter rateLimiter, CacheManager cacheManager,
                                             AddressResolver addressResolver, ConnectivityProbe connectivityProbe,
                                             HostInspector hostInspector, HostGuardProperties properties,
                                             @Qualifier("scanExecutor") Executor scanExecutor,
                                             MeterRegistry meterRegistry, Clock clock) {
        return new ScanOrchestrator(rateLimiter, cacheManager, addressResolver, connectivityProbe, hostInspector,
                properties.getScan(), scanExecutor, meterRegistry, clock);
    }
}

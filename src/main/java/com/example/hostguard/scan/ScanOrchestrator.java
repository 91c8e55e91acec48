package com.example.hostguard.scan;

import com.example.hostguard.cache.CacheManager;
import com.example.hostguard.config.HostGuardProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Refreshes host facts without overloading the network or the caller.
 *
 * Per host: cache check, resolve, one rate-limit token, TCP probe on the
 * management port, optional remote inspection. Any step failure retries the
 * whole attempt with exponential backoff. Only successes are cached.
 *
 * Concurrent scans of the same host are serialized; the second caller
 * usually finds the first caller's result in the cache.
 */
@Slf4j
public class ScanOrchestrator {

    private final RateLimiter rateLimiter;
    private final CacheManager cacheManager;
    private final AddressResolver resolver;
    private final ConnectivityProbe probe;
    private final HostInspector inspector;
    private final BackoffPolicy backoff;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final int maxRetries;
    private final int batchSize;
    private final int managementPort;
    private final Duration connectTimeout;

    /** Weak values: a lock disappears once no scan of that host holds it */
    private final LoadingCache<String, ReentrantLock> hostLocks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public ScanOrchestrator(RateLimiter rateLimiter,
                            CacheManager cacheManager,
                            AddressResolver resolver,
                            ConnectivityProbe probe,
                            HostInspector inspector,
                            HostGuardProperties.ScanConfig config,
                            Executor executor,
                            MeterRegistry meterRegistry,
                            Clock clock) {
        if (config.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + config.getMaxRetries());
        }
        if (config.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + config.getBatchSize());
        }
        if (config.getConnectTimeoutMs() <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive, got " + config.getConnectTimeoutMs());
        }
        this.rateLimiter = rateLimiter;
        this.cacheManager = cacheManager;
        this.resolver = resolver;
        this.probe = probe;
        this.inspector = inspector;
        this.backoff = new BackoffPolicy(Duration.ofMillis(config.getRetryBaseDelayMs()),
                Duration.ofMillis(config.getRetryMaxDelayMs()));
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = config.getMaxRetries();
        this.batchSize = config.getBatchSize();
        this.managementPort = config.getManagementPort();
        this.connectTimeout = Duration.ofMillis(config.getConnectTimeoutMs());
    }

    public ScanResult scanHost(String hostname, ScanCategory category, boolean force) {
        return scanHost(ScanTarget.of(hostname), category, force);
    }

    /**
     * Scan one host. Never throws for scan failures; they come back as a
     * result with {@code success == false}.
     */
    public ScanResult scanHost(ScanTarget target, ScanCategory category, boolean force) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ReentrantLock hostLock = hostLocks.get(target.hostname().toLowerCase(Locale.ROOT));
        ScanResult result;
        hostLock.lock();
        try {
            Optional<ScanResult> cached = force ? Optional.empty() : fromCache(target, category);
            if (cached.isPresent()) {
                log.debug("Using cached {} scan for {}", category.getTag(), target.hostname());
                result = cached.get();
            } else {
                result = scanWithRetry(target, category);
                if (result.isSuccess()) {
                    cacheManager.cacheHostData(target.hostname(), result.getData(), category.getCacheCategory());
                }
            }
        } finally {
            hostLock.unlock();
        }
        recordMetrics(sample, result);
        return result;
    }

    public List<ScanResult> scanHostnames(List<String> hostnames, ScanCategory category, boolean force,
                                          ProgressListener listener) {
        return scanHosts(hostnames.stream().map(ScanTarget::of).collect(Collectors.toList()),
                category, force, listener);
    }

    /**
     * Scan many hosts, {@code batchSize} at a time. Cached hosts are reported
     * first. Results come back in input order; one host failing never affects
     * another.
     */
    public List<ScanResult> scanHosts(List<ScanTarget> targets, ScanCategory category, boolean force,
                                      ProgressListener listener) {
        int total = targets.size();
        ScanResult[] results = new ScanResult[total];
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        AtomicInteger completed = new AtomicInteger();
        Object progressLock = new Object();

        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            ScanTarget target = targets.get(i);
            Optional<ScanResult> cached = force ? Optional.empty() : fromCache(target, category);
            if (cached.isPresent()) {
                results[i] = cached.get();
                notifyProgress(progress, progressLock, completed, total, target.hostname());
            } else {
                pending.add(i);
            }
        }
        if (!pending.isEmpty()) {
            log.info("Scanning {} hosts ({} cached, category {})", pending.size(), total - pending.size(),
                    category.getTag());
        }

        for (int start = 0; start < pending.size(); start += batchSize) {
            List<Integer> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));
            List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
            for (int index : batch) {
                ScanTarget target = targets.get(index);
                Runnable task = () -> {
                    results[index] = scanHostSafely(target, category, force);
                    notifyProgress(progress, progressLock, completed, total, target.hostname());
                };
                futures.add(submit(task));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        }
        return Collections.unmodifiableList(Arrays.asList(results));
    }

    private CompletableFuture<Void> submit(Runnable task) {
        try {
            return CompletableFuture.runAsync(task, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Scan executor saturated, scanning on the calling thread");
            task.run();
            return CompletableFuture.completedFuture(null);
        }
    }

    private ScanResult scanHostSafely(ScanTarget target, ScanCategory category, boolean force) {
        try {
            return scanHost(target, category, force);
        } catch (RuntimeException e) {
            log.error("Unexpected failure scanning {}: {}", target.hostname(), e.getMessage(), e);
            return ScanResult.failed(target.hostname(), category, ScanFailure.RETRIES_EXHAUSTED,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), 0, 0, clock.instant());
        }
    }

    private static void notifyProgress(ProgressListener listener, Object lock, AtomicInteger completed, int total,
                                       String hostname) {
        synchronized (lock) {
            try {
                listener.onProgress(completed.incrementAndGet(), total, hostname);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for {}: {}", hostname, e.getMessage());
            }
        }
    }

    private Optional<ScanResult> fromCache(ScanTarget target, ScanCategory category) {
        return cacheManager.getHostData(target.hostname(), category.getCacheCategory())
                .map(data -> ScanResult.cached(target.hostname(), category, data, clock.instant()));
    }

    private ScanResult scanWithRetry(ScanTarget target, ScanCategory category) {
        String lastError = null;
        ScanFailure lastKind = ScanFailure.UNREACHABLE;
        long loopStart = System.nanoTime();

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    Duration delay = backoff.delayBefore(attempt);
                    log.debug("Retry {} for {} after {}ms: {}", attempt, target.hostname(), delay.toMillis(), lastError);
                    TimeUnit.MILLISECONDS.sleep(delay.toMillis());
                }
                rateLimiter.acquire();
                long start = System.nanoTime();
                Map<String, Object> data = performScan(target, category);
                return ScanResult.builder()
                        .hostname(target.hostname())
                        .category(category)
                        .success(true)
                        .data(data)
                        .durationMs(elapsedMillis(start))
                        .retries(attempt)
                        .scannedAt(clock.instant())
                        .build();
            } catch (ScanStepException e) {
                lastError = e.getMessage();
                lastKind = e.getKind();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Scan of {} interrupted", target.hostname());
                return ScanResult.failed(target.hostname(), category, lastKind, "Scan interrupted", attempt,
                        elapsedMillis(loopStart), clock.instant());
            }
        }

        log.warn("Scan of {} failed after {} retries: {}", target.hostname(), maxRetries, lastError);
        ScanResult failed = ScanResult.failed(target.hostname(), category, ScanFailure.RETRIES_EXHAUSTED,
                lastError, maxRetries, elapsedMillis(loopStart), clock.instant())
                .withData("last_failure", lastKind.name());
        Optional<Map<String, Object>> lastKnown =
                cacheManager.getLastKnownHostData(target.hostname(), category.getCacheCategory());
        return lastKnown.isPresent() ? failed.withData("last_known", lastKnown.get()) : failed;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private Map<String, Object> performScan(ScanTarget target, ScanCategory category) throws ScanStepException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("hostname", target.hostname());
        data.put("scan_type", category.getTag());
        data.put("scanned_at", clock.instant().toString());

        List<InetAddress> addresses = resolve(target);
        data.put("ip", addresses.get(0).getHostAddress());
        if (addresses.size() > 1) {
            data.put("all_ips", addresses.stream().map(InetAddress::getHostAddress).collect(Collectors.toList()));
        }

        InetAddress reachable = null;
        for (InetAddress address : addresses) {
            if (probe.isReachable(address, managementPort, connectTimeout)) {
                reachable = address;
                break;
            }
        }
        if (reachable == null) {
            throw new ScanStepException(ScanFailure.UNREACHABLE, String.format(
                    "Host %s not reachable on port %d", target.hostname(), managementPort));
        }
        data.put("reachable", true);
        data.put("reachable_address", reachable.getHostAddress());

        if (category.needsRemoteInspection()) {
            data.putAll(inspector.inspect(reachable.getHostAddress(), category));
        }
        return Collections.unmodifiableMap(data);
    }

    private List<InetAddress> resolve(ScanTarget target) throws ScanStepException {
        Set<InetAddress> addresses = new LinkedHashSet<>();
        if (target.knownAddress() != null && !target.knownAddress().isBlank()) {
            try {
                addresses.addAll(resolver.resolve(target.knownAddress()));
            } catch (UnknownHostException e) {
                log.debug("Inventory address {} of {} is not usable: {}", target.knownAddress(),
                        target.hostname(), e.getMessage());
            }
        }
        try {
            addresses.addAll(resolver.resolve(target.hostname()));
        } catch (UnknownHostException e) {
            if (addresses.isEmpty()) {
                throw new ScanStepException(ScanFailure.UNREACHABLE,
                        "Could not resolve " + target.hostname(), e);
            }
        }
        if (addresses.isEmpty()) {
            throw new ScanStepException(ScanFailure.UNREACHABLE, "No addresses for " + target.hostname());
        }
        return new ArrayList<>(addresses);
    }

    private void recordMetrics(Timer.Sample sample, ScanResult result) {
        String outcome = result.isFromCache() ? "cached" : result.isSuccess() ? "success" : "failure";
        sample.stop(Timer.builder("hostguard.scan.duration")
                .tag("category", result.getCategory().getTag())
                .tag("outcome", outcome)
                .register(meterRegistry));
        Counter.builder("hostguard.scan.total")
                .tag("category", result.getCategory().getTag())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}

package com.example.hostguard.cache;

import com.example.hostguard.domain.ScanCacheRecord;
import com.example.hostguard.repository.ScanCacheRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stores host scan data in the scan_cache_records table as JSON.
 * Rows expire after their TTL and are purged after TTL x staleMultiplier;
 * between the two they only serve {@link #getLastKnown}.
 */
@Slf4j
public class JpaDurableCacheBacking implements DurableCacheBacking {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ScanCacheRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final double staleMultiplier;

    public JpaDurableCacheBacking(ScanCacheRecordRepository repository, ObjectMapper objectMapper,
                                  Clock clock, double staleMultiplier) {
        if (staleMultiplier < 1.0) {
            throw new IllegalArgumentException("staleMultiplier must be at least 1.0, got " + staleMultiplier);
        }
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.staleMultiplier = staleMultiplier;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DurableCacheEntry> get(String hostname, CacheCategory category) {
        Instant now = clock.instant();
        return repository.findByHostnameAndCategory(normalize(hostname), category.getTag())
                .filter(record -> now.isBefore(record.getExpiresAt()))
                .map(record -> new DurableCacheEntry(readPayload(record),
                        Duration.between(now, record.getExpiresAt()).getSeconds()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Map<String, Object>> getLastKnown(String hostname, CacheCategory category) {
        Instant now = clock.instant();
        return repository.findByHostnameAndCategory(normalize(hostname), category.getTag())
                .filter(record -> now.isBefore(record.getPurgeAfter()))
                .map(this::readPayload);
    }

    @Override
    @Transactional
    public void set(String hostname, CacheCategory category, Map<String, Object> data, long ttlSeconds) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Scan data for " + hostname + " is not serializable", e);
        }
        Instant now = clock.instant();
        long retainMillis = (long) (ttlSeconds * 1000 * staleMultiplier);
        ScanCacheRecord record = repository.findByHostnameAndCategory(normalize(hostname), category.getTag())
                .orElseGet(() -> ScanCacheRecord.builder()
                        .hostname(normalize(hostname))
                        .category(category.getTag())
                        .build());
        record.setPayload(payload);
        record.setTtlSeconds(ttlSeconds);
        record.setCreatedAt(now);
        record.setExpiresAt(now.plusSeconds(ttlSeconds));
        record.setPurgeAfter(now.plus(Duration.ofMillis(retainMillis)));
        repository.save(record);
    }

    @Override
    @Transactional
    public int clearHost(String hostname) {
        return (int) repository.deleteByHostname(normalize(hostname));
    }

    @Override
    @Transactional
    public int purgeExpired() {
        int purged = (int) repository.deleteByPurgeAfterBefore(clock.instant());
        if (purged > 0) {
            log.debug("Purged {} durable scan cache rows", purged);
        }
        return purged;
    }

    private Map<String, Object> readPayload(ScanCacheRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt scan cache payload for " + record.getHostname()
                    + "/" + record.getCategory(), e);
        }
    }

    private static String normalize(String hostname) {
        return hostname.toLowerCase(Locale.ROOT);
    }
}

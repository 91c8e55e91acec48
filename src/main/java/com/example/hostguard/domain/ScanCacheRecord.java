package com.example.hostguard.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable copy of a successful host scan. One row per (hostname, category);
 * the payload column stores the scan data as a JSON object.
 */
@Entity
@Table(name = "scan_cache_records", indexes = {
        @Index(name = "idx_scan_cache_host_category", columnList = "hostname, category", unique = true),
        @Index(name = "idx_scan_cache_purge_after", columnList = "purge_after")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanCacheRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** Lowercased hostname */
    @Column(nullable = false)
    private String hostname;

    /** Cache category tag, e.g. "host_system" */
    @Column(nullable = false, length = 32)
    private String category;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "ttl_seconds", nullable = false)
    private long ttlSeconds;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    /** Rows past expiry are kept as last-known data until this instant */
    @Column(name = "purge_after", nullable = false)
    private Instant purgeAfter;
}

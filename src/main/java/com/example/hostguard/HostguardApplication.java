package com.example.hostguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Host Guard - trust and performance layer between an agent naming a host
 * and a command actually running on it.
 *
 * Architecture:
 * - Host Registry → single source of truth for which hosts exist, fed by inventory sources
 * - Scan Orchestrator → rate-limited, retrying, bounded-concurrency host fact refresh
 * - Cache Manager → category-aware TTL cache with LRU capacity and background sweep
 * - REST API → validate, scan and cache endpoints for the agent layer
 */
@SpringBootApplication
public class HostguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(HostguardApplication.class, args);
    }
}

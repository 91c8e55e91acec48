package com.example.hostguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for Host Guard.
 * Maps to the 'host-guard' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "host-guard")
public class HostGuardProperties {

    private RegistryConfig registry = new RegistryConfig();
    private ScanConfig scan = new ScanConfig();
    private CacheConfig cache = new CacheConfig();
    private SshConfig ssh = new SshConfig();

    @Data
    public static class RegistryConfig {
        /** Reload window: loadAllSources is a no-op inside it unless forced */
        private int cacheTtlMinutes = 15;
        private String etcHostsPath = "/etc/hosts";
        private String sshConfigPath = System.getProperty("user.home") + "/.ssh/config";
        private List<String> ansibleInventoryPaths = new ArrayList<>(List.of("/etc/ansible/hosts"));
        /** Extra JSON / YAML / CSV inventories */
        private List<String> inventoryPaths = new ArrayList<>();
        private CloudConfig cloud = new CloudConfig();

        @Data
        public static class CloudConfig {
            private boolean enabled = false;
            private String name = "cloud";
            private String endpoint = "";
            private String token = "";
            private int timeoutSeconds = 10;
        }
    }

    @Data
    public static class ScanConfig {
        private double requestsPerSecond = 5.0;
        private int burstSize = 10;
        private int maxRetries = 3;
        private long retryBaseDelayMs = 1000;
        private long retryMaxDelayMs = 30000;
        private int connectTimeoutMs = 10000;
        private int commandTimeoutMs = 60000;
        private int batchSize = 5;
        private int managementPort = 22;
        private int executorCorePoolSize = 5;
        private int executorMaxPoolSize = 20;
    }

    @Data
    public static class CacheConfig {
        /** Per-category TTL overrides in seconds, keyed by category tag (e.g. host_metrics) */
        private Map<String, Long> ttlOverrides = new HashMap<>();
        private int maxEntries = 1000;
        private int cleanupIntervalSeconds = 300;
        /** Durable rows are purged once older than ttl * staleMultiplier */
        private double staleMultiplier = 2.0;
        private boolean persistenceEnabled = true;
    }

    @Data
    public static class SshConfig {
        private String user = System.getProperty("user.name");
        private String keyPath = System.getProperty("user.home") + "/.ssh/id_rsa";
        private String knownHostsPath = System.getProperty("user.home") + "/.ssh/known_hosts";
        /** REJECT (default, strict known_hosts) or AUTO_ADD (testing only) */
        private String hostKeyPolicy = "REJECT";
    }
}

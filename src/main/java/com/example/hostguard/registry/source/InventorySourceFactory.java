package com.example.hostguard.registry.source;

import com.example.hostguard.config.HostGuardProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Builds the configured inventory sources. Format to parser dispatch goes
 * through a static table so every {@link InventoryFormat} has exactly one
 * parser.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventorySourceFactory {

    private static final Map<InventoryFormat, BiFunction<Path, ObjectMapper, InventorySource>> PARSERS;

    static {
        Map<InventoryFormat, BiFunction<Path, ObjectMapper, InventorySource>> parsers = new EnumMap<>(InventoryFormat.class);
        parsers.put(InventoryFormat.ETC_HOSTS, (path, mapper) -> new EtcHostsInventorySource(path));
        parsers.put(InventoryFormat.SSH_CONFIG, (path, mapper) -> new SshConfigInventorySource(path));
        parsers.put(InventoryFormat.ANSIBLE, (path, mapper) -> new AnsibleInventorySource(path));
        parsers.put(InventoryFormat.STRUCTURED, StructuredFileInventorySource::new);
        PARSERS = Collections.unmodifiableMap(parsers);
    }

    private final HostGuardProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public InventorySource fileSource(InventoryFormat format, Path path) {
        return PARSERS.get(format).apply(path, objectMapper);
    }

    public List<InventorySource> createSources() {
        HostGuardProperties.RegistryConfig registry = properties.getRegistry();
        List<InventorySource> sources = new ArrayList<>();

        addIfConfigured(sources, InventoryFormat.ETC_HOSTS, registry.getEtcHostsPath());
        addIfConfigured(sources, InventoryFormat.SSH_CONFIG, registry.getSshConfigPath());
        registry.getAnsibleInventoryPaths().forEach(p -> addIfConfigured(sources, InventoryFormat.ANSIBLE, p));
        registry.getInventoryPaths().forEach(p -> addIfConfigured(sources, InventoryFormat.STRUCTURED, p));

        HostGuardProperties.RegistryConfig.CloudConfig cloud = registry.getCloud();
        if (cloud.isEnabled()) {
            if (cloud.getEndpoint() == null || cloud.getEndpoint().isBlank()) {
                log.warn("Cloud inventory enabled but no endpoint configured, skipping");
            } else {
                sources.add(new HttpInventorySource(cloud.getName(), cloud.getEndpoint(), cloud.getToken(),
                        Duration.ofSeconds(cloud.getTimeoutSeconds()), httpClient, objectMapper));
            }
        }

        log.info("Configured {} inventory sources", sources.size());
        return sources;
    }

    private void addIfConfigured(List<InventorySource> sources, InventoryFormat format, String path) {
        if (path == null || path.isBlank()) return;
        sources.add(fileSource(format, Path.of(path)));
    }
}

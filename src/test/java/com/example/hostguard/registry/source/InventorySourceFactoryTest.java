package com.example.hostguard.registry.source;

import com.example.hostguard.config.HostGuardProperties;
import com.example.hostguard.support.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InventorySourceFactoryTest {

    private HostGuardProperties properties() {
        HostGuardProperties properties = new HostGuardProperties();
        HostGuardProperties.RegistryConfig registry = properties.getRegistry();
        registry.setEtcHostsPath(Fixtures.inventory("hosts").toString());
        registry.setSshConfigPath("");
        registry.setAnsibleInventoryPaths(List.of(Fixtures.inventory("ansible_hosts").toString()));
        registry.setInventoryPaths(List.of(
                Fixtures.inventory("inventory.json").toString(),
                Fixtures.inventory("inventory.csv").toString()));
        return properties;
    }

    @Test
    void createsOneSourcePerConfiguredPath() {
        InventorySourceFactory factory = new InventorySourceFactory(properties(), new ObjectMapper(), new OkHttpClient());

        List<InventorySource> sources = factory.createSources();

        assertEquals(List.of(EtcHostsInventorySource.class, AnsibleInventorySource.class,
                        StructuredFileInventorySource.class, StructuredFileInventorySource.class),
                sources.stream().map(Object::getClass).collect(Collectors.toList()));
    }

    @Test
    void cloudSourceNeedsAnEndpoint() {
        HostGuardProperties properties = properties();
        properties.getRegistry().getCloud().setEnabled(true);
        InventorySourceFactory factory = new InventorySourceFactory(properties, new ObjectMapper(), new OkHttpClient());

        assertEquals(4, factory.createSources().size());

        properties.getRegistry().getCloud().setEndpoint("http://cmdb.internal/hosts");
        List<InventorySource> sources = factory.createSources();

        assertEquals(5, sources.size());
        assertInstanceOf(HttpInventorySource.class, sources.get(4));
    }

    @Test
    void everyFormatHasAParser() {
        InventorySourceFactory factory = new InventorySourceFactory(properties(), new ObjectMapper(), new OkHttpClient());

        for (InventoryFormat format : InventoryFormat.values()) {
            assertNotNull(factory.fileSource(format, Fixtures.inventory("hosts")));
        }
    }
}

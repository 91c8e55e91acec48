package com.example.hostguard.registry.source;

import com.example.hostguard.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SshConfigInventorySourceTest {

    @Test
    void parsesHostBlocksAndSkipsWildcardsAndMatch() {
        List<RawHostRecord> records = new SshConfigInventorySource(Fixtures.inventory("ssh_config")).parse();

        assertEquals(2, records.size());

        RawHostRecord bastion = records.get(0);
        assertEquals("bastion", bastion.getName());
        assertEquals(List.of("jump"), bastion.getAliases());
        assertEquals("203.0.113.5", bastion.getAddress());
        assertEquals(Map.of("ssh_user", "ops", "ssh_port", "2222"), bastion.getMetadata());

        RawHostRecord build = records.get(1);
        assertEquals("build-server", build.getName());
        assertEquals("10.0.0.40", build.getAddress());
        assertEquals("ci", build.getMetadata().get("ssh_user"));
        assertNull(build.getEnvironment());
    }
}

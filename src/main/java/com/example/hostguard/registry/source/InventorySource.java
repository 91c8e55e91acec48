package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;

import java.util.List;

/**
 * Anything that can list hosts: a file on disk, a cloud inventory endpoint.
 *
 * Implementations must not throw for an unreadable or malformed source. They
 * log a diagnostic and return an empty list so other sources still load.
 */
public interface InventorySource {

    /**
     * Human-readable name used in logs and registry stats (e.g. "ansible:/etc/ansible/hosts").
     */
    String name();

    /**
     * Tag stamped on every host this source yields.
     */
    HostSource type();

    List<RawHostRecord> parse();
}

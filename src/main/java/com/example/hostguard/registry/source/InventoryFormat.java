package com.example.hostguard.registry.source;

/**
 * File formats the registry knows how to read.
 */
public enum InventoryFormat {
    ETC_HOSTS,
    SSH_CONFIG,
    ANSIBLE,
    STRUCTURED
}

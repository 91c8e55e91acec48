package com.example.hostguard.registry;

import java.util.Arrays;
import java.util.Optional;

/**
 * Origin of a host record.
 */
public enum HostSource {
    ETC_HOSTS("etc_hosts"),
    SSH_CONFIG("ssh_config"),
    ANSIBLE("ansible"),
    CUSTOM_FILE("custom_file"),
    CLOUD("cloud"),
    MANUAL("manual");

    private final String tag;

    HostSource(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<HostSource> fromTag(String value) {
        if (value == null) return Optional.empty();
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.tag.equalsIgnoreCase(trimmed) || s.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}

package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * OpenSSH client config. Each {@code Host} block becomes a record; wildcard
 * patterns are skipped, extra patterns on the same line become aliases,
 * {@code HostName} is the address and {@code User}/{@code Port} land in metadata.
 */
public class SshConfigInventorySource extends AbstractFileInventorySource {

    public SshConfigInventorySource(Path path) {
        super(path);
    }

    @Override
    public HostSource type() {
        return HostSource.SSH_CONFIG;
    }

    @Override
    protected List<RawHostRecord> parseContent(String content) {
        List<RawHostRecord> records = new ArrayList<>();
        List<String> patterns = null;
        String hostName = null;
        Map<String, String> metadata = new LinkedHashMap<>();

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String[] parts = line.split("\\s*=\\s*|\\s+", 2);
            if (parts.length < 2) continue;
            String keyword = parts[0].toLowerCase(Locale.ROOT);
            String value = parts[1].trim();

            switch (keyword) {
                case "host" -> {
                    addBlock(records, patterns, hostName, metadata);
                    patterns = new ArrayList<>();
                    for (String pattern : value.split("\\s+")) {
                        if (!pattern.contains("*") && !pattern.contains("?") && !pattern.startsWith("!")) {
                            patterns.add(pattern);
                        }
                    }
                    hostName = null;
                    metadata = new LinkedHashMap<>();
                }
                case "match" -> {
                    addBlock(records, patterns, hostName, metadata);
                    patterns = null;
                    hostName = null;
                    metadata = new LinkedHashMap<>();
                }
                case "hostname" -> hostName = value;
                case "user" -> metadata.put("ssh_user", value);
                case "port" -> metadata.put("ssh_port", value);
                default -> { }
            }
        }
        addBlock(records, patterns, hostName, metadata);
        return records;
    }

    private static void addBlock(List<RawHostRecord> records, List<String> patterns,
                                 String hostName, Map<String, String> metadata) {
        if (patterns == null || patterns.isEmpty()) return;
        records.add(RawHostRecord.builder()
                .name(patterns.get(0))
                .address(hostName)
                .aliases(patterns.subList(1, patterns.size()))
                .metadata(metadata)
                .build());
    }
}

package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * /etc/hosts format: {@code address canonical [alias...]}. The first name is
 * canonical, the rest are aliases. Loopback, broadcast, link-local and
 * multicast entries are skipped.
 */
public class EtcHostsInventorySource extends AbstractFileInventorySource {

    private static final Set<String> SKIPPED_ADDRESSES = Set.of("127.0.0.1", "::1", "255.255.255.255", "0.0.0.0");
    private static final Set<String> SKIPPED_NAMES = Set.of("localhost", "broadcasthost", "ip6-localhost", "ip6-loopback");

    public EtcHostsInventorySource(Path path) {
        super(path);
    }

    @Override
    public HostSource type() {
        return HostSource.ETC_HOSTS;
    }

    @Override
    protected List<RawHostRecord> parseContent(String content) {
        List<RawHostRecord> records = new ArrayList<>();
        for (String rawLine : content.split("\\R")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            String[] parts = line.split("\\s+");
            if (parts.length < 2) continue;

            String address = parts[0];
            if (SKIPPED_ADDRESSES.contains(address) || address.startsWith("fe80::")
                    || address.startsWith("ff02::") || address.startsWith("ff00::")) {
                continue;
            }
            String canonical = parts[1];
            if (SKIPPED_NAMES.contains(canonical)) continue;

            records.add(RawHostRecord.builder()
                    .name(canonical)
                    .address(address)
                    .aliases(Arrays.asList(parts).subList(2, parts.length))
                    .build());
        }
        return records;
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }
}

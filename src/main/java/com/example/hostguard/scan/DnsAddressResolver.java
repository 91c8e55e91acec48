package com.example.hostguard.scan;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * System resolver with a short-lived Caffeine cache so a batch scanning the
 * same names does not hit DNS for every retry. Failures are not cached.
 */
@Slf4j
public class DnsAddressResolver implements AddressResolver {

    private final Cache<String, List<InetAddress>> lookups;

    public DnsAddressResolver(Duration cacheTtl) {
        this.lookups = Caffeine.newBuilder()
                .maximumSize(5000)
                .expireAfterWrite(cacheTtl)
                .build();
    }

    @Override
    public List<InetAddress> resolve(String hostOrAddress) throws UnknownHostException {
        String key = hostOrAddress.trim().toLowerCase(Locale.ROOT);
        List<InetAddress> cached = lookups.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        List<InetAddress> addresses = List.of(InetAddress.getAllByName(key));
        log.debug("Resolved {} to {}", hostOrAddress, addresses);
        lookups.put(key, addresses);
        return addresses;
    }
}

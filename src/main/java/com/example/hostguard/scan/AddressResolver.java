package com.example.hostguard.scan;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Turns a hostname or address literal into candidate addresses, in the order
 * they should be tried.
 */
public interface AddressResolver {

    List<InetAddress> resolve(String hostOrAddress) throws UnknownHostException;
}

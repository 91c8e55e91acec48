package com.example.hostguard.scan;

import java.net.InetAddress;
import java.time.Duration;

public interface ConnectivityProbe {

    /**
     * @return true if a TCP connection to the port was accepted within the timeout
     */
    boolean isReachable(InetAddress address, int port, Duration timeout);
}

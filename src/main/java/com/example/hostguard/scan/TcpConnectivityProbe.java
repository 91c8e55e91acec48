package com.example.hostguard.scan;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Plain socket connect against the management port.
 */
@Slf4j
public class TcpConnectivityProbe implements ConnectivityProbe {

    @Override
    public boolean isReachable(InetAddress address, int port, Duration timeout) {
        long start = System.currentTimeMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(address, port), (int) timeout.toMillis());
            log.debug("TCP connected to {}:{} ({}ms)", address.getHostAddress(), port,
                    System.currentTimeMillis() - start);
            return true;
        } catch (IOException e) {
            log.debug("TCP connect to {}:{} failed: {}", address.getHostAddress(), port, e.getMessage());
            return false;
        }
    }
}

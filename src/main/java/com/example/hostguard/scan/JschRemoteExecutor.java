package com.example.hostguard.scan;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * SSH executor over JSch with key-based authentication. One session per
 * command; the session is always disconnected before returning.
 */
@Slf4j
public class JschRemoteExecutor implements RemoteExecutor {

    public enum HostKeyPolicy {
        /** Only hosts already present in known_hosts are accepted */
        REJECT,
        /** Unknown host keys are accepted; for test environments */
        AUTO_ADD;

        public static HostKeyPolicy parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException("Unknown SSH host key policy: " + value, e);
            }
        }
    }

    private static final long POLL_INTERVAL_MS = 50;

    private final String user;
    private final String keyPath;
    private final String knownHostsPath;
    private final int port;
    private final Duration connectTimeout;
    private final HostKeyPolicy hostKeyPolicy;

    public JschRemoteExecutor(String user, String keyPath, String knownHostsPath, int port,
                              Duration connectTimeout, HostKeyPolicy hostKeyPolicy) {
        this.user = user;
        this.keyPath = keyPath;
        this.knownHostsPath = knownHostsPath;
        this.port = port;
        this.connectTimeout = connectTimeout;
        this.hostKeyPolicy = hostKeyPolicy;
        if (hostKeyPolicy == HostKeyPolicy.AUTO_ADD) {
            log.warn("SSH host key checking disabled (AUTO_ADD). This is insecure and should only be used for testing.");
        }
    }

    @Override
    public CommandResult execute(String address, String command, Duration timeout) throws RemoteExecutionException {
        log.debug("SSH executing on {}@{}:{} - {}", user, address, port, command);
        Session session = null;
        ChannelExec channel = null;
        try {
            session = openSession(address);
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            channel.setInputStream(null);

            InputStream stdout = channel.getInputStream();
            InputStream stderr = channel.getExtInputStream();
            channel.connect((int) connectTimeout.toMillis());

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ByteArrayOutputStream err = new ByteArrayOutputStream();
            long deadline = System.nanoTime() + timeout.toNanos();
            while (true) {
                drain(stdout, out);
                drain(stderr, err);
                if (channel.isClosed() && stdout.available() == 0 && stderr.available() == 0) {
                    break;
                }
                if (System.nanoTime() > deadline) {
                    throw new RemoteExecutionException(String.format(
                            "Command timed out after %ds on %s", timeout.toSeconds(), address));
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
            return new CommandResult(channel.getExitStatus(),
                    out.toString(StandardCharsets.UTF_8).trim(),
                    err.toString(StandardCharsets.UTF_8).trim());
        } catch (JSchException e) {
            throw new RemoteExecutionException(describe(e, address), e);
        } catch (IOException e) {
            throw new RemoteExecutionException("SSH I/O failure on " + address + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteExecutionException("Interrupted while running command on " + address, e);
        } finally {
            if (channel != null) channel.disconnect();
            if (session != null) session.disconnect();
        }
    }

    private Session openSession(String address) throws JSchException {
        JSch jsch = new JSch();
        if (keyPath != null && Files.isReadable(Path.of(keyPath))) {
            jsch.addIdentity(keyPath);
        }
        if (knownHostsPath != null && Files.isReadable(Path.of(knownHostsPath))) {
            jsch.setKnownHosts(knownHostsPath);
        } else if (hostKeyPolicy == HostKeyPolicy.REJECT) {
            log.warn("known_hosts file {} not readable; every host key will be rejected", knownHostsPath);
        }

        Session session = jsch.getSession(user, address, port);
        session.setConfig("StrictHostKeyChecking", hostKeyPolicy == HostKeyPolicy.REJECT ? "yes" : "no");
        session.setTimeout((int) connectTimeout.toMillis());
        session.connect((int) connectTimeout.toMillis());
        return session;
    }

    private static void drain(InputStream in, ByteArrayOutputStream sink) throws IOException {
        byte[] buffer = new byte[4096];
        while (in.available() > 0) {
            int read = in.read(buffer, 0, buffer.length);
            if (read < 0) break;
            sink.write(buffer, 0, read);
        }
    }

    private static String describe(JSchException e, String address) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("auth fail")) {
            return "SSH authentication failed on " + address + " (check credentials)";
        }
        if (lower.contains("reject hostkey") || lower.contains("unknownhostkey")) {
            return "SSH host key for " + address + " not in known_hosts";
        }
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return "SSH connection to " + address + " timed out";
        }
        if (lower.contains("connection refused")) {
            return "SSH connection refused by " + address + " (check if SSH is running)";
        }
        return "SSH connection to " + address + " failed: " + message;
    }
}

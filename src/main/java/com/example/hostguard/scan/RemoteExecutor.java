package com.example.hostguard.scan;

import java.time.Duration;

/**
 * Runs a single read-only command on a remote host.
 */
public interface RemoteExecutor {

    CommandResult execute(String address, String command, Duration timeout) throws RemoteExecutionException;
}

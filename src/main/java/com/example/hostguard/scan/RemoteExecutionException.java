package com.example.hostguard.scan;

/**
 * The command could not be run to completion: connection, authentication,
 * host key or timeout failure.
 */
public class RemoteExecutionException extends Exception {

    public RemoteExecutionException(String message) {
        super(message);
    }

    public RemoteExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

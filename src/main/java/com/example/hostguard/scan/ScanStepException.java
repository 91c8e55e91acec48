package com.example.hostguard.scan;

/**
 * A retryable failure of one scan attempt. Never leaves the orchestrator;
 * it becomes the error text of the final {@link ScanResult}.
 */
public class ScanStepException extends Exception {

    private final ScanFailure kind;

    public ScanStepException(ScanFailure kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScanStepException(ScanFailure kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ScanFailure getKind() {
        return kind;
    }
}

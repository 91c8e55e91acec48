package com.example.hostguard.scan;

/**
 * Why a scan step or a whole scan failed.
 */
public enum ScanFailure {
    /** Name did not resolve or no address accepted a connection on the management port */
    UNREACHABLE,
    /** Remote command exited non-zero, timed out or the session broke */
    INSPECTION_FAILED,
    /** Terminal: the retry budget is spent */
    RETRIES_EXHAUSTED
}

package com.example.hostguard.scan;

/**
 * Called after every per-host completion in a batch, cache hits included.
 * Calls are serialized; order follows completion, not submission.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int completed, int total, String hostname);

    ProgressListener NONE = (completed, total, hostname) -> { };
}

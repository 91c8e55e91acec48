package com.example.hostguard.scan;

/**
 * Output of one remote command.
 */
public record CommandResult(int exitStatus, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitStatus == 0;
    }
}

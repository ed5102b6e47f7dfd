package com.agentbridge.runtime;

/**
 * A runtime command exited non-zero or timed out. The message carries the
 * command's own output so callers can recognise specific failures.
 */
public class RuntimeCommandException extends RuntimeException {

    private final int exitCode;

    public RuntimeCommandException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public RuntimeCommandException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}

package com.locus.core.retry;

/**
 * Thrown when a {@link RetryPolicy} gives up.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super("%s failed after %d attempts: %s".formatted(
                operation, attempts, lastError == null ? "unknown error" : lastError.getMessage()), lastError);
        this.attempts = attempts;
    }

    public RetryExhaustedException(String message, Throwable cause) {
        super(message, cause);
        this.attempts = 0;
    }

    public int getAttempts() {
        return attempts;
    }
}

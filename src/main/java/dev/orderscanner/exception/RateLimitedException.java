package dev.orderscanner.exception;

/**
 * An upstream provider asked us to slow down (HTTP 429). Retryable at job start.
 */
public class RateLimitedException extends RuntimeException {

    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}

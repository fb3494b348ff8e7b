package dev.orderscanner.exception;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 */
public record ApiError(int status, String error, String message, Instant timestamp) {

    public static ApiError of(int status, String error, String message) {
        return new ApiError(status, error, message, Instant.now());
    }
}

package dev.orderscanner.exception;

/**
 * The email provider rejected or lacks the owner's credentials. Never retried.
 */
public class UpstreamAuthException extends RuntimeException {

    public static final String REAUTHENTICATE = "Token expired, please re-authenticate";

    public UpstreamAuthException() {
        super(REAUTHENTICATE);
    }

    public UpstreamAuthException(String message) {
        super(message);
    }
}

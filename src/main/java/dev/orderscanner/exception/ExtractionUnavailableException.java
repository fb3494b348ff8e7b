package dev.orderscanner.exception;

/**
 * The extraction service could not be reached after its retry budget.
 */
public class ExtractionUnavailableException extends ExtractionException {

    public ExtractionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

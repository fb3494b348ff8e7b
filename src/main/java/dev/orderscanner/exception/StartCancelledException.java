package dev.orderscanner.exception;

/**
 * The subscriber of a job start went away before the candidate search finished.
 */
public class StartCancelledException extends RuntimeException {

    public StartCancelledException() {
        super("Job start cancelled before the candidate search finished");
    }
}

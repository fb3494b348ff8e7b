package dev.orderscanner.model;

/**
 * Why a job ended in {@link JobStatus#FAILED}.
 */
public enum FailureReason {
    /** A newer job was started for the same owner. */
    SUPERSEDED,
    /** The email provider rejected the owner's credentials. */
    UPSTREAM_AUTH,
    /** The email provider kept rate limiting the candidate search. */
    RATE_LIMITED,
    /** The extraction service could not be reached. */
    EXTRACTION_UNAVAILABLE,
    /** The caller went away before the candidate search finished. */
    START_CANCELLED,
    /** Any other error that made the run meaningless. */
    FETCH_ERROR
}

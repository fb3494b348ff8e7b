package dev.orderscanner.model;

/**
 * Search precision for supplier queries. {@code FALLBACK} drops the subject
 * filter to trade precision for recall.
 */
public enum QueryMode {
    STRICT,
    FALLBACK
}

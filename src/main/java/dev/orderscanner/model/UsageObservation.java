package dev.orderscanner.model;

import java.time.LocalDate;

/**
 * One purchase of an item: when, how many, and at what unit price.
 */
public record UsageObservation(LocalDate date, double quantity, Double unitPrice, String orderId) {
}

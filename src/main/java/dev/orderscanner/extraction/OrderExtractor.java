package dev.orderscanner.extraction;

import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.RawEmail;
import reactor.core.publisher.Mono;

/**
 * Turns one raw email into a structured purchase order.
 */
public interface OrderExtractor {

    /**
     * Extract an order from an email.
     *
     * @param email The email to analyze
     * @return Mono with the order, or an empty Mono when the email is not an order.
     *         Fails with ExtractionException for a bad item and
     *         ExtractionUnavailableException when the service cannot be reached.
     */
    Mono<ExtractedOrder> extract(RawEmail email);

    /**
     * Check if extraction is available.
     *
     * @return true if a real extraction backend is configured
     */
    boolean isEnabled();
}

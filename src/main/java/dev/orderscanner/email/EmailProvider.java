package dev.orderscanner.email;

import dev.orderscanner.model.RawEmail;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read access to an owner's mailbox.
 */
public interface EmailProvider {

    /**
     * Get the name of this provider (e.g., "Gmail").
     */
    String getName();

    /**
     * Search the mailbox and return matching message ids in the provider's
     * listing order.
     *
     * @throws dev.orderscanner.exception.UpstreamAuthException via the Mono when credentials are missing or rejected
     * @throws dev.orderscanner.exception.RateLimitedException via the Mono when the provider throttles the call
     */
    Mono<List<String>> search(String ownerKey, String query, int maxResults);

    /**
     * Fetch one message with its decoded text body.
     */
    Mono<RawEmail> fetch(String ownerKey, String messageId);
}

package dev.orderscanner.extraction;

import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.RawEmail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op implementation of OrderExtractor.
 * Used when no AI provider is configured; every email is "not an order".
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class NoOpOrderExtractor implements OrderExtractor {

    public NoOpOrderExtractor() {
        log.info("Order extraction disabled - using no-op extractor");
    }

    @Override
    public Mono<ExtractedOrder> extract(RawEmail email) {
        return Mono.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}

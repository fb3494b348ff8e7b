package dev.orderscanner.service;

import dev.orderscanner.config.IngestionConfig;
import dev.orderscanner.model.JobCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Starts several job categories for one owner, spacing the starts so the
 * email provider does not see them as a single burst.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaggeredIngestionLauncher {

    private final IngestionOrchestrator orchestrator;
    private final IngestionConfig config;

    /**
     * Start each request {@code stagger-delay} after the previous one. Starts
     * do not wait for each other to finish. Under the default
     * {@code supersession-scope: owner} each start supersedes the one before,
     * so only the last category keeps running; use {@code owner-and-category}
     * to run them side by side.
     *
     * @return one outcome per request, in request order
     */
    public Mono<List<LaunchOutcome>> startAll(String ownerKey, List<LaunchRequest> requests) {
        Duration stagger = config.getStaggerDelay();
        log.info("Launching {} ingestion jobs for {} ({} apart)", requests.size(), ownerKey, stagger);

        return Flux.fromIterable(requests)
                .index()
                .flatMapSequential(indexed -> delayFor(stagger, indexed.getT1())
                        .then(Mono.defer(() -> startOne(ownerKey, indexed.getT2()))))
                .collectList();
    }

    private Mono<LaunchOutcome> startOne(String ownerKey, LaunchRequest request) {
        return orchestrator.start(ownerKey, request.domains(), request.category())
                .map(jobId -> LaunchOutcome.started(request.category(), jobId))
                .onErrorResume(e -> {
                    log.warn("Could not start {} job for {}: {}", request.category().getKey(), ownerKey, e.getMessage());
                    return Mono.just(LaunchOutcome.rejected(request.category(), e));
                });
    }

    private static Mono<Long> delayFor(Duration stagger, long index) {
        if (index == 0 || stagger.isZero()) {
            return Mono.just(index);
        }
        return Mono.delay(stagger.multipliedBy(index));
    }

    public record LaunchRequest(JobCategory category, List<String> domains) {
        public LaunchRequest {
            if (category == null) {
                throw new IllegalArgumentException("Category is required");
            }
            domains = domains == null ? List.of() : List.copyOf(domains);
        }
    }

    public record LaunchOutcome(JobCategory category, String jobId, String error, String errorType) {

        static LaunchOutcome started(JobCategory category, String jobId) {
            return new LaunchOutcome(category, jobId, null, null);
        }

        static LaunchOutcome rejected(JobCategory category, Throwable e) {
            return new LaunchOutcome(category, null, e.getMessage(), e.getClass().getSimpleName());
        }

        public boolean isStarted() {
            return jobId != null;
        }
    }
}

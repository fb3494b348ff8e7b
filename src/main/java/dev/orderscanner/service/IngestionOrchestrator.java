package dev.orderscanner.service;

import dev.orderscanner.config.IngestionConfig;
import dev.orderscanner.email.EmailProvider;
import dev.orderscanner.exception.ExtractionUnavailableException;
import dev.orderscanner.exception.JobNotFoundException;
import dev.orderscanner.exception.RateLimitedException;
import dev.orderscanner.exception.StartCancelledException;
import dev.orderscanner.exception.UpstreamAuthException;
import dev.orderscanner.extraction.OrderExtractor;
import dev.orderscanner.metrics.IngestionMetrics;
import dev.orderscanner.model.EmailPreview;
import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.FailureReason;
import dev.orderscanner.model.IngestionJob;
import dev.orderscanner.model.JobCategory;
import dev.orderscanner.model.JobProgress;
import dev.orderscanner.model.JobStatus;
import dev.orderscanner.model.QueryMode;
import dev.orderscanner.model.RawEmail;
import dev.orderscanner.query.SupplierQueryBuilder;
import dev.orderscanner.store.JobStore;
import dev.orderscanner.supplier.SupplierDirectory;
import dev.orderscanner.support.LinearBackoffRetry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Drives ingestion jobs: candidate search with start retry, then a
 * sequential fetch and extract pass whose every step is written to the
 * JobStore.
 */
@Slf4j
@Service
public class IngestionOrchestrator {

    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final JobStore jobStore;
    private final EmailProvider emailProvider;
    private final OrderExtractor orderExtractor;
    private final SupplierQueryBuilder queryBuilder;
    private final SupplierDirectory supplierDirectory;
    private final OrderHistoryService orderHistoryService;
    private final IngestionMetrics metrics;
    private final IngestionConfig config;
    private final Clock clock;
    private final Scheduler scheduler;

    public IngestionOrchestrator(JobStore jobStore,
                                 EmailProvider emailProvider,
                                 OrderExtractor orderExtractor,
                                 SupplierQueryBuilder queryBuilder,
                                 SupplierDirectory supplierDirectory,
                                 OrderHistoryService orderHistoryService,
                                 IngestionMetrics metrics,
                                 IngestionConfig config,
                                 Clock clock,
                                 @Qualifier("ingestionScheduler") Scheduler scheduler) {
        this.jobStore = jobStore;
        this.emailProvider = emailProvider;
        this.orderExtractor = orderExtractor;
        this.queryBuilder = queryBuilder;
        this.supplierDirectory = supplierDirectory;
        this.orderHistoryService = orderHistoryService;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Start an ingestion job. Completes with the job id once the candidate
     * search has succeeded; the per-email pass then continues in the
     * background and is observed through {@link #getStatus(String)}.
     *
     * @param ownerKey Requesting user
     * @param domains  Supplier domains to scan; empty means the category's configured defaults
     * @param category Job category
     * @return Mono with the job id. Fails with RateLimitedException once the
     *         start retry budget is spent, or UpstreamAuthException immediately.
     *         Cancelling before the search finishes fails the job.
     */
    public Mono<String> start(String ownerKey, Collection<String> domains, JobCategory category) {
        return Mono.defer(() -> {
            if (ownerKey == null || ownerKey.isBlank()) {
                return Mono.error(new IllegalArgumentException("Owner key is required"));
            }
            JobCategory resolved = category != null ? category : JobCategory.OTHER;
            List<String> searchDomains = queryBuilder.expandDomains(resolveDomains(domains, resolved));
            if (searchDomains.isEmpty()) {
                return Mono.error(new IllegalArgumentException("No valid supplier domains for " + resolved.getKey()));
            }

            IngestionJob job = jobStore.create(ownerKey, resolved);
            String jobId = job.getId();
            metrics.recordJobStarted(resolved);
            mutate(jobId, current -> current.toBuilder()
                    .status(JobStatus.RUNNING)
                    .progress(current.getProgress().toBuilder()
                            .currentTask("Searching " + searchDomains.size() + " supplier domains...")
                            .build())
                    .build()
                    .withLog(logLine("Job started for " + resolved.getKey() + " suppliers")));

            AtomicBoolean searching = new AtomicBoolean(true);
            return searchCandidates(jobId, ownerKey, searchDomains, resolved)
                    .doOnNext(candidates -> searching.set(false))
                    .doOnError(e -> failJob(jobId, resolved, e))
                    .doOnCancel(() -> {
                        if (searching.compareAndSet(true, false)) {
                            failJob(jobId, resolved, new StartCancelledException());
                        }
                    })
                    .flatMap(candidates -> Mono.fromRunnable(() -> launch(jobId, ownerKey, resolved, candidates))
                            .thenReturn(jobId));
        });
    }

    public IngestionJob getStatus(String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Optional<IngestionJob> getLatestForOwner(String ownerKey) {
        return jobStore.findLatestForOwner(ownerKey);
    }

    private Collection<String> resolveDomains(Collection<String> domains, JobCategory category) {
        if (domains != null && !domains.isEmpty()) {
            return domains;
        }
        return switch (category) {
            case MARKETPLACE -> supplierDirectory.getMarketplaceDomains();
            case PRIORITY -> supplierDirectory.getPriorityDomains();
            case OTHER -> List.of();
        };
    }

    /**
     * Strict search first; a thin result set is topped up by a search
     * without the subject filter. Rate limits are retried with the
     * category's linear backoff.
     */
    private Mono<List<String>> searchCandidates(String jobId, String ownerKey, List<String> domains,
                                                JobCategory category) {
        int maxResults = config.getMaxResults();
        int maxRetries = config.getStartRetry().getMaxRetries();

        Mono<List<String>> search = Mono.defer(() -> emailProvider
                .search(ownerKey, queryBuilder.build(domains, category, QueryMode.STRICT), maxResults)
                .flatMap(strictIds -> {
                    if (strictIds.size() >= config.getFallbackThreshold()) {
                        return Mono.just(strictIds);
                    }
                    appendLog(jobId, "Only " + strictIds.size() + " matches with subject filter, broadening search");
                    return emailProvider
                            .search(ownerKey, queryBuilder.build(domains, category, QueryMode.FALLBACK), maxResults)
                            .map(fallbackIds -> mergeCandidates(strictIds, fallbackIds, maxResults));
                }));

        return search.retryWhen(LinearBackoffRetry.of(
                maxRetries,
                config.getStartRetry().baseDelayFor(category),
                RateLimitedException.class::isInstance,
                Schedulers.parallel(),
                (attempt, delay, failure) -> {
                    log.warn("Job {} rate limited, retry {}/{} in {}", jobId, attempt, maxRetries, delay);
                    appendLog(jobId, "Rate limited, retrying in " + delay.toSeconds() + "s (attempt "
                            + attempt + "/" + maxRetries + ")");
                }));
    }

    static List<String> mergeCandidates(List<String> strictIds, List<String> fallbackIds, int maxResults) {
        Set<String> merged = new LinkedHashSet<>(strictIds);
        for (String id : fallbackIds) {
            if (merged.size() >= maxResults) {
                break;
            }
            merged.add(id);
        }
        return merged.stream().limit(maxResults).toList();
    }

    private void launch(String jobId, String ownerKey, JobCategory category, List<String> candidates) {
        log.info("Job {} found {} candidate emails", jobId, candidates.size());
        mutate(jobId, job -> job.toBuilder()
                .progress(job.getProgress().toBuilder()
                        .total(candidates.size())
                        .currentTask("Processing " + candidates.size() + " emails...")
                        .build())
                .build()
                .withLog(logLine("Found " + candidates.size() + " candidate emails")));

        process(jobId, ownerKey, category, candidates)
                .subscribeOn(scheduler)
                .subscribe(
                        unused -> { },
                        e -> log.error("Job {} pipeline terminated unexpectedly: {}", jobId, e.getMessage(), e));
    }

    /**
     * Sequential pass over the candidate ids. Stops early once the job is
     * terminal, e.g. superseded by a newer job.
     */
    Mono<Void> process(String jobId, String ownerKey, JobCategory category, List<String> candidates) {
        RunState run = new RunState(jobId, ownerKey);

        return Flux.fromIterable(candidates)
                .takeWhile(messageId -> isActive(jobId))
                .concatMap(messageId -> processCandidate(run, messageId))
                .then(Mono.fromRunnable(() -> completeJob(jobId, category)))
                .onErrorResume(e -> Mono.fromRunnable(() -> failJob(jobId, category, e)))
                .then(Mono.defer(() -> persistHistory(jobId)));
    }

    private Mono<Void> processCandidate(RunState run, String messageId) {
        return emailProvider.fetch(run.ownerKey, messageId)
                .doOnNext(email -> showCurrentEmail(run.jobId, email))
                .flatMap(orderExtractor::extract)
                .map(order -> order.getOriginalEmailId() != null
                        ? order
                        : order.toBuilder().originalEmailId(messageId).build())
                .doOnNext(order -> recordOrder(run, order))
                .switchIfEmpty(Mono.fromRunnable(() -> recordNotAnOrder(run, messageId)))
                .then()
                .onErrorResume(e -> !(e instanceof UpstreamAuthException), e -> recordItemFailure(run, messageId, e));
    }

    private void showCurrentEmail(String jobId, RawEmail email) {
        mutate(jobId, job -> job.toBuilder()
                .currentEmail(EmailPreview.of(email))
                .progress(job.getProgress().toBuilder()
                        .currentTask("Analyzing: " + email.getSubject())
                        .build())
                .build());
    }

    private void recordOrder(RunState run, ExtractedOrder order) {
        run.consecutiveUnavailable = 0;
        metrics.recordEmailProcessed();
        metrics.recordOrderExtracted();
        log.debug("Job {} extracted order {} from {}", run.jobId, order.getId(), order.getSupplier());
        mutate(run.jobId, job -> advance(job, 1, 0)
                .withOrder(order)
                .withLog(logLine("Found order from " + order.getSupplier() + " ("
                        + order.getItems().size() + " items)")));
    }

    private void recordNotAnOrder(RunState run, String messageId) {
        run.consecutiveUnavailable = 0;
        metrics.recordEmailProcessed();
        log.debug("Job {} email {} is not an order", run.jobId, messageId);
        mutate(run.jobId, job -> advance(job, 0, 0));
    }

    private Mono<Void> recordItemFailure(RunState run, String messageId, Throwable e) {
        if (e instanceof ExtractionUnavailableException) {
            run.consecutiveUnavailable++;
            if (run.consecutiveUnavailable >= config.getExtractionUnavailableLimit()) {
                return Mono.error(e);
            }
        } else {
            run.consecutiveUnavailable = 0;
        }

        metrics.recordEmailProcessed();
        metrics.recordExtractionFailure();
        log.warn("Job {} failed to process email {}: {}", run.jobId, messageId, e.getMessage());
        mutate(run.jobId, job -> advance(job, 0, 1)
                .withLog(logLine("Failed to process email " + messageId + ": " + e.getMessage())));
        return Mono.empty();
    }

    private static IngestionJob advance(IngestionJob job, int success, int failed) {
        JobProgress progress = job.getProgress();
        return job.toBuilder()
                .progress(progress.toBuilder()
                        .processed(progress.getProcessed() + 1)
                        .success(progress.getSuccess() + success)
                        .failed(progress.getFailed() + failed)
                        .build())
                .build();
    }

    private void completeJob(String jobId, JobCategory category) {
        Optional<IngestionJob> result = jobStore.update(jobId, job -> job.toBuilder()
                .status(JobStatus.COMPLETED)
                .currentEmail(null)
                .progress(job.getProgress().toBuilder().currentTask("Completed").build())
                .build()
                .withLog(logLine("Job completed. Found " + job.getOrders().size() + " orders.")));

        result.filter(job -> job.getStatus() == JobStatus.COMPLETED)
                .ifPresent(job -> {
                    metrics.recordJobCompleted(category);
                    log.info("Job {} completed: {} processed, {} orders, {} failed", jobId,
                            job.getProgress().getProcessed(), job.getOrders().size(), job.getProgress().getFailed());
                });
    }

    private void failJob(String jobId, JobCategory category, Throwable e) {
        FailureReason reason = reasonFor(e);
        String message = e instanceof UpstreamAuthException ? UpstreamAuthException.REAUTHENTICATE : e.getMessage();

        Optional<IngestionJob> result = jobStore.update(jobId, job -> job
                .failed(reason, message)
                .withLog(logLine("Job failed: " + message)));

        result.filter(job -> job.getFailureReason() == reason && job.getStatus() == JobStatus.FAILED)
                .ifPresent(job -> {
                    metrics.recordJobFailed(category);
                    log.error("Job {} failed ({}): {}", jobId, reason, message);
                });
    }

    static FailureReason reasonFor(Throwable e) {
        if (e instanceof UpstreamAuthException) {
            return FailureReason.UPSTREAM_AUTH;
        }
        if (e instanceof RateLimitedException) {
            return FailureReason.RATE_LIMITED;
        }
        if (e instanceof ExtractionUnavailableException) {
            return FailureReason.EXTRACTION_UNAVAILABLE;
        }
        if (e instanceof StartCancelledException) {
            return FailureReason.START_CANCELLED;
        }
        return FailureReason.FETCH_ERROR;
    }

    /**
     * Hand a terminal job's orders to the order history.
     */
    private Mono<Void> persistHistory(String jobId) {
        IngestionJob job = jobStore.get(jobId).orElse(null);
        if (job == null || !job.isTerminal() || job.getOrders().isEmpty()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> orderHistoryService.saveOrders(job.getOwnerKey(), job.getOrders()))
                .subscribeOn(scheduler)
                .doOnNext(saved -> log.debug("Job {} saved {} orders to history", jobId, saved))
                .onErrorResume(e -> {
                    log.error("Job {} could not save order history: {}", jobId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private boolean isActive(String jobId) {
        return jobStore.get(jobId).map(job -> !job.isTerminal()).orElse(false);
    }

    private void appendLog(String jobId, String message) {
        mutate(jobId, job -> job.withLog(logLine(message)));
    }

    private void mutate(String jobId, UnaryOperator<IngestionJob> mutation) {
        jobStore.update(jobId, mutation);
    }

    private String logLine(String message) {
        return "[" + LocalTime.now(clock).format(LOG_TIME) + "] " + message;
    }

    /**
     * Per-run counters. A run is driven by a single sequential pipeline.
     */
    private static final class RunState {
        private final String jobId;
        private final String ownerKey;
        private int consecutiveUnavailable;

        private RunState(String jobId, String ownerKey) {
            this.jobId = jobId;
            this.ownerKey = ownerKey;
        }
    }
}

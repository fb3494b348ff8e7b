package dev.orderscanner.service;

import dev.orderscanner.config.IngestionConfig;
import dev.orderscanner.config.SuppliersConfig;
import dev.orderscanner.email.EmailProvider;
import dev.orderscanner.exception.ExtractionException;
import dev.orderscanner.exception.ExtractionUnavailableException;
import dev.orderscanner.exception.JobNotFoundException;
import dev.orderscanner.exception.RateLimitedException;
import dev.orderscanner.exception.StartCancelledException;
import dev.orderscanner.exception.UpstreamAuthException;
import dev.orderscanner.extraction.OrderExtractor;
import dev.orderscanner.metrics.IngestionMetrics;
import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.FailureReason;
import dev.orderscanner.model.IngestionJob;
import dev.orderscanner.model.JobCategory;
import dev.orderscanner.model.JobStatus;
import dev.orderscanner.model.LineItem;
import dev.orderscanner.model.RawEmail;
import dev.orderscanner.query.SupplierQueryBuilder;
import dev.orderscanner.service.StaggeredIngestionLauncher.LaunchOutcome;
import dev.orderscanner.service.StaggeredIngestionLauncher.LaunchRequest;
import dev.orderscanner.store.InMemoryJobStore;
import dev.orderscanner.supplier.SupplierDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    private static final String OWNER = "owner-1";

    @Mock
    private EmailProvider emailProvider;

    @Mock
    private OrderExtractor orderExtractor;

    @Mock
    private OrderHistoryService orderHistoryService;

    private IngestionConfig config;
    private InMemoryJobStore jobStore;
    private SimpleMeterRegistry meterRegistry;
    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-17T12:00:00Z"), ZoneOffset.UTC);
        config = new IngestionConfig();
        config.getStartRetry().setDefaultBaseDelay(Duration.ofMillis(1));
        config.getStartRetry().setBaseDelays(new EnumMap<>(JobCategory.class));

        SuppliersConfig suppliersConfig = new SuppliersConfig();
        SupplierDirectory directory = new SupplierDirectory(suppliersConfig);
        jobStore = new InMemoryJobStore(config, clock);
        meterRegistry = new SimpleMeterRegistry();

        orchestrator = new IngestionOrchestrator(
                jobStore,
                emailProvider,
                orderExtractor,
                new SupplierQueryBuilder(directory, suppliersConfig, clock),
                directory,
                orderHistoryService,
                new IngestionMetrics(meterRegistry),
                config,
                clock,
                Schedulers.immediate());
    }

    private static RawEmail email(String id) {
        return RawEmail.builder()
                .id(id)
                .subject("Order " + id)
                .sender("orders@uline.com")
                .date("2024-01-31")
                .body("Order body " + id)
                .build();
    }

    private static ExtractedOrder orderFor(RawEmail email) {
        return ExtractedOrder.builder()
                .id("order-" + email.getId())
                .originalEmailId(email.getId())
                .supplier("Uline")
                .orderDate(LocalDate.of(2024, 1, 31))
                .item(LineItem.builder().name("Packing Tape").normalizedName("packing tape").quantity(2).build())
                .confidence(0.95)
                .build();
    }

    private void stubSearch(List<String> ids) {
        when(emailProvider.search(eq(OWNER), anyString(), anyInt())).thenReturn(Mono.just(ids));
    }

    private void stubFetch() {
        when(emailProvider.fetch(eq(OWNER), anyString()))
                .thenAnswer(inv -> Mono.just(email(inv.getArgument(1))));
    }

    private IngestionJob startAndGet(List<String> domains, JobCategory category) {
        AtomicReference<String> jobId = new AtomicReference<>();
        StepVerifier.create(orchestrator.start(OWNER, domains, category))
                .consumeNextWith(jobId::set)
                .verifyComplete();
        return orchestrator.getStatus(jobId.get());
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessfulRunTests {

        @Test
        @DisplayName("Should process every candidate and absorb per-item failures")
        void shouldProcessCandidates() {
            stubSearch(List.of("m1", "m2", "m3"));
            stubFetch();
            when(orderExtractor.extract(any())).thenAnswer(inv -> {
                RawEmail email = inv.getArgument(0);
                return switch (email.getId()) {
                    case "m1" -> Mono.just(orderFor(email));
                    case "m2" -> Mono.empty();
                    default -> Mono.error(new ExtractionException("bad output"));
                };
            });

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getProgress().getTotal()).isEqualTo(3);
            assertThat(job.getProgress().getProcessed()).isEqualTo(3);
            assertThat(job.getProgress().getSuccess()).isEqualTo(1);
            assertThat(job.getProgress().getFailed()).isEqualTo(1);
            assertThat(job.getProgress().getCurrentTask()).isEqualTo("Completed");
            assertThat(job.getCurrentEmail()).isNull();
            assertThat(job.getOrders()).extracting(ExtractedOrder::getId).containsExactly("order-m1");
            assertThat(job.getLogs().newest()).isEqualTo("[12:00:00] Job completed. Found 1 orders.");
            assertThat(job.getLogs().asList()).anyMatch(line -> line.contains("Found order from Uline"));
            assertThat(job.getLogs().asList()).anyMatch(line -> line.contains("Failed to process email m3"));

            verify(orderHistoryService).saveOrders(eq(OWNER), argThat(orders -> orders.size() == 1));
            assertThat(meterRegistry.counter("order_scanner_jobs_completed_total", "category", "other").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("order_scanner_emails_processed_total").count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Should fill in the source email id when the extractor leaves it out")
        void shouldFillOriginalEmailId() {
            stubSearch(List.of("m1", "m2", "m3"));
            stubFetch();
            when(orderExtractor.extract(any())).thenAnswer(inv -> Mono.just(
                    orderFor(inv.getArgument(0)).toBuilder().originalEmailId(null).build()));

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(job.getOrders()).extracting(ExtractedOrder::getOriginalEmailId)
                    .containsExactly("m1", "m2", "m3");
        }

        @Test
        @DisplayName("Should only ever advance processed")
        void shouldAdvanceProcessedMonotonically() {
            stubSearch(List.of("m1", "m2", "m3", "m4"));
            stubFetch();
            List<Integer> observed = new ArrayList<>();
            when(orderExtractor.extract(any())).thenAnswer(inv -> {
                observed.add(jobStore.findLatestForOwner(OWNER).orElseThrow().getProgress().getProcessed());
                return Mono.empty();
            });

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(observed).containsExactly(0, 1, 2, 3);
            assertThat(job.getProgress().getProcessed()).isEqualTo(4);
            verify(orderHistoryService, never()).saveOrders(anyString(), any());
        }

        @Test
        @DisplayName("Should show the email being analyzed")
        void shouldExposeCurrentEmail() {
            stubSearch(List.of("m1", "m2", "m3"));
            stubFetch();
            List<String> previews = new ArrayList<>();
            when(orderExtractor.extract(any())).thenAnswer(inv -> {
                IngestionJob running = jobStore.findLatestForOwner(OWNER).orElseThrow();
                previews.add(running.getCurrentEmail().id() + "|" + running.getProgress().getCurrentTask());
                return Mono.empty();
            });

            startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(previews).containsExactly("m1|Analyzing: Order m1", "m2|Analyzing: Order m2",
                    "m3|Analyzing: Order m3");
        }

        @Test
        @DisplayName("Should complete at once when there are no candidates")
        void shouldCompleteWithoutCandidates() {
            when(emailProvider.search(eq(OWNER), anyString(), anyInt())).thenReturn(Mono.just(List.of()));

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getProgress().getTotal()).isZero();
            verifyNoInteractions(orderExtractor);
        }
    }

    @Nested
    @DisplayName("Candidate search")
    class SearchTests {

        @Test
        @DisplayName("Should broaden the search when the strict query finds too little")
        void shouldFallBackWhenStrictIsThin() {
            when(emailProvider.search(eq(OWNER), anyString(), anyInt())).thenAnswer(inv -> {
                String query = inv.getArgument(1);
                return Mono.just(query.contains("subject:(") ? List.of("m1") : List.of("m1", "m2"));
            });
            stubFetch();
            when(orderExtractor.extract(any())).thenReturn(Mono.empty());

            IngestionJob job = startAndGet(List.of("mcmaster.com"), JobCategory.PRIORITY);

            assertThat(job.getProgress().getTotal()).isEqualTo(2);
            assertThat(job.getLogs().asList()).anyMatch(line -> line.contains("broadening search"));
        }

        @Test
        @DisplayName("Should search every alias of a priority domain")
        void shouldExpandAliases() {
            stubSearch(List.of());
            ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);

            startAndGet(List.of("mcmaster-carr.com"), JobCategory.PRIORITY);

            verify(emailProvider, times(2)).search(eq(OWNER), query.capture(), eq(50));
            assertThat(query.getAllValues().get(0))
                    .startsWith("(from:mcmaster.com OR from:mcmaster-carr.com) subject:(")
                    .endsWith("after:2025/02/17");
            assertThat(query.getAllValues().get(1))
                    .isEqualTo("(from:mcmaster.com OR from:mcmaster-carr.com) after:2025/02/17");
        }

        @Test
        @DisplayName("Should use the configured marketplace domains when none are given")
        void shouldDefaultMarketplaceDomains() {
            stubSearch(List.of("m1", "m2", "m3"));
            stubFetch();
            when(orderExtractor.extract(any())).thenReturn(Mono.empty());
            ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);

            IngestionJob job = startAndGet(List.of(), JobCategory.MARKETPLACE);

            verify(emailProvider).search(eq(OWNER), query.capture(), anyInt());
            assertThat(query.getValue()).startsWith("(from:amazon.com) subject:(");
            assertThat(job.getCategory()).isEqualTo(JobCategory.MARKETPLACE);
        }

        @Test
        @DisplayName("Should merge fallback ids without duplicates up to the limit")
        void shouldMergeCandidates() {
            assertThat(IngestionOrchestrator.mergeCandidates(List.of("a", "b"), List.of("b", "c", "d"), 3))
                    .containsExactly("a", "b", "c");
            assertThat(IngestionOrchestrator.mergeCandidates(List.of("a"), List.of(), 3)).containsExactly("a");
        }
    }

    @Nested
    @DisplayName("Start failures")
    class StartFailureTests {

        @Test
        @DisplayName("Should retry rate limits at start and then succeed")
        void shouldRetryRateLimits() {
            RateLimitedException rateLimited = new RateLimitedException("429");
            when(emailProvider.search(eq(OWNER), anyString(), anyInt()))
                    .thenReturn(Mono.error(rateLimited), Mono.error(rateLimited), Mono.just(List.of()));

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getLogs().asList()).filteredOn(line -> line.contains("Rate limited, retrying")).hasSize(2);
        }

        @Test
        @DisplayName("Should surface the rate limit once the retry budget is spent")
        void shouldSurfaceRateLimit() {
            when(emailProvider.search(eq(OWNER), anyString(), anyInt()))
                    .thenReturn(Mono.error(new RateLimitedException("429")));

            StepVerifier.create(orchestrator.start(OWNER, List.of("uline.com"), JobCategory.OTHER))
                    .expectError(RateLimitedException.class)
                    .verify(Duration.ofSeconds(5));

            verify(emailProvider, times(4)).search(eq(OWNER), anyString(), anyInt());
            IngestionJob job = orchestrator.getLatestForOwner(OWNER).orElseThrow();
            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getFailureReason()).isEqualTo(FailureReason.RATE_LIMITED);
        }

        @Test
        @DisplayName("Should not retry an auth failure")
        void shouldNotRetryAuthFailure() {
            when(emailProvider.search(eq(OWNER), anyString(), anyInt()))
                    .thenReturn(Mono.error(new UpstreamAuthException()));

            StepVerifier.create(orchestrator.start(OWNER, List.of("uline.com"), JobCategory.OTHER))
                    .expectError(UpstreamAuthException.class)
                    .verify();

            verify(emailProvider, times(1)).search(eq(OWNER), anyString(), anyInt());
            IngestionJob job = orchestrator.getLatestForOwner(OWNER).orElseThrow();
            assertThat(job.getFailureReason()).isEqualTo(FailureReason.UPSTREAM_AUTH);
            assertThat(job.getError()).isEqualTo(UpstreamAuthException.REAUTHENTICATE);
        }

        @Test
        @DisplayName("Should fail the job when the start is cancelled during the search")
        void shouldFailCancelledStart() {
            when(emailProvider.search(eq(OWNER), anyString(), anyInt())).thenReturn(Mono.never());

            Disposable subscription = orchestrator.start(OWNER, List.of("uline.com"), JobCategory.OTHER).subscribe();
            subscription.dispose();

            IngestionJob job = orchestrator.getLatestForOwner(OWNER).orElseThrow();
            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getFailureReason()).isEqualTo(FailureReason.START_CANCELLED);
            assertThat(job.getLogs().newest()).contains("Job failed: Job start cancelled");
            assertThat(meterRegistry.counter("order_scanner_jobs_failed_total", "category", "other").count())
                    .isEqualTo(1.0);

            assertThat(jobStore.evictExpired(Duration.ofSeconds(-1))).isEqualTo(1);
            assertThat(jobStore.size()).isZero();
            verifyNoInteractions(orderExtractor);
        }

        @Test
        @DisplayName("Should leave a launched run alone when the caller cancels afterwards")
        void shouldIgnoreCancelAfterLaunch() {
            stubSearch(List.of("m1", "m2", "m3"));
            when(emailProvider.fetch(eq(OWNER), anyString())).thenReturn(Mono.never());

            AtomicReference<String> jobId = new AtomicReference<>();
            Disposable subscription = orchestrator.start(OWNER, List.of("uline.com"), JobCategory.OTHER)
                    .subscribe(jobId::set);
            subscription.dispose();

            assertThat(jobId.get()).isNotNull();
            assertThat(orchestrator.getStatus(jobId.get()).getStatus()).isEqualTo(JobStatus.RUNNING);
        }

        @Test
        @DisplayName("Should reject a start without owner or usable domains")
        void shouldRejectInvalidStart() {
            StepVerifier.create(orchestrator.start(" ", List.of("uline.com"), JobCategory.OTHER))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            StepVerifier.create(orchestrator.start(OWNER, List.of(), JobCategory.OTHER))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            StepVerifier.create(orchestrator.start(OWNER, List.of("not a domain"), JobCategory.OTHER))
                    .expectError(IllegalArgumentException.class)
                    .verify();

            assertThat(jobStore.size()).isZero();
            verifyNoInteractions(emailProvider);
        }
    }

    @Nested
    @DisplayName("Fatal run failures")
    class RunFailureTests {

        @Test
        @DisplayName("Should fail on lost credentials and keep the orders found so far")
        void shouldFailOnAuthDuringFetch() {
            stubSearch(List.of("m1", "m2", "m3"));
            when(emailProvider.fetch(OWNER, "m1")).thenReturn(Mono.just(email("m1")));
            when(emailProvider.fetch(OWNER, "m2")).thenReturn(Mono.error(new UpstreamAuthException()));
            when(orderExtractor.extract(any())).thenAnswer(inv -> Mono.just(orderFor(inv.getArgument(0))));

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getFailureReason()).isEqualTo(FailureReason.UPSTREAM_AUTH);
            assertThat(job.getOrders()).hasSize(1);
            assertThat(job.getProgress().getProcessed()).isEqualTo(1);
            verify(emailProvider, never()).fetch(OWNER, "m3");
            verify(orderHistoryService).saveOrders(eq(OWNER), argThat(orders -> orders.size() == 1));
        }

        @Test
        @DisplayName("Should fail after repeated extraction outages")
        void shouldFailOnExtractionOutage() {
            stubSearch(List.of("m1", "m2", "m3", "m4", "m5"));
            stubFetch();
            when(orderExtractor.extract(any()))
                    .thenReturn(Mono.error(new ExtractionUnavailableException("down", null)));

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getFailureReason()).isEqualTo(FailureReason.EXTRACTION_UNAVAILABLE);
            assertThat(job.getProgress().getFailed()).isEqualTo(2);
            assertThat(meterRegistry.counter("order_scanner_jobs_failed_total", "category", "other").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should ride out an outage that recovers")
        void shouldSurviveShortOutage() {
            stubSearch(List.of("m1", "m2", "m3", "m4"));
            stubFetch();
            ExtractionUnavailableException down = new ExtractionUnavailableException("down", null);
            when(orderExtractor.extract(any()))
                    .thenReturn(Mono.error(down), Mono.error(down), Mono.empty(), Mono.error(down));

            IngestionJob job = startAndGet(List.of("uline.com"), JobCategory.OTHER);

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getProgress().getFailed()).isEqualTo(3);
            assertThat(job.getProgress().getProcessed()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Supersession and lookup")
    class SupersessionTests {

        @Test
        @DisplayName("Should stop a superseded run and keep its orders")
        void shouldStopSupersededRun() {
            stubSearch(List.of("m1", "m2", "m3"));
            when(emailProvider.fetch(OWNER, "m1")).thenReturn(Mono.just(email("m1")));
            when(emailProvider.fetch(OWNER, "m2")).thenAnswer(inv -> {
                jobStore.create(OWNER, JobCategory.PRIORITY);
                return Mono.just(email("m2"));
            });
            when(orderExtractor.extract(any())).thenAnswer(inv -> Mono.just(orderFor(inv.getArgument(0))));

            AtomicReference<String> jobId = new AtomicReference<>();
            StepVerifier.create(orchestrator.start(OWNER, List.of("uline.com"), JobCategory.OTHER))
                    .consumeNextWith(jobId::set)
                    .verifyComplete();

            IngestionJob job = orchestrator.getStatus(jobId.get());
            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(job.getFailureReason()).isEqualTo(FailureReason.SUPERSEDED);
            assertThat(job.getOrders()).extracting(ExtractedOrder::getId).containsExactly("order-m1");
            assertThat(job.getProgress().getProcessed()).isEqualTo(1);
            verify(emailProvider, never()).fetch(OWNER, "m3");
            verify(orderHistoryService).saveOrders(eq(OWNER), argThat(orders -> orders.size() == 1));
            assertThat(orchestrator.getLatestForOwner(OWNER).orElseThrow().getId()).isNotEqualTo(jobId.get());
        }

        @Test
        @DisplayName("Should keep only the last category of a batch running under owner-wide supersession")
        void shouldSupersedeEarlierBatchJobsPerOwner() {
            config.setStaggerDelay(Duration.ZERO);
            stubSearch(List.of("m1", "m2", "m3"));
            when(emailProvider.fetch(eq(OWNER), anyString())).thenReturn(Mono.never());
            StaggeredIngestionLauncher launcher = new StaggeredIngestionLauncher(orchestrator, config);

            List<LaunchOutcome> outcomes = launcher.startAll(OWNER, List.of(
                    new LaunchRequest(JobCategory.MARKETPLACE, List.of("amazon.com")),
                    new LaunchRequest(JobCategory.PRIORITY, List.of("mcmaster.com")),
                    new LaunchRequest(JobCategory.OTHER, List.of("uline.com")))).block(Duration.ofSeconds(5));

            assertThat(outcomes).hasSize(3).allMatch(LaunchOutcome::isStarted);
            assertThat(outcomes.subList(0, 2))
                    .extracting(outcome -> orchestrator.getStatus(outcome.jobId()).getFailureReason())
                    .containsOnly(FailureReason.SUPERSEDED);
            assertThat(orchestrator.getStatus(outcomes.get(2).jobId()).getStatus()).isEqualTo(JobStatus.RUNNING);
        }

        @Test
        @DisplayName("Should report unknown jobs as not found")
        void shouldThrowForUnknownJob() {
            assertThatThrownBy(() -> orchestrator.getStatus("missing"))
                    .isInstanceOf(JobNotFoundException.class)
                    .hasMessageContaining("missing");
            assertThat(orchestrator.getLatestForOwner("nobody")).isEmpty();
        }

        @Test
        @DisplayName("Should classify failures")
        void shouldClassifyFailures() {
            assertThat(IngestionOrchestrator.reasonFor(new UpstreamAuthException())).isEqualTo(FailureReason.UPSTREAM_AUTH);
            assertThat(IngestionOrchestrator.reasonFor(new RateLimitedException("x"))).isEqualTo(FailureReason.RATE_LIMITED);
            assertThat(IngestionOrchestrator.reasonFor(new ExtractionUnavailableException("x", null)))
                    .isEqualTo(FailureReason.EXTRACTION_UNAVAILABLE);
            assertThat(IngestionOrchestrator.reasonFor(new StartCancelledException()))
                    .isEqualTo(FailureReason.START_CANCELLED);
            assertThat(IngestionOrchestrator.reasonFor(new IllegalStateException("x"))).isEqualTo(FailureReason.FETCH_ERROR);
        }
    }
}

package dev.orderscanner.metrics;

import dev.orderscanner.model.JobCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus metrics for ingestion runs.
 */
@Component
public class IngestionMetrics {

    private static final String TAG_CATEGORY = "category";
    private static final String TAG_PROVIDER = "provider";
    private final MeterRegistry registry;

    private final Counter emailsProcessedCounter;
    private final Counter ordersExtractedCounter;
    private final Counter extractionFailuresCounter;
    private final Counter jobsEvictedCounter;

    private final ConcurrentHashMap<String, Timer> fetchTimers = new ConcurrentHashMap<>();

    public IngestionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.emailsProcessedCounter = Counter.builder("order_scanner_emails_processed_total")
                .description("Candidate emails processed by ingestion jobs")
                .register(registry);

        this.ordersExtractedCounter = Counter.builder("order_scanner_orders_extracted_total")
                .description("Purchase orders extracted from email")
                .register(registry);

        this.extractionFailuresCounter = Counter.builder("order_scanner_extraction_failures_total")
                .description("Emails whose extraction failed")
                .register(registry);

        this.jobsEvictedCounter = Counter.builder("order_scanner_jobs_evicted_total")
                .description("Finished jobs evicted after the retention window")
                .register(registry);
    }

    public void recordJobStarted(JobCategory category) {
        jobCounter("order_scanner_jobs_started_total", category).increment();
    }

    public void recordJobCompleted(JobCategory category) {
        jobCounter("order_scanner_jobs_completed_total", category).increment();
    }

    public void recordJobFailed(JobCategory category) {
        jobCounter("order_scanner_jobs_failed_total", category).increment();
    }

    public void recordEmailProcessed() {
        emailsProcessedCounter.increment();
    }

    public void recordOrderExtracted() {
        ordersExtractedCounter.increment();
    }

    public void recordExtractionFailure() {
        extractionFailuresCounter.increment();
    }

    public void recordJobsEvicted(int count) {
        jobsEvictedCounter.increment(count);
    }

    /**
     * Get or create the fetch latency timer for an email provider.
     */
    public Timer getFetchTimer(String provider) {
        return fetchTimers.computeIfAbsent(provider, name ->
                Timer.builder("order_scanner_provider_fetch_duration")
                        .description("Time to call the email provider")
                        .tag(TAG_PROVIDER, name)
                        .register(registry));
    }

    public void recordFetchLatency(String provider, long latencyMs) {
        getFetchTimer(provider).record(Duration.ofMillis(latencyMs));
    }

    private Counter jobCounter(String name, JobCategory category) {
        return Counter.builder(name)
                .tag(TAG_CATEGORY, category.getKey())
                .register(registry);
    }
}

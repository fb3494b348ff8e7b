package dev.orderscanner.service;

import dev.orderscanner.config.IngestionConfig;
import dev.orderscanner.metrics.IngestionMetrics;
import dev.orderscanner.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically evicts finished jobs past the retention window and purges
 * old order history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCleanupService {

    private final JobStore jobStore;
    private final IngestionConfig config;
    private final IngestionMetrics metrics;
    private final OrderHistoryService orderHistoryService;

    @Scheduled(fixedDelayString = "${ingestion.cleanup-interval:PT10M}",
            initialDelayString = "${ingestion.cleanup-interval:PT10M}")
    public int evictExpiredJobs() {
        int evicted = jobStore.evictExpired(config.getRetention());
        metrics.recordJobsEvicted(evicted);
        log.debug("Job cleanup: {} evicted, {} remaining", evicted, jobStore.size());
        return evicted;
    }

    /**
     * Purge saved orders older than {@code history-retention-days}. Zero or
     * less keeps everything.
     */
    @Scheduled(cron = "${ingestion.history-cleanup-cron:0 0 3 * * *}")
    public long purgeOrderHistory() {
        int days = config.getHistoryRetentionDays();
        if (days <= 0) {
            return 0;
        }
        return orderHistoryService.cleanupOlderThan(days);
    }
}

package dev.orderscanner.store;

import dev.orderscanner.config.IngestionConfig;
import dev.orderscanner.config.IngestionConfig.SupersessionScope;
import dev.orderscanner.model.FailureReason;
import dev.orderscanner.model.IngestionJob;
import dev.orderscanner.model.JobCategory;
import dev.orderscanner.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory JobStore. Each job lives in its own AtomicReference holding an
 * immutable snapshot: readers never lock, writers compare-and-swap whole
 * snapshots.
 */
@Slf4j
@Component
public class InMemoryJobStore implements JobStore {

    static final String SUPERSEDED_MESSAGE = "Cancelled - new job started";

    private final Map<String, AtomicReference<IngestionJob>> jobs = new ConcurrentHashMap<>();
    private final Map<String, String> latestByOwner = new ConcurrentHashMap<>();
    private final Map<String, String> latestBySlot = new ConcurrentHashMap<>();

    private final Clock clock;
    private final int logCapacity;
    private final SupersessionScope supersessionScope;

    public InMemoryJobStore(IngestionConfig ingestionConfig, Clock clock) {
        this.clock = clock;
        this.logCapacity = ingestionConfig.getLogCapacity();
        this.supersessionScope = ingestionConfig.getSupersessionScope();
    }

    @Override
    public IngestionJob create(String ownerKey, JobCategory category) {
        Instant now = clock.instant();
        IngestionJob job = IngestionJob.pending(UUID.randomUUID().toString(), ownerKey, category, logCapacity, now);

        latestBySlot.compute(slotKey(ownerKey, category), (slot, previousId) -> {
            if (previousId != null) {
                supersede(previousId, job.getId(), now);
            }
            jobs.put(job.getId(), new AtomicReference<>(job));
            return job.getId();
        });
        latestByOwner.put(ownerKey, job.getId());

        log.info("Created job {} for owner {} ({})", job.getId(), ownerKey, category.getKey());
        return job;
    }

    private void supersede(String previousId, String newId, Instant now) {
        AtomicReference<IngestionJob> ref = jobs.get(previousId);
        if (ref == null) {
            return;
        }
        IngestionJob result = ref.updateAndGet(current -> current.getStatus() != JobStatus.RUNNING
                ? current
                : current.failed(FailureReason.SUPERSEDED, SUPERSEDED_MESSAGE)
                        .withLog("Superseded by job " + newId)
                        .toBuilder().updatedAt(now).build());
        if (result.getFailureReason() == FailureReason.SUPERSEDED) {
            log.info("Job {} superseded by {}", previousId, newId);
        }
    }

    @Override
    public Optional<IngestionJob> get(String jobId) {
        AtomicReference<IngestionJob> ref = jobs.get(jobId);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    @Override
    public Optional<IngestionJob> findLatestForOwner(String ownerKey) {
        String jobId = latestByOwner.get(ownerKey);
        return jobId == null ? Optional.empty() : get(jobId);
    }

    @Override
    public Optional<IngestionJob> update(String jobId, UnaryOperator<IngestionJob> mutation) {
        AtomicReference<IngestionJob> ref = jobs.get(jobId);
        if (ref == null) {
            log.debug("Update for unknown job {} ignored", jobId);
            return Optional.empty();
        }

        AtomicBoolean dropped = new AtomicBoolean();
        IngestionJob result = ref.updateAndGet(current -> {
            dropped.set(current.isTerminal());
            if (current.isTerminal()) {
                return current;
            }
            return mutation.apply(current).toBuilder().updatedAt(clock.instant()).build();
        });

        if (dropped.get()) {
            log.debug("Job {} is {} - late write dropped", jobId, result.getStatus().toJson());
        }
        return Optional.of(result);
    }

    @Override
    public int evictExpired(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        AtomicInteger evicted = new AtomicInteger();

        jobs.entrySet().removeIf(entry -> {
            IngestionJob job = entry.getValue().get();
            if (job.getStatus() == JobStatus.RUNNING || !job.getUpdatedAt().isBefore(cutoff)) {
                return false;
            }
            latestByOwner.remove(job.getOwnerKey(), job.getId());
            latestBySlot.remove(slotKey(job.getOwnerKey(), job.getCategory()), job.getId());
            evicted.incrementAndGet();
            return true;
        });

        if (evicted.get() > 0) {
            log.info("Evicted {} jobs older than {}", evicted.get(), retention);
        }
        return evicted.get();
    }

    @Override
    public int size() {
        return jobs.size();
    }

    private String slotKey(String ownerKey, JobCategory category) {
        return supersessionScope == SupersessionScope.OWNER_AND_CATEGORY
                ? ownerKey + "|" + category.getKey()
                : ownerKey;
    }
}

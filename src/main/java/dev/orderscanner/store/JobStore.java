package dev.orderscanner.store;

import dev.orderscanner.model.IngestionJob;
import dev.orderscanner.model.JobCategory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Holds the state of in-flight and recently finished ingestion jobs.
 * Reads return immutable snapshots; each update is applied atomically.
 */
public interface JobStore {

    /**
     * Create a pending job. A running job occupying the same supersession
     * slot is marked failed with reason SUPERSEDED; its orders are kept.
     */
    IngestionJob create(String ownerKey, JobCategory category);

    Optional<IngestionJob> get(String jobId);

    /**
     * The most recently created job for an owner, if it has not been evicted.
     */
    Optional<IngestionJob> findLatestForOwner(String ownerKey);

    /**
     * Apply a mutation to a job. Mutations against a terminal job are dropped
     * and the current snapshot is returned unchanged.
     *
     * @return the resulting snapshot, or empty if the job is unknown
     */
    Optional<IngestionJob> update(String jobId, UnaryOperator<IngestionJob> mutation);

    /**
     * Remove every job that is not running and whose last update is older
     * than the retention window.
     *
     * @return number of evicted jobs
     */
    int evictExpired(Duration retention);

    int size();
}

package dev.orderscanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of one ingestion run. Every mutation produces a new
 * snapshot, so a reader always sees progress, orders and logs from the same
 * update.
 */
@Value
@Builder(toBuilder = true)
public class IngestionJob {
    String id;
    String ownerKey;
    JobCategory category;
    JobStatus status;
    JobProgress progress;
    EmailPreview currentEmail;
    List<ExtractedOrder> orders;
    BoundedLog logs;
    Instant createdAt;
    Instant updatedAt;
    String error;
    FailureReason failureReason;

    public static IngestionJob pending(String id, String ownerKey, JobCategory category,
                                       int logCapacity, Instant now) {
        return IngestionJob.builder()
                .id(id)
                .ownerKey(ownerKey)
                .category(category)
                .status(JobStatus.PENDING)
                .progress(JobProgress.queued())
                .orders(List.of())
                .logs(BoundedLog.empty(logCapacity))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public IngestionJob withLog(String line) {
        return toBuilder().logs(logs.push(line)).build();
    }

    public IngestionJob withOrder(ExtractedOrder order) {
        List<ExtractedOrder> next = new ArrayList<>(orders.size() + 1);
        next.addAll(orders);
        next.add(order);
        return toBuilder().orders(Collections.unmodifiableList(next)).build();
    }

    public IngestionJob failed(FailureReason reason, String message) {
        return toBuilder()
                .status(JobStatus.FAILED)
                .failureReason(reason)
                .error(message)
                .currentEmail(null)
                .build();
    }
}

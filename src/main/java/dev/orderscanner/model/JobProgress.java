package dev.orderscanner.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class JobProgress {
    int total;
    int processed;
    int success;
    int failed;
    String currentTask;

    public static JobProgress queued() {
        return JobProgress.builder().currentTask("Queued...").build();
    }
}

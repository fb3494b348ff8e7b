package dev.orderscanner.controller.dto;

import dev.orderscanner.model.JobCategory;

public record StartJobResponse(String jobId, JobCategory category) {
}

package dev.orderscanner.controller.dto;

import dev.orderscanner.model.JobCategory;

import java.util.List;

/**
 * Body of a single job start. An empty domain list scans the category's
 * configured suppliers.
 */
public record StartJobRequest(String ownerKey, JobCategory category, List<String> domains) {
}

package dev.orderscanner.controller.dto;

import dev.orderscanner.service.StaggeredIngestionLauncher.LaunchOutcome;

import java.util.List;

public record BatchStartResponse(String ownerKey, List<LaunchOutcome> jobs) {
}

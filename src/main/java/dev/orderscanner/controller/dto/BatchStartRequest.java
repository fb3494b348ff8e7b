package dev.orderscanner.controller.dto;

import dev.orderscanner.service.StaggeredIngestionLauncher.LaunchRequest;

import java.util.List;

public record BatchStartRequest(String ownerKey, List<LaunchRequest> jobs) {
}

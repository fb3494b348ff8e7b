package dev.orderscanner.controller;

import dev.orderscanner.controller.dto.BatchStartRequest;
import dev.orderscanner.controller.dto.BatchStartResponse;
import dev.orderscanner.controller.dto.StartJobRequest;
import dev.orderscanner.controller.dto.StartJobResponse;
import dev.orderscanner.inventory.InventoryAggregator;
import dev.orderscanner.model.IngestionJob;
import dev.orderscanner.model.ItemVelocityProfile;
import dev.orderscanner.model.JobCategory;
import dev.orderscanner.service.IngestionOrchestrator;
import dev.orderscanner.service.StaggeredIngestionLauncher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Job lifecycle API polled by the client.
 */
@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final IngestionOrchestrator orchestrator;
    private final StaggeredIngestionLauncher launcher;
    private final InventoryAggregator inventoryAggregator;

    @PostMapping
    public Mono<ResponseEntity<StartJobResponse>> startJob(@RequestBody StartJobRequest request) {
        JobCategory category = request.category() != null ? request.category() : JobCategory.OTHER;
        log.info("Start requested: owner={}, category={}", request.ownerKey(), category.getKey());

        return orchestrator.start(request.ownerKey(), request.domains(), category)
                .map(jobId -> ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(new StartJobResponse(jobId, category)));
    }

    /**
     * Start several categories with staggered starts. Per-category failures
     * are reported in the body rather than failing the request.
     */
    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchStartResponse>> startBatch(@RequestBody BatchStartRequest request) {
        if (request.ownerKey() == null || request.ownerKey().isBlank()) {
            return Mono.error(new IllegalArgumentException("Owner key is required"));
        }
        if (request.jobs() == null || request.jobs().isEmpty()) {
            return Mono.error(new IllegalArgumentException("At least one job category is required"));
        }
        return launcher.startAll(request.ownerKey(), request.jobs())
                .map(outcomes -> ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(new BatchStartResponse(request.ownerKey(), outcomes)));
    }

    @GetMapping("/{jobId}")
    public IngestionJob getJob(@PathVariable String jobId) {
        return orchestrator.getStatus(jobId);
    }

    @GetMapping("/latest")
    public ResponseEntity<IngestionJob> getLatest(@RequestParam("owner") String ownerKey) {
        return orchestrator.getLatestForOwner(ownerKey)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Velocity profiles over the orders a job has accumulated so far.
     */
    @GetMapping("/{jobId}/inventory")
    public List<ItemVelocityProfile> getJobInventory(@PathVariable String jobId) {
        return inventoryAggregator.aggregate(orchestrator.getStatus(jobId).getOrders());
    }
}

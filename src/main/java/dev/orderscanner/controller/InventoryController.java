package dev.orderscanner.controller;

import dev.orderscanner.controller.dto.DigestResponse;
import dev.orderscanner.export.CsvExportService;
import dev.orderscanner.inventory.InventoryAggregator;
import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.ItemVelocityProfile;
import dev.orderscanner.service.OrderHistoryService;
import dev.orderscanner.service.ReorderDigestService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Inventory recommendations and exports over the owner's saved order history.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InventoryController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv;charset=UTF-8");

    private final OrderHistoryService orderHistoryService;
    private final InventoryAggregator inventoryAggregator;
    private final CsvExportService csvExportService;
    private final ReorderDigestService reorderDigestService;

    @GetMapping("/inventory")
    public Mono<List<ItemVelocityProfile>> getInventory(@RequestParam("owner") String ownerKey) {
        return loadHistory(ownerKey).map(inventoryAggregator::aggregate);
    }

    @GetMapping("/inventory/export.csv")
    public Mono<ResponseEntity<String>> exportInventory(@RequestParam("owner") String ownerKey) {
        return loadHistory(ownerKey)
                .map(inventoryAggregator::aggregate)
                .map(csvExportService::exportVelocity)
                .map(csv -> csvResponse("velocity-profiles.csv", csv));
    }

    @GetMapping("/orders/export.csv")
    public Mono<ResponseEntity<String>> exportOrders(@RequestParam("owner") String ownerKey) {
        return loadHistory(ownerKey)
                .map(csvExportService::exportOrders)
                .map(csv -> csvResponse("orders.csv", csv));
    }

    @PostMapping("/inventory/digest")
    public Mono<DigestResponse> sendDigest(@RequestParam("owner") String ownerKey) {
        return loadHistory(ownerKey)
                .map(inventoryAggregator::aggregate)
                .flatMap(profiles -> reorderDigestService.sendReorderDigest(ownerKey, profiles)
                        .map(sent -> new DigestResponse(ownerKey, profiles.size(), sent)));
    }

    private Mono<List<ExtractedOrder>> loadHistory(String ownerKey) {
        if (ownerKey == null || ownerKey.isBlank()) {
            return Mono.error(new IllegalArgumentException("Owner key is required"));
        }
        return Mono.fromCallable(() -> orderHistoryService.loadHistory(ownerKey))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<String> csvResponse(String filename, String csv) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .body(csv);
    }
}

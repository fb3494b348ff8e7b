package dev.orderscanner.controller;

import dev.orderscanner.model.DiscoveredSupplier;
import dev.orderscanner.supplier.SupplierMergeService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/suppliers")
@RequiredArgsConstructor
public class SupplierController {

    private final SupplierMergeService supplierMergeService;

    /**
     * Merge discovery results with the configured priority suppliers into
     * the ranked list offered for selection.
     */
    @PostMapping("/merge")
    public List<DiscoveredSupplier> merge(@RequestBody List<DiscoveredSupplier> discovered) {
        return supplierMergeService.mergeWithPriority(discovered);
    }
}

package dev.orderscanner.service;

import dev.orderscanner.entity.OrderLineRecord;
import dev.orderscanner.entity.OrderRecord;
import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.LineItem;
import dev.orderscanner.repository.OrderRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for the owner's persisted order history using SQLite storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderHistoryService {

    private final OrderRecordRepository orderRecordRepository;
    private final Clock clock;

    /**
     * Save orders for an owner, skipping any whose source email is already stored.
     *
     * @param ownerKey Owner of the orders
     * @param orders   Orders to save
     * @return Number of orders actually saved
     */
    @Transactional
    public int saveOrders(String ownerKey, List<ExtractedOrder> orders) {
        if (orders == null || orders.isEmpty()) {
            return 0;
        }

        Set<String> emailIds = orders.stream()
                .map(ExtractedOrder::getOriginalEmailId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Set<String> seen = emailIds.isEmpty()
                ? new HashSet<>()
                : new HashSet<>(orderRecordRepository.findExistingEmailIds(ownerKey, emailIds));

        LocalDateTime now = LocalDateTime.now(clock);
        List<OrderRecord> records = new ArrayList<>();
        for (ExtractedOrder order : orders) {
            if (order.getOriginalEmailId() != null && !seen.add(order.getOriginalEmailId())) {
                continue;
            }
            records.add(toRecord(ownerKey, order, now));
        }

        orderRecordRepository.saveAll(records);
        log.info("Order history: {} orders for {}, {} already stored, {} saved",
                orders.size(), ownerKey, orders.size() - records.size(), records.size());
        return records.size();
    }

    /**
     * Load every stored order for an owner, in the order they were saved.
     */
    @Transactional(readOnly = true)
    public List<ExtractedOrder> loadHistory(String ownerKey) {
        return orderRecordRepository.findByOwnerKeyOrderByIdAsc(ownerKey).stream()
                .map(OrderHistoryService::toOrder)
                .toList();
    }

    long countForOwner(String ownerKey) {
        return orderRecordRepository.countByOwnerKey(ownerKey);
    }

    /**
     * Clean up old records (older than specified days).
     *
     * @param daysToKeep Number of days to keep records
     * @return Number of deleted orders
     */
    @Transactional
    public long cleanupOlderThan(int daysToKeep) {
        LocalDateTime cutoffDate = LocalDateTime.now(clock).minusDays(daysToKeep);
        long deleted = orderRecordRepository.deleteBySavedAtBefore(cutoffDate);
        log.info("Cleaned up {} order records older than {} days", deleted, daysToKeep);
        return deleted;
    }

    private static OrderRecord toRecord(String ownerKey, ExtractedOrder order, LocalDateTime savedAt) {
        List<OrderLineRecord> lines = order.getItems().stream()
                .map(item -> OrderLineRecord.builder()
                        .name(item.getName())
                        .normalizedName(item.getNormalizedName())
                        .quantity(item.getQuantity())
                        .unit(item.getUnit())
                        .unitPrice(item.getUnitPrice())
                        .sku(item.getSku())
                        .asin(item.getAsin())
                        .build())
                .collect(Collectors.toCollection(ArrayList::new));

        return OrderRecord.builder()
                .orderId(order.getId())
                .ownerKey(ownerKey)
                .originalEmailId(order.getOriginalEmailId())
                .supplier(order.getSupplier())
                .orderDate(order.getOrderDate())
                .totalAmount(order.getTotalAmount())
                .confidence(order.getConfidence())
                .savedAt(savedAt)
                .lines(lines)
                .build();
    }

    private static ExtractedOrder toOrder(OrderRecord record) {
        return ExtractedOrder.builder()
                .id(record.getOrderId())
                .originalEmailId(record.getOriginalEmailId())
                .supplier(record.getSupplier())
                .orderDate(record.getOrderDate())
                .totalAmount(record.getTotalAmount())
                .confidence(record.getConfidence())
                .items(record.getLines().stream()
                        .map(line -> LineItem.builder()
                                .name(line.getName())
                                .normalizedName(line.getNormalizedName())
                                .quantity(line.getQuantity())
                                .unit(line.getUnit())
                                .unitPrice(line.getUnitPrice())
                                .sku(line.getSku())
                                .asin(line.getAsin())
                                .build())
                        .toList())
                .build();
    }
}

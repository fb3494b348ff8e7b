package dev.orderscanner.inventory;

import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.ItemVelocityProfile;
import dev.orderscanner.model.LineItem;
import dev.orderscanner.model.UsageObservation;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds an order list into one velocity profile per normalized item name.
 * Stateless; the same input always yields the same profiles.
 */
@Component
public class InventoryAggregator {

    static final int LEAD_TIME_DAYS = 7;
    static final double SAFETY_FACTOR = 1.5;
    static final int DEFAULT_CADENCE_DAYS = 30;

    // Absorbs floating point noise before ceil, e.g. 10/30*30 = 10.000000000000002
    private static final double EPSILON = 1e-9;

    /**
     * Build velocity profiles. Orders without a date carry no timing
     * information and are skipped.
     *
     * @param orders Orders to aggregate, not modified
     * @return Profiles in order of each item's first appearance
     */
    public List<ItemVelocityProfile> aggregate(List<ExtractedOrder> orders) {
        Map<String, ItemAccumulator> items = new LinkedHashMap<>();

        for (int orderIndex = 0; orderIndex < orders.size(); orderIndex++) {
            ExtractedOrder order = orders.get(orderIndex);
            if (order == null || order.getOrderDate() == null) {
                continue;
            }
            for (LineItem item : order.getItems()) {
                String key = item.getAggregationKey();
                if (key.isEmpty()) {
                    continue;
                }
                items.computeIfAbsent(key, k -> new ItemAccumulator(k, item, order))
                        .add(orderIndex, order, item);
            }
        }

        return items.values().stream()
                .map(ItemAccumulator::toProfile)
                .toList();
    }

    private static final class ItemAccumulator {
        private final String normalizedName;
        private final String displayName;
        private final String supplier;
        private String sku;
        private final List<UsageObservation> observations = new ArrayList<>();
        private final Set<Integer> orders = new HashSet<>();
        private double totalQuantity;
        private Double lastPrice;

        private ItemAccumulator(String normalizedName, LineItem first, ExtractedOrder order) {
            this.normalizedName = normalizedName;
            this.displayName = first.getName() != null ? first.getName().trim() : normalizedName;
            this.supplier = order.getSupplier();
        }

        private void add(int orderIndex, ExtractedOrder order, LineItem item) {
            orders.add(orderIndex);
            totalQuantity += item.getQuantity();
            if (item.getUnitPrice() != null) {
                lastPrice = item.getUnitPrice();
            }
            if (sku == null && item.getSku() != null && !item.getSku().isBlank()) {
                sku = item.getSku();
            }
            observations.add(new UsageObservation(order.getOrderDate(), item.getQuantity(),
                    item.getUnitPrice(), order.getId()));
        }

        private ItemVelocityProfile toProfile() {
            List<UsageObservation> history = new ArrayList<>(observations);
            history.sort(Comparator.comparing(UsageObservation::date));

            LocalDate first = history.get(0).date();
            LocalDate last = history.get(history.size() - 1).date();
            long daySpan = ChronoUnit.DAYS.between(first, last);
            int orderCount = orders.size();

            double cadence = orderCount > 1 && daySpan > 0
                    ? (double) daySpan / (orderCount - 1)
                    : DEFAULT_CADENCE_DAYS;
            double effectiveSpan = daySpan == 0 ? DEFAULT_CADENCE_DAYS : daySpan;
            double burnRate = totalQuantity / effectiveSpan;

            return ItemVelocityProfile.builder()
                    .normalizedName(normalizedName)
                    .displayName(displayName)
                    .supplier(supplier)
                    .sku(sku)
                    .totalQuantityOrdered(totalQuantity)
                    .orderCount(orderCount)
                    .firstOrderDate(first)
                    .lastOrderDate(last)
                    .daySpan(daySpan)
                    .averageCadenceDays(cadence)
                    .dailyBurnRate(burnRate)
                    .recommendedMin(ceil(burnRate * LEAD_TIME_DAYS * SAFETY_FACTOR))
                    .recommendedOrderQty(ceil(burnRate * Math.max(cadence, DEFAULT_CADENCE_DAYS)))
                    .lastPrice(lastPrice)
                    .nextPredictedOrder(last.plusDays(Math.round(cadence)))
                    .history(List.copyOf(history))
                    .build();
        }

        private static long ceil(double value) {
            return (long) Math.ceil(value - EPSILON);
        }
    }
}

package dev.orderscanner.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Derived consumption statistics for one tracked item. Recomputed from the
 * order set, never persisted on its own.
 */
@Value
@Builder
public class ItemVelocityProfile {
    String normalizedName;
    String displayName;
    String supplier;
    String sku;
    double totalQuantityOrdered;
    int orderCount;
    LocalDate firstOrderDate;
    LocalDate lastOrderDate;
    long daySpan;
    double averageCadenceDays;
    double dailyBurnRate;
    long recommendedMin;
    long recommendedOrderQty;
    Double lastPrice;
    LocalDate nextPredictedOrder;
    List<UsageObservation> history;
}

package dev.orderscanner.export;

import dev.orderscanner.model.ExtractedOrder;
import dev.orderscanner.model.ItemVelocityProfile;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * CSV projections of velocity profiles and orders.
 */
@Service
public class CsvExportService {

    static final List<String> VELOCITY_HEADERS = List.of(
            "Item Name", "Supplier", "SKU", "Total Ordered", "Order Count", "Avg Cadence Days",
            "Daily Burn Rate", "Recommended Min", "Recommended Order Qty", "Next Predicted Order");

    static final List<String> ORDER_HEADERS = List.of(
            "Order ID", "Email ID", "Supplier", "Date", "Total Amount", "Item Count", "Item Names");

    private static final String LINE_SEPARATOR = "\n";

    public String exportVelocity(List<ItemVelocityProfile> profiles) {
        List<String> rows = new ArrayList<>(profiles.size() + 1);
        rows.add(row(VELOCITY_HEADERS));

        for (ItemVelocityProfile profile : profiles) {
            rows.add(row(List.of(
                    profile.getDisplayName() != null ? profile.getDisplayName() : profile.getNormalizedName(),
                    nullToEmpty(profile.getSupplier()),
                    nullToEmpty(profile.getSku()),
                    number(profile.getTotalQuantityOrdered()),
                    String.valueOf(profile.getOrderCount()),
                    fixed(profile.getAverageCadenceDays(), 2),
                    fixed(profile.getDailyBurnRate(), 4),
                    fixed(profile.getRecommendedMin(), 2),
                    fixed(profile.getRecommendedOrderQty(), 2),
                    date(profile.getNextPredictedOrder()))));
        }
        return String.join(LINE_SEPARATOR, rows);
    }

    public String exportOrders(List<ExtractedOrder> orders) {
        List<String> rows = new ArrayList<>(orders.size() + 1);
        rows.add(row(ORDER_HEADERS));

        for (ExtractedOrder order : orders) {
            rows.add(row(List.of(
                    nullToEmpty(order.getId()),
                    nullToEmpty(order.getOriginalEmailId()),
                    nullToEmpty(order.getSupplier()),
                    date(order.getOrderDate()),
                    order.getTotalAmount() != null ? fixed(order.getTotalAmount(), 2) : "",
                    String.valueOf(order.getItems().size()),
                    order.getItems().stream()
                            .map(item -> nullToEmpty(item.getName()))
                            .collect(Collectors.joining("; ")))));
        }
        return String.join(LINE_SEPARATOR, rows);
    }

    /**
     * Quote a field when it contains a comma, quote or line break; inner
     * quotes are doubled.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static String row(List<String> fields) {
        return fields.stream().map(CsvExportService::escape).collect(Collectors.joining(","));
    }

    private static String fixed(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    private static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String date(LocalDate date) {
        return date != null ? date.toString() : "";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}

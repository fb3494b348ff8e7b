package dev.orderscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class LineItem {
    String name;
    String normalizedName;
    double quantity;
    String unit;
    Double unitPrice;
    String sku;
    String asin;

    /**
     * Join key used for aggregation: the explicit normalized name, or the
     * trimmed, lower-cased display name when absent.
     */
    @JsonIgnore
    public String getAggregationKey() {
        if (normalizedName != null && !normalizedName.isBlank()) {
            return normalizedName;
        }
        return normalize(name);
    }

    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}

package dev.orderscanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * A group of supplier domains scanned together, each with its own lookback
 * window and subject keyword policy.
 */
public enum JobCategory {

    MARKETPLACE("amazon", 6),
    PRIORITY("priority", 12),
    OTHER("other", 6);

    private final String key;
    private final int lookbackMonths;

    JobCategory(String key, int lookbackMonths) {
        this.key = key;
        this.lookbackMonths = lookbackMonths;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public int getLookbackMonths() {
        return lookbackMonths;
    }

    public boolean isPriority() {
        return this == PRIORITY;
    }

    @JsonCreator
    public static JobCategory fromKey(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.key.equals(normalized) || c.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job category: " + value));
    }
}

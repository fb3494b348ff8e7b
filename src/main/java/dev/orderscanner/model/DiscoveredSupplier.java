package dev.orderscanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class DiscoveredSupplier {

    public static final String UNKNOWN_CATEGORY = "unknown";

    String domain;
    String displayName;
    int emailCount;
    double score;
    String category;
    List<String> sampleSubjects;
    @JsonProperty("isRecommended")
    boolean recommended;

    public boolean hasKnownCategory() {
        return category != null && !category.isBlank() && !UNKNOWN_CATEGORY.equalsIgnoreCase(category);
    }
}

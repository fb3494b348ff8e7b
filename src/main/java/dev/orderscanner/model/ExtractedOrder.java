package dev.orderscanner.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExtractedOrder {
    String id;
    String originalEmailId;
    String supplier;
    LocalDate orderDate;
    Double totalAmount;
    @Singular
    List<LineItem> items;
    double confidence;
}

package dev.orderscanner.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Embeddable
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineRecord {

    @Column(nullable = false, length = 1000)
    private String name;

    private String normalizedName;

    @Column(nullable = false)
    private double quantity;

    private String unit;

    private Double unitPrice;

    private String sku;

    private String asin;
}

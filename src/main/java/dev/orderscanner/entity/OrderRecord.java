package dev.orderscanner.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Entity for an extracted purchase order kept in the owner's history.
 * One row per (owner, source email).
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_owner_email", columnNames = {"ownerKey", "originalEmailId"}),
        indexes = {
                @Index(name = "idx_owner", columnList = "ownerKey"),
                @Index(name = "idx_saved_at", columnList = "savedAt")
        })
public class OrderRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String orderId;

    @Column(nullable = false)
    private String ownerKey;

    private String originalEmailId;

    @Column(nullable = false)
    private String supplier;

    private LocalDate orderDate;

    private Double totalAmount;

    @Column(nullable = false)
    private double confidence;

    @Column(nullable = false)
    private LocalDateTime savedAt;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_items", joinColumns = @JoinColumn(name = "order_record_id"))
    @OrderColumn(name = "line_index")
    private List<OrderLineRecord> lines = new ArrayList<>();
}

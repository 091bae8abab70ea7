package com.buffrhost.inventory.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A stock keeping unit of one property (ingredient, beverage, amenity).
 *
 * {@code currentStock} is a cached projection of the item's ledger. It has no setter and is
 * only moved by {@code InventoryItemRepository#applyDelta} in the same transaction that
 * appends the matching {@link StockTransaction}.
 */
@Entity
@Table(name = "inventory_items",
        uniqueConstraints = @UniqueConstraint(name = "uk_inventory_property_sku", columnNames = {"property_id", "sku"}),
        indexes = @Index(name = "idx_inventory_property", columnList = "property_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class InventoryItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false, updatable = false)
    private Long propertyId;

    @Column(name = "sku", nullable = false, length = 64, updatable = false)
    private String sku;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "unit", nullable = false, length = 20)
    private UnitOfMeasure unit;

    @Builder.Default
    @Column(name = "current_stock", nullable = false, precision = 12, scale = 3, insertable = false, updatable = false)
    private BigDecimal currentStock = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "min_stock", nullable = false, precision = 12, scale = 3)
    private BigDecimal minStock = BigDecimal.ZERO;

    @Column(name = "max_stock", precision = 12, scale = 3)
    private BigDecimal maxStock;

    @Column(name = "reorder_point", precision = 12, scale = 3)
    private BigDecimal reorderPoint;

    @Column(name = "reorder_quantity", precision = 12, scale = 3)
    private BigDecimal reorderQuantity;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Applies the non-null fields of {@code update}. Stock is not among them.
     */
    public void updateDetails(ItemDetailsUpdate update) {
        if (update.name() != null) {
            name = update.name();
        }
        if (update.unit() != null) {
            unit = update.unit();
        }
        if (update.minStock() != null) {
            minStock = update.minStock();
        }
        if (update.maxStock() != null) {
            maxStock = update.maxStock();
        }
        if (update.reorderPoint() != null) {
            reorderPoint = update.reorderPoint();
        }
        if (update.reorderQuantity() != null) {
            reorderQuantity = update.reorderQuantity();
        }
        if (update.expiryDate() != null) {
            expiryDate = update.expiryDate();
        }
        if (update.active() != null) {
            active = update.active();
        }
    }

    public boolean isLowStock() {
        return currentStock.compareTo(minStock) <= 0;
    }
}

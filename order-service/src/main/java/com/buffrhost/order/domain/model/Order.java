package com.buffrhost.order.domain.model;

import com.buffrhost.common.exception.ResourceNotFoundException;
import com.buffrhost.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Customer order. The status only changes through {@code OrderLifecycleService}; line items,
 * tip and delivery fee are editable while the order is PENDING and frozen afterwards, as are
 * the totals computed at confirmation.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_property", columnList = "property_id"),
        @Index(name = "idx_orders_status_created", columnList = "status,created_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Order {
    public static final String ITEMS_FROZEN = "ORDER_ITEMS_FROZEN";
    public static final String CHARGES_FROZEN = "ORDER_CHARGES_FROZEN";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_number", nullable = false, unique = true, length = 32, updatable = false)
    private String orderNumber;

    @Column(name = "property_id", nullable = false, updatable = false)
    private Long propertyId;

    @Column(name = "customer_id", updatable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, length = 20, updatable = false)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    // Loaded by a second select, so FOR UPDATE on the order row never joins the items table
    @Builder.Default
    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("id ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Builder.Default
    @Column(name = "subtotal", nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "tax_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal taxAmount = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "tip_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal tipAmount = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "delivery_fee", nullable = false, precision = 12, scale = 2)
    private BigDecimal deliveryFee = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Column(name = "totals_finalized_at")
    private LocalDateTime totalsFinalizedAt;

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
        if (status == null) {
            status = OrderStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public OrderItem addItem(Long menuItemId, String name, int quantity, BigDecimal unitPrice) {
        requireEditable();
        OrderItem item = OrderItem.builder()
                .order(this)
                .menuItemId(menuItemId)
                .name(name)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .build();
        item.recalculate();
        items.add(item);
        return item;
    }

    public OrderItem updateItem(Long itemId, Integer quantity, BigDecimal unitPrice) {
        requireEditable();
        OrderItem item = findItem(itemId);
        item.update(quantity, unitPrice);
        return item;
    }

    public void removeItem(Long itemId) {
        requireEditable();
        items.remove(findItem(itemId));
    }

    /**
     * Sets tip and delivery fee; null keeps the current amount. Totals are recomputed by the caller.
     */
    public void updateCharges(BigDecimal newTipAmount, BigDecimal newDeliveryFee) {
        if (!status.isEditable()) {
            throw new ValidationException("Tip and delivery fee are frozen once the order leaves PENDING",
                    CHARGES_FROZEN, Map.of("orderId", String.valueOf(id), "status", status.name()));
        }
        if (newTipAmount != null) {
            tipAmount = newTipAmount;
        }
        if (newDeliveryFee != null) {
            deliveryFee = newDeliveryFee;
        }
    }

    /**
     * Moves the order along one edge of the status graph. The caller has already
     * validated the edge.
     */
    public void moveTo(OrderStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException("Order " + id + " cannot move from " + status + " to " + newStatus);
        }
        status = newStatus;
    }

    public void applyTotals(OrderTotals totals) {
        if (totalsFinalizedAt != null) {
            throw new IllegalStateException("Totals of order " + id + " are already final");
        }
        subtotal = totals.subtotal();
        taxAmount = totals.taxAmount();
        tipAmount = totals.tipAmount();
        deliveryFee = totals.deliveryFee();
        totalAmount = totals.totalAmount();
    }

    public void finalizeTotals(OrderTotals totals, LocalDateTime at) {
        applyTotals(totals);
        totalsFinalizedAt = at;
    }

    private OrderItem findItem(Long itemId) {
        return items.stream()
                .filter(item -> item.getId() != null && item.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("OrderItem", itemId));
    }

    private void requireEditable() {
        if (!status.isEditable()) {
            throw new ValidationException("Order items are frozen once the order leaves PENDING",
                    ITEMS_FROZEN, Map.of("orderId", String.valueOf(id), "status", status.name()));
        }
    }
}

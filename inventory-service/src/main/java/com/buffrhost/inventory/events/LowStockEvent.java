package com.buffrhost.inventory.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event published when a movement takes an item from above its minimum stock to at or below it.
 * Consumed by purchasing and notification collaborators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LowStockEvent {
    private Long itemId;
    private Long propertyId;
    private String sku;
    private String name;
    private BigDecimal currentStock;
    private BigDecimal minStock;
    private BigDecimal reorderQuantity;
    private Instant timestamp;
}

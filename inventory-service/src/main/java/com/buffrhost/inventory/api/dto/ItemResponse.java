package com.buffrhost.inventory.api.dto;

import com.buffrhost.inventory.domain.model.InventoryItem;
import com.buffrhost.inventory.domain.model.UnitOfMeasure;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ItemResponse(
        Long id,
        String sku,
        String name,
        UnitOfMeasure unit,
        BigDecimal currentStock,
        BigDecimal minStock,
        BigDecimal maxStock,
        BigDecimal reorderPoint,
        BigDecimal reorderQuantity,
        LocalDate expiryDate,
        boolean lowStock
) {
    public static ItemResponse from(InventoryItem item) {
        return new ItemResponse(
                item.getId(),
                item.getSku(),
                item.getName(),
                item.getUnit(),
                item.getCurrentStock(),
                item.getMinStock(),
                item.getMaxStock(),
                item.getReorderPoint(),
                item.getReorderQuantity(),
                item.getExpiryDate(),
                item.isLowStock());
    }
}

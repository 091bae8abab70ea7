package com.buffrhost.inventory.domain.service;

import com.buffrhost.inventory.domain.model.UnitOfMeasure;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * @param openingBalance Optional. Recorded as an ADJUSTMENT so the ledger explains the first stock level.
 */
public record NewInventoryItem(
        String sku,
        String name,
        UnitOfMeasure unit,
        BigDecimal minStock,
        BigDecimal maxStock,
        BigDecimal reorderPoint,
        BigDecimal reorderQuantity,
        LocalDate expiryDate,
        BigDecimal openingBalance
) {
}

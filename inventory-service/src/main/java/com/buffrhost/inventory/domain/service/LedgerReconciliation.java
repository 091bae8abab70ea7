package com.buffrhost.inventory.domain.service;

import java.math.BigDecimal;

/**
 * Result of replaying an item's ledger against its cached stock column.
 */
public record LedgerReconciliation(
        Long itemId,
        BigDecimal cachedStock,
        BigDecimal ledgerStock,
        long transactionCount
) {
    public boolean isConsistent() {
        return cachedStock.compareTo(ledgerStock) == 0;
    }
}

package com.buffrhost.inventory.api.dto;

import com.buffrhost.inventory.domain.model.StockTransaction;
import com.buffrhost.inventory.domain.model.TransactionKind;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record StockTransactionResponse(
        Long id,
        Long itemId,
        TransactionKind kind,
        BigDecimal quantity,
        BigDecimal delta,
        BigDecimal balanceAfter,
        String reason,
        String actor,
        String referenceId,
        LocalDateTime createdAt
) {
    public static StockTransactionResponse from(StockTransaction tx) {
        return new StockTransactionResponse(
                tx.getId(),
                tx.getItemId(),
                tx.getKind(),
                tx.getQuantity(),
                tx.getDelta(),
                tx.getBalanceAfter(),
                tx.getReason(),
                tx.getActor(),
                tx.getReferenceId(),
                tx.getCreatedAt());
    }
}

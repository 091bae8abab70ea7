package com.buffrhost.common.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A stock decrease would drive the item's balance below zero. Nothing was recorded.
 */
public class InsufficientStockException extends BusinessException {
    public static final String ERROR_CODE = "INSUFFICIENT_STOCK";

    public InsufficientStockException(Long itemId, BigDecimal requested, BigDecimal available) {
        super(String.format("Insufficient stock for item %d: requested=%s, available=%s",
                        itemId, requested.toPlainString(), available.toPlainString()),
                ERROR_CODE,
                Map.of("itemId", itemId,
                        "requested", requested,
                        "available", available));
    }
}

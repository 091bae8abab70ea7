package com.buffrhost.order.domain.service;

import com.buffrhost.order.domain.model.OrderType;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param tipAmount   Optional, zero when absent.
 * @param deliveryFee Optional, zero when absent.
 */
public record NewOrder(Long customerId, OrderType orderType, List<NewOrderLine> items,
                       BigDecimal tipAmount, BigDecimal deliveryFee) {

    public NewOrder(Long customerId, OrderType orderType, List<NewOrderLine> items) {
        this(customerId, orderType, items, null, null);
    }
}

package com.buffrhost.order.domain.model;

import java.math.BigDecimal;

/**
 * Money amounts of an order, all at scale 2. Tax is charged on the subtotal only.
 */
public record OrderTotals(BigDecimal subtotal, BigDecimal taxAmount, BigDecimal tipAmount,
                          BigDecimal deliveryFee, BigDecimal totalAmount) {
}

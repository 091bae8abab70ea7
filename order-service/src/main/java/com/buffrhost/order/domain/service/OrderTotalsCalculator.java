package com.buffrhost.order.domain.service;

import com.buffrhost.order.domain.model.OrderItem;
import com.buffrhost.order.domain.model.OrderTotals;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * subtotal = sum(quantity * unit price), tax = subtotal * rate (HALF_UP, 2 decimals),
 * total = subtotal + tax + tip + delivery fee. Deterministic for a given item list, charges and rate.
 */
@Component
public class OrderTotalsCalculator {

    private static final int SCALE = 2;

    private final BigDecimal taxRate;

    public OrderTotalsCalculator(@Value("${order.tax-rate:0.15}") BigDecimal taxRate) {
        if (taxRate == null || taxRate.signum() < 0) {
            throw new IllegalArgumentException("order.tax-rate must be zero or positive, was " + taxRate);
        }
        this.taxRate = taxRate;
    }

    public OrderTotals calculate(List<OrderItem> items) {
        return calculate(items, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /**
     * @param tipAmount   null counts as zero
     * @param deliveryFee null counts as zero
     */
    public OrderTotals calculate(List<OrderItem> items, BigDecimal tipAmount, BigDecimal deliveryFee) {
        BigDecimal subtotal = items.stream()
                .map(item -> item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal tax = subtotal.multiply(taxRate).setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal tip = money(tipAmount);
        BigDecimal fee = money(deliveryFee);
        return new OrderTotals(subtotal, tax, tip, fee, subtotal.add(tax).add(tip).add(fee));
    }

    public BigDecimal getTaxRate() {
        return taxRate;
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO.setScale(SCALE) : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }
}

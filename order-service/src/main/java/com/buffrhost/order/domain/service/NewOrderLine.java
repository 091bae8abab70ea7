package com.buffrhost.order.domain.service;

import java.math.BigDecimal;

public record NewOrderLine(Long menuItemId, String name, Integer quantity, BigDecimal unitPrice) {
}

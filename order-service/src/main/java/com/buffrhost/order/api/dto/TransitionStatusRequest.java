package com.buffrhost.order.api.dto;

import com.buffrhost.order.domain.model.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * @param expectedStatus status the client last saw; the change is refused if the order has moved on since
 */
public record TransitionStatusRequest(
        @NotNull(message = "Status cannot be null")
        OrderStatus status,

        @Size(max = 500)
        String notes,

        OrderStatus expectedStatus
) {
}

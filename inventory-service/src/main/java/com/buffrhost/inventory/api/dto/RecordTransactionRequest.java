package com.buffrhost.inventory.api.dto;

import com.buffrhost.inventory.domain.model.TransactionKind;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * @param quantity Unsigned magnitude; the kind decides whether stock goes up or down.
 */
public record RecordTransactionRequest(
        @NotNull(message = "Kind cannot be null")
        TransactionKind kind,

        @NotNull(message = "Quantity cannot be null")
        @Positive(message = "Quantity must be positive")
        @Digits(integer = 9, fraction = 3)
        BigDecimal quantity,

        @Size(max = 255)
        String reason,

        @Size(max = 100)
        String referenceId
) {
}

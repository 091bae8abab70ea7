package com.buffrhost.availability.api.dto;

import com.buffrhost.availability.domain.model.ResourceKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateResourceRequest(
        @NotNull(message = "Kind cannot be null")
        ResourceKind kind,

        @NotBlank(message = "Code cannot be blank")
        @Size(max = 50)
        String code,

        @NotNull(message = "Capacity cannot be null")
        @Positive(message = "Capacity must be positive")
        Integer capacity
) {
}

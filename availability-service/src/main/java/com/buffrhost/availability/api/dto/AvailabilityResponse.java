package com.buffrhost.availability.api.dto;

import java.time.LocalDateTime;

public record AvailabilityResponse(
        Long resourceId,
        LocalDateTime start,
        LocalDateTime end,
        boolean available
) {
}

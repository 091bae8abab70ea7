package com.buffrhost.availability.api.dto;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.ResourceKind;

import java.time.LocalDateTime;

public record ResourceResponse(
        Long id,
        Long propertyId,
        ResourceKind kind,
        String code,
        Integer capacity,
        boolean active,
        LocalDateTime createdAt
) {
    public static ResourceResponse from(BookableResource resource) {
        return new ResourceResponse(
                resource.getId(),
                resource.getPropertyId(),
                resource.getKind(),
                resource.getCode(),
                resource.getCapacity(),
                resource.isActive(),
                resource.getCreatedAt());
    }
}

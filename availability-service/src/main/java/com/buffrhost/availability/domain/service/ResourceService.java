package com.buffrhost.availability.domain.service;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.ResourceKind;
import com.buffrhost.availability.domain.repository.BookableResourceRepository;
import com.buffrhost.common.exception.ResourceNotFoundException;
import com.buffrhost.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Registry of bookable rooms and tables.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceService {

    private final BookableResourceRepository resourceRepository;

    @Transactional
    public BookableResource createResource(Long propertyId, ResourceKind kind, String code, Integer capacity) {
        if (capacity == null || capacity <= 0) {
            throw new ValidationException("capacity must be positive");
        }
        if (resourceRepository.existsByPropertyIdAndCode(propertyId, code)) {
            throw new ValidationException("Resource code " + code + " already exists in property " + propertyId,
                    "DUPLICATE_RESOURCE_CODE", Map.of("propertyId", propertyId, "code", code));
        }
        BookableResource resource = resourceRepository.save(BookableResource.builder()
                .propertyId(propertyId)
                .kind(kind)
                .code(code)
                .capacity(capacity)
                .build());
        log.info("Created {} {} (id={}) in property {}", kind, code, resource.getId(), propertyId);
        return resource;
    }

    @Transactional(readOnly = true)
    public BookableResource getResource(Long propertyId, Long resourceId) {
        return resourceRepository.findByIdAndPropertyId(resourceId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
    }

    /**
     * Soft-deactivates the resource. Existing reservations are kept; new ones are refused.
     * Takes the same row lock as the pessimistic reservation strategy so an in-flight booking
     * either commits first or sees the resource inactive.
     */
    @Transactional
    public BookableResource deactivateResource(Long propertyId, Long resourceId) {
        BookableResource resource = resourceRepository.findByIdAndPropertyIdForUpdate(resourceId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
        if (resource.isActive()) {
            resource.deactivate();
            log.info("Deactivated resource {} in property {}", resourceId, propertyId);
        }
        return resource;
    }
}

package com.buffrhost.availability.api.controller;

import com.buffrhost.availability.api.dto.AvailabilityResponse;
import com.buffrhost.availability.api.dto.CreateResourceRequest;
import com.buffrhost.availability.api.dto.ReservationResponse;
import com.buffrhost.availability.api.dto.ResourceResponse;
import com.buffrhost.availability.domain.service.ReservationService;
import com.buffrhost.availability.domain.service.ResourceService;
import com.buffrhost.common.dto.BaseResponse;
import com.buffrhost.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * REST controller for the resource registry and availability queries.
 */
@RestController
@RequestMapping("/api/v1/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final ResourceService resourceService;
    private final ReservationService reservationService;

    @PostMapping
    public ResponseEntity<BaseResponse<ResourceResponse>> createResource(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @Valid @RequestBody CreateResourceRequest request) {
        ResourceResponse response = ResourceResponse.from(resourceService.createResource(
                propertyId, request.kind(), request.code(), request.capacity()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Resource created successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ResourceResponse>> getResource(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(ResourceResponse.from(resourceService.getResource(propertyId, id))));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<BaseResponse<ResourceResponse>> deactivateResource(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        ResourceResponse response = ResourceResponse.from(resourceService.deactivateResource(propertyId, id));
        return ResponseEntity.ok(BaseResponse.success("Resource deactivated", response));
    }

    /**
     * Whether [start, end) is free on the resource. Touching an existing reservation's endpoint counts as free.
     */
    @GetMapping("/{id}/availability")
    public ResponseEntity<BaseResponse<AvailabilityResponse>> checkAvailability(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        boolean available = reservationService.checkAvailability(propertyId, id, start, end);
        return ResponseEntity.ok(BaseResponse.success(new AvailabilityResponse(id, start, end, available)));
    }

    @GetMapping("/{id}/reservations")
    public ResponseEntity<BaseResponse<List<ReservationResponse>>> listActiveReservations(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        List<ReservationResponse> reservations = reservationService.listActiveReservations(propertyId, id, from, to)
                .stream()
                .map(ReservationResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(reservations));
    }
}

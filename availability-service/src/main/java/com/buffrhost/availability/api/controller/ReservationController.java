package com.buffrhost.availability.api.controller;

import com.buffrhost.availability.api.dto.CancelReservationRequest;
import com.buffrhost.availability.api.dto.CreateReservationRequest;
import com.buffrhost.availability.api.dto.ReservationResponse;
import com.buffrhost.availability.domain.service.ReservationCommand;
import com.buffrhost.availability.domain.service.ReservationService;
import com.buffrhost.common.dto.BaseResponse;
import com.buffrhost.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for reservations.
 * The concurrency strategy behind createReservation is selected via application.yml:
 * availability.reservation.strategy
 */
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationService reservationService;

    /**
     * Holds the resource for the requested interval.
     * Send an Idempotency-Key header to make retries safe: the same key returns the same reservation.
     */
    @PostMapping
    public ResponseEntity<BaseResponse<ReservationResponse>> createReservation(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @RequestHeader(value = Constants.IDEMPOTENCY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateReservationRequest request) {
        ReservationCommand command = new ReservationCommand(
                propertyId,
                request.resourceId(),
                request.start(),
                request.end(),
                request.customerId(),
                request.partySize(),
                idempotencyKey);
        ReservationResponse response = ReservationResponse.from(reservationService.createReservation(command));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Reservation held successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> getReservation(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(
                ReservationResponse.from(reservationService.getReservation(propertyId, id))));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<BaseResponse<ReservationResponse>> confirmReservation(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id) {
        ReservationResponse response = ReservationResponse.from(reservationService.confirmReservation(propertyId, id));
        return ResponseEntity.ok(BaseResponse.success("Reservation confirmed", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<ReservationResponse>> cancelReservation(
            @RequestHeader(Constants.PROPERTY_HEADER) Long propertyId,
            @PathVariable Long id,
            @Valid @RequestBody(required = false) CancelReservationRequest request) {
        String reason = request != null ? request.reason() : null;
        ReservationResponse response = ReservationResponse.from(
                reservationService.cancelReservation(propertyId, id, reason));
        return ResponseEntity.ok(BaseResponse.success("Reservation cancelled", response));
    }
}

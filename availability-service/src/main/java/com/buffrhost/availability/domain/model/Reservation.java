package com.buffrhost.availability.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Claim on a {@link BookableResource} for the half-open interval [startAt, endAt).
 * The interval is never edited; a change of dates is a cancel followed by a new reservation.
 * Rows are never deleted, cancellation only changes the status.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_resource_interval", columnList = "resource_id,start_at,end_at"),
        @Index(name = "idx_reservations_hold_expiry", columnList = "status,hold_expires_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Reservation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, updatable = false)
    private Long resourceId;

    @Column(name = "property_id", nullable = false, updatable = false)
    private Long propertyId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private Long customerId;

    @Column(name = "start_at", nullable = false, updatable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false, updatable = false)
    private LocalDateTime endAt;

    @Column(name = "party_size", updatable = false)
    private Integer partySize;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = ReservationStatus.HELD;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isHoldExpired(LocalDateTime now) {
        return status == ReservationStatus.HELD && holdExpiresAt != null && holdExpiresAt.isBefore(now);
    }

    /**
     * HELD -> CONFIRMED. Returns false when the reservation was already confirmed.
     */
    public boolean confirm() {
        if (status == ReservationStatus.CONFIRMED) {
            return false;
        }
        if (status != ReservationStatus.HELD) {
            throw new IllegalStateException("Only held reservations can be confirmed, status=" + status);
        }
        status = ReservationStatus.CONFIRMED;
        holdExpiresAt = null;
        return true;
    }

    /**
     * Moves an active reservation to CANCELLED. Returns false when it was already cancelled.
     */
    public boolean cancel(String reason, LocalDateTime at) {
        if (status == ReservationStatus.CANCELLED) {
            return false;
        }
        status = ReservationStatus.CANCELLED;
        cancellationReason = reason;
        cancelledAt = at;
        holdExpiresAt = null;
        return true;
    }
}

package com.buffrhost.availability.domain.strategy;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.model.ReservationStatus;
import com.buffrhost.availability.domain.repository.ReservationRepository;
import com.buffrhost.availability.domain.service.ReservationCommand;
import com.buffrhost.common.exception.ReservationConflictException;
import com.buffrhost.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Check-then-insert step shared by every {@link ReservationStrategy}.
 * Must be called inside a transaction while the strategy holds its lock on the resource.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationWriter {

    static final String NO_OVERLAP_CONSTRAINT = "reservations_no_overlap";
    static final String IDEMPOTENCY_KEY_CONSTRAINT = "uk_reservations_idempotency_key";

    private final ReservationRepository reservationRepository;

    public Reservation insertIfFree(BookableResource resource, ReservationCommand command, LocalDateTime holdExpiresAt) {
        if (!resource.isActive()) {
            throw new ValidationException("Resource " + resource.getId() + " is no longer bookable",
                    "RESOURCE_INACTIVE", Map.of("resourceId", resource.getId()));
        }
        if (!resource.canHost(command.partySize())) {
            throw new ValidationException(
                    String.format("Party of %d exceeds capacity %d of resource %d",
                            command.partySize(), resource.getCapacity(), resource.getId()),
                    Map.of("resourceId", resource.getId(),
                            "partySize", command.partySize(),
                            "capacity", resource.getCapacity()));
        }

        if (command.hasIdempotencyKey()) {
            Optional<Reservation> replay = reservationRepository.findByIdempotencyKey(command.idempotencyKey())
                    .map(command::replayOf);
            if (replay.isPresent()) {
                log.info("Idempotent replay of reservation {} for key {}", replay.get().getId(), command.idempotencyKey());
                return replay.get();
            }
        }

        List<Reservation> overlapping = reservationRepository.findOverlapping(
                resource.getId(), ReservationStatus.active(), command.start(), command.end());
        if (!overlapping.isEmpty()) {
            throw new ReservationConflictException(resource.getId(), command.start(), command.end(),
                    overlapping.get(0).getId());
        }

        Reservation reservation = Reservation.builder()
                .resourceId(resource.getId())
                .propertyId(resource.getPropertyId())
                .customerId(command.customerId())
                .startAt(command.start())
                .endAt(command.end())
                .partySize(command.partySize())
                .status(ReservationStatus.HELD)
                .holdExpiresAt(holdExpiresAt)
                .idempotencyKey(command.hasIdempotencyKey() ? command.idempotencyKey() : null)
                .build();

        try {
            return reservationRepository.saveAndFlush(reservation);
        } catch (DataIntegrityViolationException e) {
            if (isOverlapViolation(e)) {
                log.warn("Exclusion constraint rejected reservation on resource {} for [{}, {})",
                        resource.getId(), command.start(), command.end());
                throw new ReservationConflictException(resource.getId(), command.start(), command.end(), null);
            }
            if (command.hasIdempotencyKey() && violates(e, IDEMPOTENCY_KEY_CONSTRAINT)) {
                log.info("Idempotency key {} was stored concurrently", command.idempotencyKey());
                throw new IdempotencyKeyTakenException(command.idempotencyKey(), e);
            }
            throw e;
        }
    }

    private boolean isOverlapViolation(DataIntegrityViolationException e) {
        return violates(e, NO_OVERLAP_CONSTRAINT);
    }

    private static boolean violates(DataIntegrityViolationException e, String constraint) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(constraint);
    }
}

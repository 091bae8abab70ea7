package com.buffrhost.availability.domain.strategy;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.repository.BookableResourceRepository;
import com.buffrhost.availability.domain.service.ReservationCommand;
import com.buffrhost.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Reservation strategy using pessimistic lock (SELECT FOR UPDATE) on the resource row.
 *
 * Flow:
 * 1. Lock the resource row; concurrent bookings of the same resource wait here
 * 2. Check for overlapping active reservations
 * 3. Insert the HELD reservation
 * 4. Commit (releases the lock)
 *
 * Bookings of different resources never contend.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockReservationStrategy implements ReservationStrategy {

    private final BookableResourceRepository resourceRepository;
    private final ReservationWriter reservationWriter;

    @Override
    @Transactional
    public Reservation reserve(ReservationCommand command, LocalDateTime holdExpiresAt) {
        BookableResource resource = resourceRepository
                .findByIdAndPropertyIdForUpdate(command.resourceId(), command.propertyId())
                .orElseThrow(() -> new ResourceNotFoundException("Resource", command.resourceId()));
        log.debug("Locked resource {} for reservation [{}, {})", resource.getId(), command.start(), command.end());
        return reservationWriter.insertIfFree(resource, command, holdExpiresAt);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}

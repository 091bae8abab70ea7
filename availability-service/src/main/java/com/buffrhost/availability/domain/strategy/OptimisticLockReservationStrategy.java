package com.buffrhost.availability.domain.strategy;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.repository.BookableResourceRepository;
import com.buffrhost.availability.domain.service.ReservationCommand;
import com.buffrhost.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Reservation strategy using optimistic lock with retry.
 *
 * The resource row is read with OPTIMISTIC_FORCE_INCREMENT, so every booking of a resource
 * bumps its version at commit. Of two transactions that both passed the overlap check only
 * the first commits; the second fails with OptimisticLockingFailureException and is retried
 * from scratch, this time seeing the first reservation. Retries up to 3 times.
 *
 * Good for moderate concurrency. No database locks are held while checking.
 */
@Slf4j
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticLockReservationStrategy implements ReservationStrategy {

    private final BookableResourceRepository resourceRepository;
    private final ReservationWriter reservationWriter;

    @Override
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2)
    )
    @Transactional
    public Reservation reserve(ReservationCommand command, LocalDateTime holdExpiresAt) {
        BookableResource resource = resourceRepository
                .findByIdAndPropertyIdWithVersionBump(command.resourceId(), command.propertyId())
                .orElseThrow(() -> new ResourceNotFoundException("Resource", command.resourceId()));
        log.debug("Reserving resource {} at version {}", resource.getId(), resource.getVersion());
        return reservationWriter.insertIfFree(resource, command, holdExpiresAt);
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}

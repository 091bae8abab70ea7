package com.buffrhost.availability.domain.service;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.model.ReservationStatus;
import com.buffrhost.availability.domain.repository.BookableResourceRepository;
import com.buffrhost.availability.domain.repository.ReservationRepository;
import com.buffrhost.availability.domain.strategy.IdempotencyKeyTakenException;
import com.buffrhost.availability.domain.strategy.ReservationStrategy;
import com.buffrhost.common.exception.ResourceNotFoundException;
import com.buffrhost.common.exception.ValidationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Availability checks and the reservation lifecycle (HELD -> CONFIRMED, HELD/CONFIRMED -> CANCELLED).
 *
 * The check-and-insert of a new reservation is delegated to a {@link ReservationStrategy}.
 * Spring injects every strategy into a Map keyed by bean name; the one used is picked by
 * {@code availability.reservation.strategy} (pessimistic | optimistic | distributed).
 *
 * createReservation runs outside a transaction here: each strategy opens its own,
 * and the distributed one must commit before it releases its lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    static final String DEFAULT_STRATEGY = "pessimistic";
    static final String HOLD_EXPIRED_REASON = "Hold expired";

    private final Map<String, ReservationStrategy> reservationStrategies;
    private final BookableResourceRepository resourceRepository;
    private final ReservationRepository reservationRepository;

    @Value("${availability.reservation.strategy:pessimistic}")
    private String strategyType;

    @Value("${availability.reservation.hold-ttl-minutes:15}")
    private int holdTtlMinutes;

    @PostConstruct
    public void init() {
        ReservationStrategy strategy = getReservationStrategy();
        log.info("Initialized ReservationService with strategy: {}, hold TTL {} min",
                strategy.getStrategyType(), holdTtlMinutes);
    }

    /**
     * True iff the resource is active and no HELD or CONFIRMED reservation overlaps [start, end).
     * Reservations that only touch an endpoint do not overlap.
     */
    @Transactional(readOnly = true)
    public boolean checkAvailability(Long propertyId, Long resourceId, LocalDateTime start, LocalDateTime end) {
        validateInterval(start, end);
        BookableResource resource = findResource(propertyId, resourceId);
        if (!resource.isActive()) {
            return false;
        }
        return !reservationRepository.existsOverlapping(resourceId, ReservationStatus.active(), start, end);
    }

    /**
     * Creates a HELD reservation, or throws ReservationConflictException when the interval is taken.
     * With an idempotency key, a repeated identical request returns the reservation created by the first one;
     * reusing the key for a different request is a validation error.
     */
    public Reservation createReservation(ReservationCommand command) {
        validateInterval(command.start(), command.end());
        if (command.customerId() == null) {
            throw new ValidationException("customerId is required");
        }
        if (command.partySize() != null && command.partySize() <= 0) {
            throw new ValidationException("partySize must be positive",
                    Map.of("partySize", command.partySize()));
        }

        if (command.hasIdempotencyKey()) {
            Optional<Reservation> existing = findReplay(command);
            if (existing.isPresent()) {
                log.info("Returning reservation {} for repeated idempotency key {}",
                        existing.get().getId(), command.idempotencyKey());
                return existing.get();
            }
        }

        ReservationStrategy strategy = getReservationStrategy();
        log.debug("Reserving resource {} using strategy: {}", command.resourceId(), strategy.getStrategyType());
        Reservation reservation;
        try {
            reservation = strategy.reserve(command, LocalDateTime.now().plusMinutes(holdTtlMinutes));
        } catch (IdempotencyKeyTakenException e) {
            // The winning request has committed; answer with its reservation.
            return findReplay(command).orElseThrow(() -> new IllegalStateException(
                    "Reservation for idempotency key " + command.idempotencyKey() + " not found after key violation", e));
        }
        log.info("Reservation {} held on resource {} for [{}, {})",
                reservation.getId(), reservation.getResourceId(), reservation.getStartAt(), reservation.getEndAt());
        return reservation;
    }

    /**
     * HELD -> CONFIRMED. Confirming a confirmed reservation is a no-op.
     */
    @Transactional
    public Reservation confirmReservation(Long propertyId, Long reservationId) {
        Reservation reservation = lockReservation(propertyId, reservationId);
        if (reservation.getStatus() == ReservationStatus.CANCELLED) {
            throw new ValidationException("Reservation " + reservationId + " is cancelled and cannot be confirmed",
                    "RESERVATION_CANCELLED", Map.of("reservationId", reservationId));
        }
        if (reservation.isHoldExpired(LocalDateTime.now())) {
            throw new ValidationException("Hold on reservation " + reservationId + " has expired",
                    "HOLD_EXPIRED", Map.of("reservationId", reservationId,
                            "holdExpiresAt", reservation.getHoldExpiresAt()));
        }
        if (reservation.confirm()) {
            log.info("Confirmed reservation {}", reservationId);
        }
        return reservation;
    }

    /**
     * Moves the reservation to CANCELLED and records why. The row is kept.
     * Cancelling a cancelled reservation returns it unchanged.
     */
    @Transactional
    public Reservation cancelReservation(Long propertyId, Long reservationId, String reason) {
        Reservation reservation = lockReservation(propertyId, reservationId);
        cancel(reservation, reason);
        return reservation;
    }

    /**
     * Cancels the reservation if it is still an expired hold once its row is locked.
     * A reservation confirmed after the sweep read it is left alone.
     *
     * @return true if the hold was cancelled
     */
    @Transactional
    public boolean expireHold(Long reservationId) {
        Optional<Reservation> locked = reservationRepository.findByIdForUpdate(reservationId);
        if (locked.isEmpty() || !locked.get().isHoldExpired(LocalDateTime.now())) {
            return false;
        }
        return cancel(locked.get(), HOLD_EXPIRED_REASON);
    }

    @Transactional(readOnly = true)
    public Reservation getReservation(Long propertyId, Long reservationId) {
        return reservationRepository.findByIdAndPropertyId(reservationId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }

    /**
     * Active (HELD or CONFIRMED) reservations of a resource overlapping [from, to), ordered by start.
     */
    @Transactional(readOnly = true)
    public List<Reservation> listActiveReservations(Long propertyId, Long resourceId,
                                                    LocalDateTime from, LocalDateTime to) {
        validateInterval(from, to);
        findResource(propertyId, resourceId);
        return reservationRepository.findOverlapping(resourceId, ReservationStatus.active(), from, to);
    }

    private boolean cancel(Reservation reservation, String reason) {
        boolean changed = reservation.cancel(reason, LocalDateTime.now());
        if (changed) {
            log.info("Cancelled reservation {} on resource {}: {}", reservation.getId(), reservation.getResourceId(), reason);
        } else {
            log.debug("Reservation {} already cancelled", reservation.getId());
        }
        return changed;
    }

    private Reservation lockReservation(Long propertyId, Long reservationId) {
        return reservationRepository.findByIdForUpdate(reservationId)
                .filter(r -> r.getPropertyId().equals(propertyId))
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }

    private Optional<Reservation> findReplay(ReservationCommand command) {
        return reservationRepository.findByIdempotencyKey(command.idempotencyKey()).map(command::replayOf);
    }

    private BookableResource findResource(Long propertyId, Long resourceId) {
        return resourceRepository.findByIdAndPropertyId(resourceId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Resource", resourceId));
    }

    private static void validateInterval(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new ValidationException("start and end are required");
        }
        if (!start.isBefore(end)) {
            throw new ValidationException("start must be before end", Map.of("start", start, "end", end));
        }
    }

    /**
     * Looks the configured strategy up by bean name, falling back to pessimistic for unknown values.
     */
    private ReservationStrategy getReservationStrategy() {
        ReservationStrategy strategy = reservationStrategies.get(strategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, reservationStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = reservationStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + reservationStrategies.keySet());
            }
        }
        return strategy;
    }
}

package com.buffrhost.availability.domain.strategy;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.repository.BookableResourceRepository;
import com.buffrhost.availability.domain.service.ReservationCommand;
import com.buffrhost.common.exception.ResourceNotFoundException;
import com.buffrhost.common.exception.ServiceUnavailableException;
import com.buffrhost.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

/**
 * Reservation strategy using a distributed lock (Redis/Redisson) keyed by resource.
 *
 * Coordinates service instances that share the database but should not queue on row locks.
 * The check-and-insert runs in its own transaction inside the lock, so the reservation is
 * committed before the lock is released and the next holder always sees it.
 * The exclusion constraint on the reservations table still backs this up if a lease expires
 * while the holder is running.
 */
@Slf4j
@Component("distributed")
public class DistributedLockReservationStrategy implements ReservationStrategy {

    static final long LOCK_WAIT_SECONDS = 5;
    static final long LOCK_LEASE_SECONDS = 30;

    private final BookableResourceRepository resourceRepository;
    private final ReservationWriter reservationWriter;
    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;

    public DistributedLockReservationStrategy(BookableResourceRepository resourceRepository,
                                              ReservationWriter reservationWriter,
                                              RedissonClient redissonClient,
                                              PlatformTransactionManager transactionManager) {
        this.resourceRepository = resourceRepository;
        this.reservationWriter = reservationWriter;
        this.redissonClient = redissonClient;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Reservation reserve(ReservationCommand command, LocalDateTime holdExpiresAt) {
        String lockKey = Constants.LOCK_PREFIX + command.resourceId();
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(LOCK_WAIT_SECONDS, LOCK_LEASE_SECONDS, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ServiceUnavailableException(
                        "Unable to acquire lock for resource " + command.resourceId() + ". Please try again.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return transactionTemplate.execute(status -> {
                BookableResource resource = resourceRepository
                        .findByIdAndPropertyId(command.resourceId(), command.propertyId())
                        .orElseThrow(() -> new ResourceNotFoundException("Resource", command.resourceId()));
                return reservationWriter.insertIfFree(resource, command, holdExpiresAt);
            });

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for lock " + lockKey, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}

package com.buffrhost.availability.domain.strategy;

import com.buffrhost.availability.domain.model.BookableResource;
import com.buffrhost.availability.domain.model.Reservation;
import com.buffrhost.availability.domain.model.ResourceKind;
import com.buffrhost.availability.domain.repository.BookableResourceRepository;
import com.buffrhost.availability.domain.service.ReservationCommand;
import com.buffrhost.common.exception.ReservationConflictException;
import com.buffrhost.common.exception.ServiceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link DistributedLockReservationStrategy}.
 *
 * The reservation must be committed while the Redisson lock is still held, otherwise the
 * next lock holder could miss it in its overlap check.
 */
@ExtendWith(MockitoExtension.class)
class DistributedLockReservationStrategyTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 1, 1, 14, 0);
    private static final LocalDateTime END = LocalDateTime.of(2026, 1, 2, 11, 0);

    @Mock
    private BookableResourceRepository resourceRepository;
    @Mock
    private ReservationWriter reservationWriter;
    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RLock lock;
    @Mock
    private PlatformTransactionManager transactionManager;

    private DistributedLockReservationStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new DistributedLockReservationStrategy(
                resourceRepository, reservationWriter, redissonClient, transactionManager);
        given(redissonClient.getLock("lock:resource:101")).willReturn(lock);
    }

    @Test
    @DisplayName("reserve() commits the insert before releasing the lock")
    void reserve_success_commitsBeforeUnlock() throws Exception {
        ReservationCommand command = command();
        BookableResource resource = resource();
        Reservation held = Reservation.builder().id(1L).resourceId(101L).build();
        SimpleTransactionStatus status = new SimpleTransactionStatus();

        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        given(transactionManager.getTransaction(any())).willReturn(status);
        given(resourceRepository.findByIdAndPropertyId(101L, 1L)).willReturn(Optional.of(resource));
        given(reservationWriter.insertIfFree(resource, command, null)).willReturn(held);

        Reservation result = strategy.reserve(command, null);

        assertThat(result).isSameAs(held);
        InOrder order = inOrder(lock, reservationWriter, transactionManager);
        order.verify(lock).tryLock(anyLong(), anyLong(), any());
        order.verify(reservationWriter).insertIfFree(resource, command, null);
        order.verify(transactionManager).commit(status);
        order.verify(lock).unlock();
    }

    @Test
    @DisplayName("reserve() rolls back and still unlocks when the interval is taken")
    void reserve_conflict_rollsBackAndUnlocks() throws Exception {
        ReservationCommand command = command();
        BookableResource resource = resource();
        SimpleTransactionStatus status = new SimpleTransactionStatus();

        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        given(transactionManager.getTransaction(any())).willReturn(status);
        given(resourceRepository.findByIdAndPropertyId(101L, 1L)).willReturn(Optional.of(resource));
        given(reservationWriter.insertIfFree(resource, command, null))
                .willThrow(new ReservationConflictException(101L, START, END, 9L));

        assertThatThrownBy(() -> strategy.reserve(command, null))
                .isInstanceOf(ReservationConflictException.class);

        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
        verify(lock).unlock();
    }

    @Test
    @DisplayName("reserve() fails with ServiceUnavailable when the lock cannot be acquired")
    void reserve_lockNotAcquired_serviceUnavailable() throws Exception {
        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(false);

        assertThatThrownBy(() -> strategy.reserve(command(), null))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("Unable to acquire lock for resource 101");

        verifyNoInteractions(reservationWriter, transactionManager);
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("reserve() restores the interrupt flag when interrupted while waiting")
    void reserve_interrupted_restoresFlag() throws Exception {
        given(lock.tryLock(anyLong(), anyLong(), any())).willThrow(new InterruptedException());

        assertThatThrownBy(() -> strategy.reserve(command(), null))
                .isInstanceOf(ServiceUnavailableException.class);

        assertThat(Thread.interrupted()).isTrue();
        verifyNoInteractions(reservationWriter);
    }

    private static ReservationCommand command() {
        return new ReservationCommand(1L, 101L, START, END, 500L, null, null);
    }

    private static BookableResource resource() {
        return BookableResource.builder()
                .id(101L)
                .propertyId(1L)
                .kind(ResourceKind.ROOM)
                .code("101")
                .capacity(2)
                .build();
    }
}

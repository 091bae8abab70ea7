package com.buffrhost.order.domain.repository;

import com.buffrhost.order.domain.model.Order;
import com.buffrhost.order.domain.model.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByIdAndPropertyId(Long id, Long propertyId);

    /**
     * SELECT ... FOR UPDATE on the order row. Every mutation of an order goes through this,
     * so status changes and item edits on the same order are serialised.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<Order> findWithLockByIdAndPropertyId(Long id, Long propertyId);

    List<Order> findByPropertyIdOrderByCreatedAtDescIdDesc(Long propertyId, Pageable pageable);

    List<Order> findByPropertyIdAndStatusOrderByCreatedAtDescIdDesc(Long propertyId, OrderStatus status,
                                                                    Pageable pageable);

    List<Order> findByPropertyIdAndCustomerIdOrderByCreatedAtDescIdDesc(Long propertyId, Long customerId,
                                                                        Pageable pageable);

    List<Order> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(OrderStatus status, LocalDateTime before,
                                                                 Pageable pageable);
}

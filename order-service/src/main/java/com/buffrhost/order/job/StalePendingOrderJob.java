package com.buffrhost.order.job;

import com.buffrhost.common.exception.InvalidTransitionException;
import com.buffrhost.common.util.Constants;
import com.buffrhost.order.domain.model.Order;
import com.buffrhost.order.domain.model.OrderStatus;
import com.buffrhost.order.domain.repository.OrderRepository;
import com.buffrhost.order.domain.service.OrderLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Cancels orders left PENDING longer than {@code order.auto-cancel.pending-hours}.
 * Each cancellation is an ordinary transition in its own transaction, recorded with the system actor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StalePendingOrderJob {

    private final OrderRepository orderRepository;
    private final OrderLifecycleService lifecycleService;

    @Value("${order.auto-cancel.enabled:true}")
    private boolean enabled;

    @Value("${order.auto-cancel.pending-hours:24}")
    private int pendingHours;

    @Value("${order.auto-cancel.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${order.auto-cancel.interval-ms:900000}")
    public void cancelStalePendingOrders() {
        if (!enabled) return;
        LocalDateTime threshold = LocalDateTime.now().minusHours(pendingHours);
        List<Order> stale = orderRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                OrderStatus.PENDING, threshold, PageRequest.of(0, batchSize));
        if (stale.isEmpty()) return;
        log.info("Auto-cancel: found {} order(s) pending since before {}", stale.size(), threshold);
        String notes = "Auto-cancelled after " + pendingHours + "h pending";
        for (Order order : stale) {
            try {
                lifecycleService.transitionOrderStatus(order.getPropertyId(), order.getId(),
                        OrderStatus.CANCELLED, Constants.SYSTEM_ACTOR, notes, OrderStatus.PENDING);
            } catch (InvalidTransitionException e) {
                log.info("Order {} changed status before auto-cancel, skipping: {}", order.getId(), e.getMessage());
            } catch (Exception e) {
                log.error("Auto-cancel failed for order {}", order.getId(), e);
            }
        }
    }
}

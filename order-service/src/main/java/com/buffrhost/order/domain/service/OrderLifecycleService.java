package com.buffrhost.order.domain.service;

import com.buffrhost.common.exception.InvalidTransitionException;
import com.buffrhost.common.exception.ResourceNotFoundException;
import com.buffrhost.common.exception.ValidationException;
import com.buffrhost.common.util.Constants;
import com.buffrhost.order.domain.model.Order;
import com.buffrhost.order.domain.model.OrderStatus;
import com.buffrhost.order.domain.model.OrderStatusHistory;
import com.buffrhost.order.domain.model.OrderTotals;
import com.buffrhost.order.domain.repository.OrderRepository;
import com.buffrhost.order.domain.repository.OrderStatusHistoryRepository;
import com.buffrhost.order.events.OrderStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Order lifecycle state machine.
 *
 * Every mutation locks the order row first, so a status change and its history row are written
 * in one transaction against the latest committed state. Two staff members acting on the same
 * order are serialised; the second one is validated against whatever the first one committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLifecycleService {

    static final String CREATED_NOTE = "Order created";
    static final String INVALID_AMOUNT_PRECISION = "INVALID_AMOUNT_PRECISION";
    static final String ORDER_TOTAL_TOO_LARGE = "ORDER_TOTAL_TOO_LARGE";

    // Matches NUMERIC(12,2) on every money column.
    static final int MONEY_SCALE = 2;
    static final int MONEY_INTEGER_DIGITS = 10;
    static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");
    private static final DateTimeFormatter ORDER_NUMBER_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final OrderTotalsCalculator totalsCalculator;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a PENDING order with its initial history row.
     */
    @Transactional
    public Order createOrder(Long propertyId, NewOrder request, String actor) {
        requireActor(actor);
        if (request.orderType() == null) {
            throw new ValidationException("orderType is required");
        }
        requireCharge("tipAmount", request.tipAmount());
        requireCharge("deliveryFee", request.deliveryFee());

        Order order = Order.builder()
                .orderNumber(nextOrderNumber())
                .propertyId(propertyId)
                .customerId(request.customerId())
                .orderType(request.orderType())
                .status(OrderStatus.PENDING)
                .build();
        if (request.items() != null) {
            request.items().forEach(line -> addLine(order, line));
        }
        order.updateCharges(request.tipAmount(), request.deliveryFee());
        order.applyTotals(totalsOf(order));
        Order saved = orderRepository.saveAndFlush(order);

        appendHistory(saved, null, actor, CREATED_NOTE);
        log.info("Created order {} ({}) in property {} with {} item(s)",
                saved.getId(), saved.getOrderNumber(), propertyId, saved.getItems().size());
        return saved;
    }

    @Transactional
    public Order addItem(Long propertyId, Long orderId, NewOrderLine line) {
        Order order = lockOrder(propertyId, orderId);
        addLine(order, line);
        return saveWithProvisionalTotals(order);
    }

    /**
     * Changes quantity and/or unit price of a line. Null arguments keep the current value.
     */
    @Transactional
    public Order updateItem(Long propertyId, Long orderId, Long itemId, Integer quantity, BigDecimal unitPrice) {
        if (quantity != null) {
            requirePositiveQuantity(quantity);
        }
        if (unitPrice != null) {
            requireUnitPrice(unitPrice);
        }
        Order order = lockOrder(propertyId, orderId);
        order.updateItem(itemId, quantity, unitPrice);
        return saveWithProvisionalTotals(order);
    }

    @Transactional
    public Order removeItem(Long propertyId, Long orderId, Long itemId) {
        Order order = lockOrder(propertyId, orderId);
        order.removeItem(itemId);
        return saveWithProvisionalTotals(order);
    }

    /**
     * Sets the tip and/or delivery fee of a PENDING order. Null arguments keep the current amount.
     * Both are frozen with the rest of the totals at confirmation.
     */
    @Transactional
    public Order updateCharges(Long propertyId, Long orderId, BigDecimal tipAmount, BigDecimal deliveryFee) {
        requireCharge("tipAmount", tipAmount);
        requireCharge("deliveryFee", deliveryFee);
        Order order = lockOrder(propertyId, orderId);
        order.updateCharges(tipAmount, deliveryFee);
        Order saved = saveWithProvisionalTotals(order);
        log.info("Order {} charges set: tip {}, delivery fee {}", orderId, saved.getTipAmount(), saved.getDeliveryFee());
        return saved;
    }

    /**
     * Moves the order to {@code newStatus} and records the change.
     *
     * @param expectedStatus the status the caller last read, or null to skip the stale read check
     * @throws InvalidTransitionException if the edge is not in the status graph, or the order is no longer
     *                                    in {@code expectedStatus}; nothing is written
     * @throws ValidationException        if an order without items is confirmed
     */
    @Transactional
    public Order transitionOrderStatus(Long propertyId, Long orderId, OrderStatus newStatus, String actor,
                                       String notes, OrderStatus expectedStatus) {
        if (newStatus == null) {
            throw new ValidationException("status is required");
        }
        requireActor(actor);

        Order order = lockOrder(propertyId, orderId);
        OrderStatus current = order.getStatus();
        if (expectedStatus != null && expectedStatus != current) {
            log.warn("Stale transition on order {}: expected {} but found {}", orderId, expectedStatus, current);
            throw new InvalidTransitionException("Order", orderId, current, newStatus, expectedStatus);
        }
        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidTransitionException("Order", orderId, current, newStatus);
        }

        if (newStatus == OrderStatus.CONFIRMED) {
            if (order.getItems().isEmpty()) {
                throw new ValidationException("An order without items cannot be confirmed",
                        Map.of("orderId", orderId));
            }
            order.finalizeTotals(totalsOf(order), LocalDateTime.now());
        }
        order.moveTo(newStatus);
        Order saved = orderRepository.saveAndFlush(order);

        appendHistory(saved, current, actor, notes);
        log.info("Order {} moved {} -> {} by {}", orderId, current, newStatus, actor);
        return saved;
    }

    @Transactional(readOnly = true)
    public Order getOrder(Long propertyId, Long orderId) {
        return orderRepository.findByIdAndPropertyId(orderId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    /**
     * Orders of the property, newest first, optionally restricted to one status.
     */
    @Transactional(readOnly = true)
    public List<Order> listOrders(Long propertyId, OrderStatus status, int page, int size) {
        PageRequest pageable = pageOf(page, size);
        return status == null
                ? orderRepository.findByPropertyIdOrderByCreatedAtDescIdDesc(propertyId, pageable)
                : orderRepository.findByPropertyIdAndStatusOrderByCreatedAtDescIdDesc(propertyId, status, pageable);
    }

    /**
     * A customer's orders within the property, newest first.
     */
    @Transactional(readOnly = true)
    public List<Order> listCustomerOrders(Long propertyId, Long customerId, int page, int size) {
        if (customerId == null) {
            throw new ValidationException("customerId is required");
        }
        return orderRepository.findByPropertyIdAndCustomerIdOrderByCreatedAtDescIdDesc(
                propertyId, customerId, pageOf(page, size));
    }

    /**
     * Chronological, creation row first.
     */
    @Transactional(readOnly = true)
    public List<OrderStatusHistory> getStatusHistory(Long propertyId, Long orderId) {
        Order order = getOrder(propertyId, orderId);
        return historyRepository.findByOrderIdOrderByCreatedAtAscIdAsc(order.getId());
    }

    private Order lockOrder(Long propertyId, Long orderId) {
        return orderRepository.findWithLockByIdAndPropertyId(orderId, propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    private Order saveWithProvisionalTotals(Order order) {
        order.applyTotals(totalsOf(order));
        return orderRepository.saveAndFlush(order);
    }

    private OrderTotals totalsOf(Order order) {
        OrderTotals totals = totalsCalculator.calculate(order.getItems(), order.getTipAmount(), order.getDeliveryFee());
        if (totals.totalAmount().compareTo(MAX_AMOUNT) > 0) {
            throw new ValidationException("Order total would exceed " + MAX_AMOUNT.toPlainString(),
                    ORDER_TOTAL_TOO_LARGE, Map.of("totalAmount", totals.totalAmount().toPlainString()));
        }
        return totals;
    }

    private void addLine(Order order, NewOrderLine line) {
        if (line.menuItemId() == null) {
            throw new ValidationException("menuItemId is required");
        }
        if (line.name() == null || line.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        requirePositiveQuantity(line.quantity());
        requireUnitPrice(line.unitPrice());
        order.addItem(line.menuItemId(), line.name(), line.quantity(), line.unitPrice());
    }

    private void appendHistory(Order order, OrderStatus previous, String actor, String notes) {
        historyRepository.save(OrderStatusHistory.builder()
                .orderId(order.getId())
                .previousStatus(previous)
                .status(order.getStatus())
                .actor(actor)
                .notes(notes)
                .build());
        eventPublisher.publishEvent(OrderStatusChangedEvent.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .propertyId(order.getPropertyId())
                .previousStatus(previous == null ? null : previous.name())
                .status(order.getStatus().name())
                .actor(actor)
                .totalAmount(order.getTotalAmount())
                .timestamp(Instant.now())
                .build());
    }

    private static String nextOrderNumber() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
        return "ORD-" + LocalDate.now().format(ORDER_NUMBER_DATE) + "-" + suffix;
    }

    private static void requirePositiveQuantity(Integer quantity) {
        if (quantity == null || quantity <= 0) {
            Map<String, Object> details = new HashMap<>();
            details.put("quantity", quantity);
            throw new ValidationException("quantity must be positive", details);
        }
    }

    private static void requireUnitPrice(BigDecimal unitPrice) {
        if (unitPrice == null || unitPrice.signum() < 0) {
            Map<String, Object> details = new HashMap<>();
            details.put("unitPrice", unitPrice);
            throw new ValidationException("unitPrice must be zero or positive", details);
        }
        requireMoneyPrecision("unitPrice", unitPrice);
    }

    private static void requireCharge(String field, BigDecimal amount) {
        if (amount == null) {
            return;
        }
        if (amount.signum() < 0) {
            throw new ValidationException(field + " must be zero or positive", Map.of(field, amount.toPlainString()));
        }
        requireMoneyPrecision(field, amount);
    }

    /**
     * Rejects amounts the money columns would round or overflow.
     */
    private static void requireMoneyPrecision(String field, BigDecimal amount) {
        BigDecimal normalized = amount.stripTrailingZeros();
        int integerDigits = normalized.precision() - normalized.scale();
        if (normalized.scale() > MONEY_SCALE || integerDigits > MONEY_INTEGER_DIGITS) {
            throw new ValidationException(field + " allows at most " + MONEY_INTEGER_DIGITS
                    + " integer digits and " + MONEY_SCALE + " decimal places",
                    INVALID_AMOUNT_PRECISION, Map.of(field, amount.toPlainString()));
        }
    }

    private static PageRequest pageOf(int page, int size) {
        if (page < 0 || size <= 0) {
            throw new ValidationException("page must not be negative and size must be positive",
                    Map.of("page", page, "size", size));
        }
        return PageRequest.of(page, Math.min(size, Constants.MAX_PAGE_SIZE));
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("actor is required");
        }
    }
}

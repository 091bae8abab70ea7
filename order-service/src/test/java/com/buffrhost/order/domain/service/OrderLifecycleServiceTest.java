package com.buffrhost.order.domain.service;

import com.buffrhost.common.exception.InvalidTransitionException;
import com.buffrhost.common.exception.ResourceNotFoundException;
import com.buffrhost.common.exception.ValidationException;
import com.buffrhost.common.util.Constants;
import com.buffrhost.order.domain.model.Order;
import com.buffrhost.order.domain.model.OrderStatus;
import com.buffrhost.order.domain.model.OrderStatusHistory;
import com.buffrhost.order.domain.model.OrderType;
import com.buffrhost.order.domain.repository.OrderRepository;
import com.buffrhost.order.domain.repository.OrderStatusHistoryRepository;
import com.buffrhost.order.events.OrderStatusChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link OrderLifecycleService}: the status graph, item freezing,
 * totals at confirmation and stale read detection.
 */
@ExtendWith(MockitoExtension.class)
class OrderLifecycleServiceTest {

    private static final Long PROPERTY_ID = 1L;
    private static final Long ORDER_ID = 10L;

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderStatusHistoryRepository historyRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private OrderLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new OrderLifecycleService(orderRepository, historyRepository,
                new OrderTotalsCalculator(new BigDecimal("0.15")), eventPublisher);
    }

    @Test
    @DisplayName("confirm freezes items, a later add fails, and a completed order cannot go back to pending")
    void scenarioC() {
        Order order = order(OrderStatus.PENDING);
        givenLocked(order);
        given(orderRepository.saveAndFlush(any(Order.class))).will(returnsFirstArg());

        service.addItem(PROPERTY_ID, ORDER_ID, line("Burger", 2, "12.50"));
        Order confirmed = service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.CONFIRMED,
                "waiter", null, null);

        assertThat(confirmed.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(confirmed.getSubtotal()).isEqualByComparingTo("25.00");
        assertThat(confirmed.getTaxAmount()).isEqualByComparingTo("3.75");
        assertThat(confirmed.getTotalAmount()).isEqualByComparingTo("28.75");
        assertThat(confirmed.getTotalsFinalizedAt()).isNotNull();

        assertThatThrownBy(() -> service.addItem(PROPERTY_ID, ORDER_ID, line("Fries", 1, "4.00")))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(Order.ITEMS_FROZEN));
        assertThat(order.getItems()).hasSize(1);

        service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.PREPARING, "chef", null, null);
        service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.READY, "chef", null, null);
        service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.COMPLETED, "waiter", null, null);

        assertThatThrownBy(() -> service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.PENDING,
                "waiter", null, null))
                .isInstanceOfSatisfying(InvalidTransitionException.class, ex -> {
                    assertThat(ex.getDetails()).containsEntry("currentStatus", "COMPLETED");
                    assertThat(ex.getDetails()).containsEntry("requestedStatus", "PENDING");
                });
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        verify(historyRepository, times(4)).save(any(OrderStatusHistory.class));
    }

    @Test
    void createOrder_writesInitialHistoryRowWithoutPreviousStatus() {
        given(orderRepository.saveAndFlush(any(Order.class))).will(invocation -> {
            Order saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", ORDER_ID);
            return saved;
        });

        Order created = service.createOrder(PROPERTY_ID,
                new NewOrder(7L, OrderType.ROOM_SERVICE, List.of(line("Club sandwich", 1, "9.00"))), "frontdesk");

        assertThat(created.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(created.getOrderNumber()).startsWith("ORD-");
        assertThat(created.getSubtotal()).isEqualByComparingTo("9.00");
        assertThat(created.getTotalsFinalizedAt()).isNull();

        ArgumentCaptor<OrderStatusHistory> history = ArgumentCaptor.forClass(OrderStatusHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getOrderId()).isEqualTo(ORDER_ID);
        assertThat(history.getValue().getPreviousStatus()).isNull();
        assertThat(history.getValue().getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(history.getValue().getActor()).isEqualTo("frontdesk");

        ArgumentCaptor<OrderStatusChangedEvent> event = ArgumentCaptor.forClass(OrderStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getStatus()).isEqualTo("PENDING");
        assertThat(event.getValue().getPreviousStatus()).isNull();
    }

    @Test
    void createOrder_withoutType_isRejected() {
        assertThatThrownBy(() -> service.createOrder(PROPERTY_ID, new NewOrder(7L, null, List.of()), "waiter"))
                .isInstanceOf(ValidationException.class);
        verify(orderRepository, never()).saveAndFlush(any(Order.class));
    }

    @Test
    void transition_recordsPreviousStatusActorAndNotes() {
        Order order = order(OrderStatus.CONFIRMED);
        givenLocked(order);
        given(orderRepository.saveAndFlush(any(Order.class))).will(returnsFirstArg());

        service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.CANCELLED, "manager", "guest left", null);

        ArgumentCaptor<OrderStatusHistory> history = ArgumentCaptor.forClass(OrderStatusHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getPreviousStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(history.getValue().getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(history.getValue().getActor()).isEqualTo("manager");
        assertThat(history.getValue().getNotes()).isEqualTo("guest left");
    }

    @Test
    @DisplayName("a transition based on a stale read fails even when the edge would be valid from the new status")
    void staleExpectedStatus_isRejectedWithoutChanges() {
        Order order = order(OrderStatus.PREPARING);
        givenLocked(order);

        assertThatThrownBy(() -> service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.CANCELLED,
                "manager", null, OrderStatus.CONFIRMED))
                .isInstanceOfSatisfying(InvalidTransitionException.class, ex -> {
                    assertThat(ex.getDetails()).containsEntry("expectedStatus", "CONFIRMED");
                    assertThat(ex.getDetails()).containsEntry("currentStatus", "PREPARING");
                });

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PREPARING);
        verify(orderRepository, never()).saveAndFlush(any(Order.class));
        verify(historyRepository, never()).save(any(OrderStatusHistory.class));
    }

    @Test
    void cancel_fromReady_isInvalid() {
        givenLocked(order(OrderStatus.READY));

        assertThatThrownBy(() -> service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.CANCELLED,
                "manager", null, null))
                .isInstanceOf(InvalidTransitionException.class);
        verify(historyRepository, never()).save(any(OrderStatusHistory.class));
    }

    @Test
    void confirm_withoutItems_isValidationError() {
        givenLocked(order(OrderStatus.PENDING));

        assertThatThrownBy(() -> service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.CONFIRMED,
                "waiter", null, null))
                .isInstanceOf(ValidationException.class);
        verify(historyRepository, never()).save(any(OrderStatusHistory.class));
    }

    @Test
    void updateAndRemoveItem_recomputeProvisionalTotals() {
        Order order = order(OrderStatus.PENDING);
        order.addItem(1L, "Soup", 1, new BigDecimal("6.00"));
        order.addItem(2L, "Bread", 2, new BigDecimal("1.50"));
        ReflectionTestUtils.setField(order.getItems().get(0), "id", 100L);
        ReflectionTestUtils.setField(order.getItems().get(1), "id", 101L);
        givenLocked(order);
        given(orderRepository.saveAndFlush(any(Order.class))).will(returnsFirstArg());

        service.updateItem(PROPERTY_ID, ORDER_ID, 100L, 2, null);
        assertThat(order.getItems().get(0).getLineTotal()).isEqualByComparingTo("12.00");
        assertThat(order.getSubtotal()).isEqualByComparingTo("15.00");

        service.removeItem(PROPERTY_ID, ORDER_ID, 101L);
        assertThat(order.getItems()).hasSize(1);
        assertThat(order.getSubtotal()).isEqualByComparingTo("12.00");
        assertThat(order.getTotalAmount()).isEqualByComparingTo("13.80");
    }

    @Test
    void updateItem_unknownLine_isNotFound() {
        givenLocked(order(OrderStatus.PENDING));

        assertThatThrownBy(() -> service.updateItem(PROPERTY_ID, ORDER_ID, 999L, 1, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void addItem_withNonPositiveQuantity_isRejected() {
        givenLocked(order(OrderStatus.PENDING));

        assertThatThrownBy(() -> service.addItem(PROPERTY_ID, ORDER_ID, line("Tea", 0, "2.00")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void orderOfAnotherProperty_isNotFound() {
        given(orderRepository.findWithLockByIdAndPropertyId(ORDER_ID, 2L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.transitionOrderStatus(2L, ORDER_ID, OrderStatus.CONFIRMED,
                "waiter", null, null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Order with identifier 10 not found");
    }

    @Test
    void getStatusHistory_readsChronologically() {
        Order order = order(OrderStatus.CONFIRMED);
        given(orderRepository.findByIdAndPropertyId(ORDER_ID, PROPERTY_ID)).willReturn(Optional.of(order));
        given(historyRepository.findByOrderIdOrderByCreatedAtAscIdAsc(ORDER_ID)).willReturn(List.of());

        assertThat(service.getStatusHistory(PROPERTY_ID, ORDER_ID)).isEmpty();
        verify(historyRepository).findByOrderIdOrderByCreatedAtAscIdAsc(ORDER_ID);
    }

    @Test
    @DisplayName("tip and delivery fee move the provisional total, then freeze with it at confirmation")
    void charges_editableWhilePending_frozenAfterConfirm() {
        Order order = order(OrderStatus.PENDING);
        order.addItem(1L, "Pizza", 2, new BigDecimal("10.00"));
        givenLocked(order);
        given(orderRepository.saveAndFlush(any(Order.class))).will(returnsFirstArg());

        service.updateCharges(PROPERTY_ID, ORDER_ID, new BigDecimal("2.50"), new BigDecimal("4.00"));
        assertThat(order.getTotalAmount()).isEqualByComparingTo("29.50");
        assertThat(order.getTotalsFinalizedAt()).isNull();

        service.updateCharges(PROPERTY_ID, ORDER_ID, null, new BigDecimal("3.00"));
        assertThat(order.getTipAmount()).isEqualByComparingTo("2.50");
        assertThat(order.getDeliveryFee()).isEqualByComparingTo("3.00");

        Order confirmed = service.transitionOrderStatus(PROPERTY_ID, ORDER_ID, OrderStatus.CONFIRMED, "waiter", null, null);
        assertThat(confirmed.getTotalAmount()).isEqualByComparingTo("28.50");
        assertThat(confirmed.getTotalsFinalizedAt()).isNotNull();

        assertThatThrownBy(() -> service.updateCharges(PROPERTY_ID, ORDER_ID, new BigDecimal("10.00"), null))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(Order.CHARGES_FROZEN));
        assertThat(order.getTipAmount()).isEqualByComparingTo("2.50");
        assertThat(order.getTotalAmount()).isEqualByComparingTo("28.50");
    }

    @Test
    void createOrder_withCharges_includesThemInTotal() {
        given(orderRepository.saveAndFlush(any(Order.class))).will(returnsFirstArg());

        Order created = service.createOrder(PROPERTY_ID, new NewOrder(7L, OrderType.DELIVERY,
                List.of(line("Curry", 1, "12.00")), new BigDecimal("1.00"), new BigDecimal("5.00")), "web");

        // 12.00 + 1.80 tax + 1.00 tip + 5.00 delivery
        assertThat(created.getTotalAmount()).isEqualByComparingTo("19.80");
        assertThat(created.getDeliveryFee()).isEqualByComparingTo("5.00");
    }

    @Test
    void negativeCharge_isRejectedBeforeLocking() {
        assertThatThrownBy(() -> service.updateCharges(PROPERTY_ID, ORDER_ID, new BigDecimal("-1"), null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(orderRepository);
    }

    @Test
    @DisplayName("a unit price with more than two decimals is rejected, so provisional and final totals agree")
    void unitPriceBeyondCents_isRejected() {
        givenLocked(order(OrderStatus.PENDING));

        assertThatThrownBy(() -> service.addItem(PROPERTY_ID, ORDER_ID, line("Gum", 3, "1.005")))
                .isInstanceOfSatisfying(ValidationException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(OrderLifecycleService.INVALID_AMOUNT_PRECISION);
                    assertThat(ex.getDetails()).containsEntry("unitPrice", "1.005");
                });
        verify(orderRepository, never()).saveAndFlush(any(Order.class));

        assertThatThrownBy(() -> service.updateItem(PROPERTY_ID, ORDER_ID, 100L, null, new BigDecimal("2.499")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.updateCharges(PROPERTY_ID, ORDER_ID, new BigDecimal("0.001"), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unitPriceWithTrailingZeros_isAccepted() {
        Order order = order(OrderStatus.PENDING);
        givenLocked(order);
        given(orderRepository.saveAndFlush(any(Order.class))).will(returnsFirstArg());

        service.addItem(PROPERTY_ID, ORDER_ID, line("Tea", 2, "2.5000"));

        assertThat(order.getSubtotal()).isEqualByComparingTo("5.00");
    }

    @Test
    void totalBeyondMoneyColumn_isRejected() {
        givenLocked(order(OrderStatus.PENDING));

        assertThatThrownBy(() -> service.addItem(PROPERTY_ID, ORDER_ID, line("Yacht", 2, "9999999999.99")))
                .isInstanceOfSatisfying(ValidationException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(OrderLifecycleService.ORDER_TOTAL_TOO_LARGE));
        verify(orderRepository, never()).saveAndFlush(any(Order.class));
    }

    @Test
    @DisplayName("listing by property filters on status only when one is given and caps the page size")
    void listOrders_byPropertyAndStatus() {
        given(orderRepository.findByPropertyIdOrderByCreatedAtDescIdDesc(eq(PROPERTY_ID), any()))
                .willReturn(List.of(order(OrderStatus.PENDING)));
        given(orderRepository.findByPropertyIdAndStatusOrderByCreatedAtDescIdDesc(eq(PROPERTY_ID),
                eq(OrderStatus.READY), any())).willReturn(List.of());

        assertThat(service.listOrders(PROPERTY_ID, null, 0, 1_000)).hasSize(1);
        assertThat(service.listOrders(PROPERTY_ID, OrderStatus.READY, 1, 20)).isEmpty();

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(orderRepository).findByPropertyIdOrderByCreatedAtDescIdDesc(eq(PROPERTY_ID), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(Constants.MAX_PAGE_SIZE);
    }

    @Test
    void listCustomerOrders_scopedToProperty() {
        given(orderRepository.findByPropertyIdAndCustomerIdOrderByCreatedAtDescIdDesc(eq(PROPERTY_ID), eq(7L), any()))
                .willReturn(List.of(order(OrderStatus.COMPLETED)));

        assertThat(service.listCustomerOrders(PROPERTY_ID, 7L, 0, 10))
                .extracting(Order::getStatus).containsExactly(OrderStatus.COMPLETED);
        assertThatThrownBy(() -> service.listCustomerOrders(PROPERTY_ID, 7L, -1, 10))
                .isInstanceOf(ValidationException.class);
    }

    private void givenLocked(Order order) {
        given(orderRepository.findWithLockByIdAndPropertyId(ORDER_ID, PROPERTY_ID)).willReturn(Optional.of(order));
    }

    private static Order order(OrderStatus status) {
        return Order.builder()
                .id(ORDER_ID)
                .orderNumber("ORD-20250601-TEST")
                .propertyId(PROPERTY_ID)
                .orderType(OrderType.DINE_IN)
                .status(status)
                .build();
    }

    private static NewOrderLine line(String name, int quantity, String unitPrice) {
        return new NewOrderLine(1L, name, quantity, new BigDecimal(unitPrice));
    }
}

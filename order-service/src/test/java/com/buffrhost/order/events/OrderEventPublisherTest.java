package com.buffrhost.order.events;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OrderEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @InjectMocks
    private OrderEventPublisher publisher;

    @Test
    void onStatusChanged_sendsToConfiguredTopicKeyedByOrder() {
        ReflectionTestUtils.setField(publisher, "statusTopic", "order-status-changed");
        OrderStatusChangedEvent event = OrderStatusChangedEvent.builder()
                .orderId(10L)
                .propertyId(1L)
                .previousStatus("PENDING")
                .status("CONFIRMED")
                .actor("waiter")
                .build();
        given(kafkaTemplate.send("order-status-changed", "10", event)).willReturn(new CompletableFuture<>());

        publisher.onStatusChanged(event);

        verify(kafkaTemplate).send("order-status-changed", "10", event);
    }
}

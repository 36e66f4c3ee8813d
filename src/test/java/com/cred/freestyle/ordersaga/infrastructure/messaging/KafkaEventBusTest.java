package com.cred.freestyle.ordersaga.infrastructure.messaging;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.testutil.TestDataBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KafkaEventBus.
 *
 * @author Order Saga Team
 */
@ExtendWith(MockitoExtension.class)
class KafkaEventBusTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = TestDataBuilder.objectMapper();

    private KafkaEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new KafkaEventBus(kafkaTemplate, objectMapper);
    }

    @Test
    @DisplayName("publish - Should send to the subject topic keyed by order id")
    void publish_TopicAndKey() throws Exception {
        // Arrange
        DomainEvent event = DomainEvent.of("inventory.reserved", "inventory_service",
                Map.of("order_id", "o1", "reservation_id", "res-1"));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(new CompletableFuture<SendResult<String, String>>());

        // Act
        eventBus.publish(event);

        // Assert
        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("inventory_service.inventory.reserved"), eq("o1"), value.capture());
        DomainEvent sent = objectMapper.readValue(value.getValue(), DomainEvent.class);
        assertThat(sent.getId()).isEqualTo(event.getId());
        assertThat(sent.getType()).isEqualTo("inventory.reserved");
        assertThat(sent.getSource()).isEqualTo("inventory_service");
        assertThat(value.getValue()).doesNotContain("subject");
    }

    @Test
    @DisplayName("publish - Broker failure: Should complete the returned future exceptionally")
    void publish_BrokerFailure() {
        // Arrange
        DomainEvent event = DomainEvent.of("inventory.failed", "inventory_service", Map.of("order_id", "o1"));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        // Act
        CompletableFuture<Void> result = eventBus.publish(event);

        // Assert
        assertThat(result).isCompletedExceptionally();
    }
}

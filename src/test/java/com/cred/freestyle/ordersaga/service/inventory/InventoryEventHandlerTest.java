package com.cred.freestyle.ordersaga.service.inventory;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.domain.event.EventTypes;
import com.cred.freestyle.ordersaga.domain.event.payload.LineItemPayload;
import com.cred.freestyle.ordersaga.saga.EventPayloadReader;
import com.cred.freestyle.ordersaga.saga.HandlerResult;
import com.cred.freestyle.ordersaga.testutil.TestDataBuilder;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InventoryEventHandler.
 *
 * @author Order Saga Team
 */
@ExtendWith(MockitoExtension.class)
class InventoryEventHandlerTest {

    @Mock
    private InventoryParticipant participant;

    private InventoryEventHandler handler;

    @BeforeEach
    void setUp() {
        EventPayloadReader reader = new EventPayloadReader(
                TestDataBuilder.objectMapper(),
                Validation.buildDefaultValidatorFactory().getValidator());
        handler = new InventoryEventHandler(participant, reader);
    }

    @Test
    @DisplayName("handle - order.created: Should pass the order lines to the participant")
    @SuppressWarnings("unchecked")
    void handle_OrderCreated() {
        // Arrange
        DomainEvent event = TestDataBuilder.orderCreated("o1",
                List.of(TestDataBuilder.item("SKU-1", 2), TestDataBuilder.item("SKU-2", 1)));
        when(participant.handleOrderCreated(eq("o1"), eq("user-1"), anyList(), eq("order.created")))
                .thenReturn(HandlerResult.applied("res-1"));

        // Act
        HandlerResult result = handler.handle(event);

        // Assert
        assertThat(result.getOutcome()).isEqualTo(HandlerResult.Outcome.APPLIED);
        ArgumentCaptor<List<LineItemPayload>> items = ArgumentCaptor.forClass(List.class);
        verify(participant).handleOrderCreated(eq("o1"), eq("user-1"), items.capture(), eq("order.created"));
        assertThat(items.getValue()).extracting(LineItemPayload::skuId).containsExactly("SKU-1", "SKU-2");
    }

    @Test
    @DisplayName("handle - order.created without items: Should reject without calling the participant")
    void handle_OrderCreatedMissingItems() {
        // Arrange
        DomainEvent event = DomainEvent.of(EventTypes.ORDER_CREATED, EventTypes.ORDER_SERVICE,
                Map.of("order_id", "o1"));

        // Act
        HandlerResult result = handler.handle(event);

        // Assert
        assertThat(result.getOutcome()).isEqualTo(HandlerResult.Outcome.REJECTED);
        assertThat(result.getMessage()).contains("items is required");
        verifyNoInteractions(participant);
    }

    @Test
    @DisplayName("handle - payment.completed: Should commit through the participant")
    void handle_PaymentCompleted() {
        // Arrange
        when(participant.handlePaymentCompleted("o1", "user-1", "payment.completed"))
                .thenReturn(HandlerResult.applied("res-1"));

        // Act
        HandlerResult result = handler.handle(TestDataBuilder.paymentCompleted("o1"));

        // Assert
        assertThat(result.getAggregateId()).isEqualTo("res-1");
    }

    @Test
    @DisplayName("handle - order.canceled without reason: Should default to order_canceled")
    void handle_OrderCanceledDefaultReason() {
        // Arrange
        when(participant.handleOrderCanceled("o1", "user-1", "order_canceled", "order.canceled"))
                .thenReturn(HandlerResult.skipped("no active reservation"));

        // Act
        HandlerResult result = handler.handle(TestDataBuilder.orderCanceled("o1", null));

        // Assert
        assertThat(result.getOutcome()).isEqualTo(HandlerResult.Outcome.SKIPPED);
        verify(participant).handleOrderCanceled("o1", "user-1", "order_canceled", "order.canceled");
    }

    @Test
    @DisplayName("handle - Unknown type: Should skip")
    void handle_UnknownType() {
        HandlerResult result = handler.handle(
                DomainEvent.of("order.shipped", EventTypes.ORDER_SERVICE, Map.of("order_id", "o1")));

        assertThat(result.getOutcome()).isEqualTo(HandlerResult.Outcome.SKIPPED);
        verifyNoInteractions(participant);
    }
}

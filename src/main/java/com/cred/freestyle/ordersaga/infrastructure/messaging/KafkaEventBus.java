package com.cred.freestyle.ordersaga.infrastructure.messaging;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka implementation of the event bus.
 *
 * Topic naming: one topic per subject, {@code <source>.<type>}
 * (e.g. {@code inventory_service.inventory.reserved}).
 * Key: order_id, so all events of one order land on the same partition.
 *
 * @author Order Saga Team
 */
@Component
public class KafkaEventBus implements EventBus {

    private static final Logger logger = LoggerFactory.getLogger(KafkaEventBus.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public KafkaEventBus(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<Void> publish(DomainEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing event {} of type {}", event.getId(), event.getType(), e);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(event.getSubject(), event.getOrderId(), payload);

        return future.thenAccept(result ->
                logger.debug("Published {} for order {}, partition: {}, offset: {}",
                        event.getSubject(), event.getOrderId(),
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset()));
    }
}

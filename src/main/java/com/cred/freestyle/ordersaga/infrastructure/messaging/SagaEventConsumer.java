package com.cred.freestyle.ordersaga.infrastructure.messaging;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.infrastructure.cache.ProcessedEventCache;
import com.cred.freestyle.ordersaga.infrastructure.metrics.SagaMetricsService;
import com.cred.freestyle.ordersaga.saga.DispatchResult;
import com.cred.freestyle.ordersaga.saga.EventRouter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Kafka consumer feeding upstream saga events to the event router.
 *
 * Processing flow:
 * 1. Parse the record into a domain event (malformed records are dropped)
 * 2. Skip events this group already handled
 * 3. Dispatch to every participant routed for the topic
 * 4. Acknowledge, or nack for redelivery when enabled and a handler failed retryably
 *
 * @author Order Saga Team
 */
@Component
public class SagaEventConsumer {

    private static final Logger logger = LoggerFactory.getLogger(SagaEventConsumer.class);

    private final EventRouter eventRouter;
    private final ProcessedEventCache processedEventCache;
    private final SagaMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final boolean redeliverOnFailure;
    private final Duration redeliveryBackoff;

    public SagaEventConsumer(
            EventRouter eventRouter,
            ProcessedEventCache processedEventCache,
            SagaMetricsService metricsService,
            ObjectMapper objectMapper,
            @Value("${ordersaga.messaging.redeliver-on-failure:false}") boolean redeliverOnFailure,
            @Value("${ordersaga.messaging.redelivery-backoff:PT2S}") Duration redeliveryBackoff) {
        this.eventRouter = eventRouter;
        this.processedEventCache = processedEventCache;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.redeliverOnFailure = redeliverOnFailure;
        this.redeliveryBackoff = redeliveryBackoff;
    }

    /**
     * Consume one upstream event. Topics are the router's subjects.
     *
     * @param record Kafka record (topic = subject, key = order id, value = event JSON)
     * @param acknowledgment Manual acknowledgment
     */
    @KafkaListener(
            topics = "#{@eventRouter.subscribedSubjects()}",
            groupId = "${spring.kafka.consumer.group-id:order-saga}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        DomainEvent event;
        try {
            event = objectMapper.readValue(record.value(), DomainEvent.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Dropping malformed record on {} (partition {}, offset {}): {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            acknowledgment.acknowledge();
            return;
        }

        if (event.getType() == null) {
            logger.warn("Dropping event {} on {} without a type", event.getId(), record.topic());
            acknowledgment.acknowledge();
            return;
        }

        if (processedEventCache.isProcessed(event.getId())) {
            logger.info("Event {} on {} already processed, skipping", event.getId(), record.topic());
            metricsService.recordDuplicateEvent(record.topic());
            acknowledgment.acknowledge();
            return;
        }

        DispatchResult result = eventRouter.dispatch(record.topic(), event);
        logger.debug("Dispatched event {}: {}", event.getId(), result);

        if (result.requiresRedelivery() && redeliverOnFailure) {
            logger.warn("Event {} on {} failed retryably, requesting redelivery in {}",
                    event.getId(), record.topic(), redeliveryBackoff);
            acknowledgment.nack(redeliveryBackoff);
            return;
        }

        if (result.hasFailure()) {
            logger.warn("Event {} on {} failed, acknowledging without redelivery: {}",
                    event.getId(), record.topic(), result);
        } else {
            processedEventCache.markProcessed(event.getId());
        }
        acknowledgment.acknowledge();
    }
}

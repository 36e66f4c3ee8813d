package com.cred.freestyle.ordersaga.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis record of event ids already handled by this consumer group.
 *
 * This is a fast path for redeliveries only: handlers stay idempotent through
 * their conditional updates, so any cache error is logged and treated as
 * "not processed".
 *
 * Cache Keys:
 * - event:processed:{group}:{event_id} -> "1" (TTL, default 24h)
 *
 * @author Order Saga Team
 */
@Service
public class ProcessedEventCache {

    private static final Logger logger = LoggerFactory.getLogger(ProcessedEventCache.class);

    private static final String KEY_PREFIX = "event:processed:";

    private final StringRedisTemplate redisTemplate;
    private final boolean enabled;
    private final String consumerGroup;
    private final Duration ttl;

    public ProcessedEventCache(
            StringRedisTemplate redisTemplate,
            @Value("${ordersaga.messaging.dedup.enabled:true}") boolean enabled,
            @Value("${spring.kafka.consumer.group-id:order-saga}") String consumerGroup,
            @Value("${ordersaga.messaging.dedup.ttl:PT24H}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.consumerGroup = consumerGroup;
        this.ttl = ttl;
    }

    /**
     * Check if an event was already handled.
     *
     * @param eventId Event ID
     * @return true only if the cache positively knows the event
     */
    public boolean isProcessed(String eventId) {
        if (!enabled || eventId == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(eventId)));
        } catch (Exception e) {
            logger.warn("Processed-event lookup failed for {}, dispatching anyway: {}", eventId, e.getMessage());
            return false;
        }
    }

    /**
     * Record an event as handled.
     *
     * @param eventId Event ID
     */
    public void markProcessed(String eventId) {
        if (!enabled || eventId == null) {
            return;
        }
        try {
            Boolean created = redisTemplate.opsForValue().setIfAbsent(buildKey(eventId), "1", ttl);
            if (!Boolean.TRUE.equals(created)) {
                logger.debug("Event {} was already marked processed", eventId);
            }
        } catch (Exception e) {
            logger.warn("Failed to mark event {} processed: {}", eventId, e.getMessage());
        }
    }

    private String buildKey(String eventId) {
        return KEY_PREFIX + consumerGroup + ":" + eventId;
    }
}

package com.cred.freestyle.ordersaga.infrastructure.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProcessedEventCache.
 *
 * @author Order Saga Team
 */
@ExtendWith(MockitoExtension.class)
class ProcessedEventCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private ProcessedEventCache cache;

    @BeforeEach
    void setUp() {
        cache = new ProcessedEventCache(redisTemplate, true, "order-saga", Duration.ofHours(24));
    }

    @Test
    @DisplayName("isProcessed - Key present: Should return true")
    void isProcessed_Hit() {
        when(redisTemplate.hasKey("event:processed:order-saga:e1")).thenReturn(true);

        assertThat(cache.isProcessed("e1")).isTrue();
    }

    @Test
    @DisplayName("isProcessed - Redis down: Should treat the event as not processed")
    void isProcessed_RedisDown() {
        when(redisTemplate.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(cache.isProcessed("e1")).isFalse();
    }

    @Test
    @DisplayName("markProcessed - Should set the key with the configured TTL")
    void markProcessed() {
        // Arrange
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent("event:processed:order-saga:e1", "1", Duration.ofHours(24)))
                .thenReturn(true);

        // Act
        cache.markProcessed("e1");

        // Assert
        verify(valueOperations).setIfAbsent("event:processed:order-saga:e1", "1", Duration.ofHours(24));
    }

    @Test
    @DisplayName("markProcessed - Redis down: Should not throw")
    void markProcessed_RedisDown() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatCode(() -> cache.markProcessed("e1")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Disabled cache - Should never touch Redis")
    void disabled() {
        ProcessedEventCache disabled = new ProcessedEventCache(redisTemplate, false, "order-saga", Duration.ofHours(1));

        assertThat(disabled.isProcessed("e1")).isFalse();
        disabled.markProcessed("e1");

        verifyNoInteractions(redisTemplate);
    }
}

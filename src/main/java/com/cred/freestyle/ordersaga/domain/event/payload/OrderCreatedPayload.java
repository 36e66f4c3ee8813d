package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * order.created (v1).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderCreatedPayload(
        @NotBlank(message = "order_id is required") String orderId,
        String userId,
        @NotNull(message = "items is required") List<LineItemPayload> items,
        Map<String, Object> metadata
) {
}

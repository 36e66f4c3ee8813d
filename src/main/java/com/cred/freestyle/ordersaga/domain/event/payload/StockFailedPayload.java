package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * inventory.failed (v1). error_code is NO_VALID_ITEMS or RESERVATION_ERROR.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StockFailedPayload(
        String orderId,
        String userId,
        String errorCode,
        String errorMessage,
        Map<String, Object> metadata
) {
}

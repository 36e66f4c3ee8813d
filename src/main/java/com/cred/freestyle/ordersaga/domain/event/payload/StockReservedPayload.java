package com.cred.freestyle.ordersaga.domain.event.payload;

import com.cred.freestyle.ordersaga.domain.model.ReservedItem;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * inventory.reserved (v1).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StockReservedPayload(
        String orderId,
        String userId,
        String reservationId,
        List<ReservedItem> items,
        Instant expiresAt,
        Map<String, Object> metadata
) {
}

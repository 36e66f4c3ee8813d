package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * fulfillment.label.created (v1).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LabelCreatedPayload(
        String orderId,
        String userId,
        String shipmentId,
        String carrier,
        String trackingNumber,
        String labelUrl,
        Instant estimatedDelivery,
        Map<String, Object> metadata
) {
}

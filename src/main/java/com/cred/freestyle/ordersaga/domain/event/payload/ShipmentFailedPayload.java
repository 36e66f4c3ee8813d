package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * fulfillment.shipment.failed (v1). error_code is PREPARATION_ERROR or LABEL_CREATION_ERROR.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ShipmentFailedPayload(
        String orderId,
        String userId,
        String shipmentId,
        String errorCode,
        String errorMessage,
        Map<String, Object> metadata
) {
}

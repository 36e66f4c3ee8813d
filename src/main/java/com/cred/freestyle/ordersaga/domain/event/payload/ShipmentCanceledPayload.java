package com.cred.freestyle.ordersaga.domain.event.payload;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * fulfillment.shipment.canceled (v1). refund_shipping is true when a label had already been bought.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ShipmentCanceledPayload(
        String orderId,
        String userId,
        String shipmentId,
        String reason,
        boolean refundShipping,
        Map<String, Object> metadata
) {
}

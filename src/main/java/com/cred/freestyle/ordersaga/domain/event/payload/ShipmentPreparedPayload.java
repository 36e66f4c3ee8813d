package com.cred.freestyle.ordersaga.domain.event.payload;

import com.cred.freestyle.ordersaga.domain.model.ShipmentItem;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * fulfillment.shipment.prepared (v1).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ShipmentPreparedPayload(
        String orderId,
        String userId,
        String shipmentId,
        List<ShipmentItem> items,
        int estimatedWeightGrams,
        Map<String, Object> shippingAddress,
        Map<String, Object> metadata
) {
}

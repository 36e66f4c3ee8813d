package com.cred.freestyle.ordersaga.infrastructure.provider;

import java.time.Instant;

/**
 * Label bought from a shipping provider.
 *
 * @author Order Saga Team
 */
public record ShippingLabel(
        String carrier,
        String trackingNumber,
        String labelUrl,
        Instant estimatedDelivery
) {
}

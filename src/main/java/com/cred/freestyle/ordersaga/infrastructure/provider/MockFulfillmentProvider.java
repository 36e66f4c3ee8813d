package com.cred.freestyle.ordersaga.infrastructure.provider;

import com.cred.freestyle.ordersaga.domain.model.Shipment;
import com.cred.freestyle.ordersaga.exception.FulfillmentProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * In-process shipping provider that fabricates labels.
 * Active unless another provider is selected with ordersaga.fulfillment.provider.type.
 *
 * @author Order Saga Team
 */
@Component
@ConditionalOnProperty(name = "ordersaga.fulfillment.provider.type", havingValue = "mock", matchIfMissing = true)
public class MockFulfillmentProvider implements FulfillmentProvider {

    private static final Logger logger = LoggerFactory.getLogger(MockFulfillmentProvider.class);

    private static final String TRACKING_PREFIX = "trk_";

    private final String carrier;
    private final String labelBaseUrl;
    private final long transitDays;

    public MockFulfillmentProvider(
            @Value("${ordersaga.fulfillment.provider.carrier:USPS}") String carrier,
            @Value("${ordersaga.fulfillment.provider.label-base-url:https://labels.example.com}") String labelBaseUrl,
            @Value("${ordersaga.fulfillment.provider.transit-days:5}") long transitDays) {
        this.carrier = carrier;
        this.labelBaseUrl = labelBaseUrl.endsWith("/")
                ? labelBaseUrl.substring(0, labelBaseUrl.length() - 1)
                : labelBaseUrl;
        this.transitDays = transitDays;
    }

    @Override
    public ShippingLabel createShipment(Shipment shipment) {
        if (shipment.getItems() == null || shipment.getItems().isEmpty()) {
            throw new FulfillmentProviderException(shipment.getShipmentId(), "shipment has no items");
        }

        String trackingNumber = TRACKING_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        String labelUrl = labelBaseUrl + "/" + trackingNumber + ".pdf";
        Instant estimatedDelivery = Instant.now().plus(Duration.ofDays(transitDays));

        logger.info("Mock label created for shipment {}: carrier {}, tracking {}",
                shipment.getShipmentId(), carrier, trackingNumber);
        return new ShippingLabel(carrier, trackingNumber, labelUrl, estimatedDelivery);
    }
}

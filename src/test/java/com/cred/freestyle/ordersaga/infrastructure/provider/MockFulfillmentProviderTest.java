package com.cred.freestyle.ordersaga.infrastructure.provider;

import com.cred.freestyle.ordersaga.domain.model.Shipment;
import com.cred.freestyle.ordersaga.domain.model.Shipment.ShipmentStatus;
import com.cred.freestyle.ordersaga.exception.FulfillmentProviderException;
import com.cred.freestyle.ordersaga.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for MockFulfillmentProvider.
 *
 * @author Order Saga Team
 */
class MockFulfillmentProviderTest {

    private final MockFulfillmentProvider provider =
            new MockFulfillmentProvider("USPS", "https://labels.example.com/", 5);

    @Test
    @DisplayName("createShipment - Should return a tracking number, label URL and delivery estimate")
    void createShipment() {
        // Arrange
        Shipment shipment = TestDataBuilder.shipment("o1", ShipmentStatus.CREATED);
        Instant before = Instant.now();

        // Act
        ShippingLabel label = provider.createShipment(shipment);

        // Assert
        assertThat(label.carrier()).isEqualTo("USPS");
        assertThat(label.trackingNumber()).matches("trk_[0-9a-f]{16}");
        assertThat(label.labelUrl()).isEqualTo("https://labels.example.com/" + label.trackingNumber() + ".pdf");
        assertThat(label.estimatedDelivery()).isAfterOrEqualTo(before.plus(Duration.ofDays(5)));
    }

    @Test
    @DisplayName("createShipment - Each call: Should issue a distinct tracking number")
    void createShipment_DistinctTracking() {
        Shipment shipment = TestDataBuilder.shipment("o1", ShipmentStatus.CREATED);

        assertThat(provider.createShipment(shipment).trackingNumber())
                .isNotEqualTo(provider.createShipment(shipment).trackingNumber());
    }

    @Test
    @DisplayName("createShipment - No items: Should throw FulfillmentProviderException")
    void createShipment_NoItems() {
        // Arrange
        Shipment shipment = TestDataBuilder.shipment("o1", ShipmentStatus.CREATED);
        shipment.setItems(new ArrayList<>());

        // Act & Assert
        assertThatThrownBy(() -> provider.createShipment(shipment))
                .isInstanceOf(FulfillmentProviderException.class)
                .hasMessageContaining("no items");
    }
}

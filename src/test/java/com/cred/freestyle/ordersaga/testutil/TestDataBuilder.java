package com.cred.freestyle.ordersaga.testutil;

import com.cred.freestyle.ordersaga.domain.event.DomainEvent;
import com.cred.freestyle.ordersaga.domain.event.EventTypes;
import com.cred.freestyle.ordersaga.domain.model.Reservation;
import com.cred.freestyle.ordersaga.domain.model.Reservation.ReservationStatus;
import com.cred.freestyle.ordersaga.domain.model.ReservedItem;
import com.cred.freestyle.ordersaga.domain.model.Shipment;
import com.cred.freestyle.ordersaga.domain.model.Shipment.ShipmentStatus;
import com.cred.freestyle.ordersaga.domain.model.ShipmentItem;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Factory methods for test data with sensible defaults.
 */
public final class TestDataBuilder {

    private TestDataBuilder() {
    }

    /**
     * ObjectMapper configured like Spring Boot's auto-configured one.
     */
    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ========================================
    // Aggregates
    // ========================================

    public static Reservation activeReservation(String orderId) {
        Instant now = Instant.now();
        return Reservation.builder()
                .reservationId(UUID.randomUUID().toString())
                .orderId(orderId)
                .userId("user-1")
                .items(new ArrayList<>(List.of(new ReservedItem("SKU-1", 2, new BigDecimal("9.99")))))
                .status(ReservationStatus.ACTIVE)
                .createdAt(now)
                .expiresAt(now.plus(30, ChronoUnit.MINUTES))
                .activeOrderKey(orderId)
                .build();
    }

    public static Reservation expiredReservation(String orderId) {
        Reservation reservation = activeReservation(orderId);
        reservation.setCreatedAt(Instant.now().minus(45, ChronoUnit.MINUTES));
        reservation.setExpiresAt(Instant.now().minus(15, ChronoUnit.MINUTES));
        return reservation;
    }

    public static Shipment shipment(String orderId, ShipmentStatus status) {
        return Shipment.builder()
                .shipmentId(UUID.randomUUID().toString())
                .orderId(orderId)
                .userId("user-1")
                .items(new ArrayList<>(List.of(new ShipmentItem("SKU-1", 2, 1000))))
                .shippingAddress(address())
                .status(status)
                .createdAt(Instant.now())
                .openOrderKey(status == ShipmentStatus.CANCELED ? null : orderId)
                .build();
    }

    public static Map<String, Object> address() {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("line1", "1 Main St");
        address.put("city", "Springfield");
        address.put("postal_code", "12345");
        address.put("country", "US");
        return address;
    }

    // ========================================
    // Upstream events
    // ========================================

    public static Map<String, Object> item(String skuId, int quantity) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("sku_id", skuId);
        item.put("quantity", quantity);
        return item;
    }

    public static DomainEvent orderCreated(String orderId, List<Map<String, Object>> items) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", orderId);
        data.put("user_id", "user-1");
        data.put("items", items);
        return DomainEvent.of(EventTypes.ORDER_CREATED, EventTypes.ORDER_SERVICE, data);
    }

    public static DomainEvent paymentCompleted(String orderId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", orderId);
        data.put("user_id", "user-1");
        data.put("payment_id", "pay-" + orderId);
        return DomainEvent.of(EventTypes.PAYMENT_COMPLETED, EventTypes.PAYMENT_SERVICE, data);
    }

    public static DomainEvent orderCanceled(String orderId, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", orderId);
        data.put("user_id", "user-1");
        if (reason != null) {
            data.put("cancellation_reason", reason);
        }
        return DomainEvent.of(EventTypes.ORDER_CANCELED, EventTypes.ORDER_SERVICE, data);
    }

    public static DomainEvent taxCalculated(String orderId, List<Map<String, Object>> metadataItems) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (metadataItems != null) {
            metadata.put("items", metadataItems);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", orderId);
        data.put("user_id", "user-1");
        data.put("tax_amount", "1.50");
        data.put("shipping_address", address());
        data.put("metadata", metadata);
        return DomainEvent.of(EventTypes.TAX_CALCULATED, EventTypes.TAX_SERVICE, data);
    }
}

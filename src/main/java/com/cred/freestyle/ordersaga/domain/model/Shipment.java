package com.cred.freestyle.ordersaga.domain.model;

import com.cred.freestyle.ordersaga.domain.model.converter.JsonMapConverter;
import com.cred.freestyle.ordersaga.domain.model.converter.ShipmentItemListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Shipment entity representing the physical delivery of an order.
 * Shipments move through:
 * - CREATED: Prepared after tax calculation, no label yet
 * - LABEL_PURCHASED: Carrier label bought after payment
 * - IN_TRANSIT / DELIVERED: Carrier progress (driven by carrier webhooks)
 * - CANCELED: Order canceled before delivery (terminal)
 *
 * At most one open (non-canceled) shipment exists per order, enforced by the
 * unique open_order_key column.
 *
 * @author Order Saga Team
 */
@Entity
@Table(name = "shipments", schema = "fulfillment", indexes = {
    @Index(name = "idx_shipment_order_created", columnList = "order_id, created_at"),
    @Index(name = "idx_shipment_open_order", columnList = "open_order_key", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Shipment {

    @Id
    @Column(name = "shipment_id", nullable = false, length = 36)
    private String shipmentId;

    @Column(name = "order_id", nullable = false, length = 100)
    private String orderId;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Convert(converter = ShipmentItemListConverter.class)
    @Column(name = "items", nullable = false, columnDefinition = "text")
    @Builder.Default
    private List<ShipmentItem> items = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "shipping_address", columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> shippingAddress = new LinkedHashMap<>();

    @Column(name = "carrier", length = 50)
    private String carrier;

    @Column(name = "tracking_number", length = 100)
    private String trackingNumber;

    @Column(name = "label_url", length = 1024)
    private String labelUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ShipmentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "label_created_at")
    private Instant labelCreatedAt;

    @Column(name = "shipped_at")
    private Instant shippedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "cancellation_reason", length = 255)
    private String cancellationReason;

    /**
     * Order id while the shipment is open, null once canceled.
     */
    @Column(name = "open_order_key", length = 100, unique = true)
    private String openOrderKey;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @PrePersist
    protected void onCreate() {
        if (shipmentId == null) {
            shipmentId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = ShipmentStatus.CREATED;
        }
        if (status != ShipmentStatus.CANCELED) {
            openOrderKey = orderId;
        }
    }

    /**
     * Sum of line weights.
     *
     * @throws ArithmeticException if the total does not fit in an int
     */
    public int getEstimatedWeightGrams() {
        int total = 0;
        for (ShipmentItem item : items) {
            total = Math.addExact(total, item.getWeightGrams());
        }
        return total;
    }

    /**
     * Shipment status enum with its allowed transitions.
     */
    public enum ShipmentStatus {
        CREATED,
        LABEL_PURCHASED,
        IN_TRANSIT,
        DELIVERED,
        CANCELED;

        public Set<ShipmentStatus> allowedTransitions() {
            switch (this) {
                case CREATED:
                    return EnumSet.of(LABEL_PURCHASED, CANCELED);
                case LABEL_PURCHASED:
                    return EnumSet.of(IN_TRANSIT, CANCELED);
                case IN_TRANSIT:
                    return EnumSet.of(DELIVERED);
                default:
                    return EnumSet.noneOf(ShipmentStatus.class);
            }
        }

        public boolean canTransitionTo(ShipmentStatus target) {
            return allowedTransitions().contains(target);
        }
    }
}

package com.cred.freestyle.ordersaga.domain.model;

import com.cred.freestyle.ordersaga.domain.model.converter.JsonMapConverter;
import com.cred.freestyle.ordersaga.domain.model.converter.ReservedItemListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reservation entity representing a time-bounded hold on inventory for one order.
 * Reservations can be:
 * - ACTIVE: Hold placed when the order was created
 * - COMMITTED: Payment completed, stock is sold (terminal)
 * - RELEASED: Order canceled or hold expired, stock returned (terminal)
 *
 * At most one ACTIVE reservation exists per order. This is enforced by the
 * unique active_order_key column, which carries the order id while the
 * reservation is ACTIVE and is cleared by every transition out of ACTIVE.
 *
 * @author Order Saga Team
 */
@Entity
@Table(name = "reservations", schema = "inventory", indexes = {
    @Index(name = "idx_reservation_order_status", columnList = "order_id, status"),
    @Index(name = "idx_reservation_status_expires", columnList = "status, expires_at"),
    @Index(name = "idx_reservation_active_order", columnList = "active_order_key", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    @Id
    @Column(name = "reservation_id", nullable = false, length = 36)
    private String reservationId;

    @Column(name = "order_id", nullable = false, length = 100)
    private String orderId;

    @Column(name = "user_id", length = 100)
    private String userId;

    /**
     * Snapshot of the reserved lines, taken from the order.created payload.
     */
    @Convert(converter = ReservedItemListConverter.class)
    @Column(name = "items", nullable = false, columnDefinition = "text")
    @Builder.Default
    private List<ReservedItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    /**
     * End of the hold (created_at + reservation TTL).
     * ACTIVE reservations past this instant are released by the expiry sweeper.
     */
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * When payment completed. Null until COMMITTED.
     */
    @Column(name = "committed_at")
    private Instant committedAt;

    /**
     * When the hold was released. Null until RELEASED.
     */
    @Column(name = "released_at")
    private Instant releasedAt;

    @Column(name = "release_reason", length = 255)
    private String releaseReason;

    /**
     * Order id while ACTIVE, null otherwise.
     */
    @Column(name = "active_order_key", length = 100, unique = true)
    private String activeOrderKey;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @PrePersist
    protected void onCreate() {
        if (reservationId == null) {
            reservationId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }

        // Default status to ACTIVE
        if (status == null) {
            status = ReservationStatus.ACTIVE;
        }

        if (status == ReservationStatus.ACTIVE) {
            activeOrderKey = orderId;
        }
    }

    /**
     * Total number of units held across all lines.
     */
    public long getTotalQuantity() {
        return items.stream().mapToLong(ReservedItem::getQuantity).sum();
    }

    /**
     * Reservation status enum.
     */
    public enum ReservationStatus {
        /**
         * Stock is held for the order.
         */
        ACTIVE,

        /**
         * Payment completed, stock sold.
         */
        COMMITTED,

        /**
         * Hold released (order canceled or expired).
         */
        RELEASED
    }
}

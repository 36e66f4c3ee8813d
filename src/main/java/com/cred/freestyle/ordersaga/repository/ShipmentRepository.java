package com.cred.freestyle.ordersaga.repository;

import com.cred.freestyle.ordersaga.domain.model.Shipment;
import com.cred.freestyle.ordersaga.domain.model.Shipment.ShipmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Shipment entity.
 * Transitions are conditional updates guarded by the expected current status.
 *
 * @author Order Saga Team
 */
@Repository
public interface ShipmentRepository extends JpaRepository<Shipment, String> {

    /**
     * Latest shipment created for an order, whatever its status.
     *
     * @param orderId Order ID
     * @return Optional containing the shipment if found
     */
    Optional<Shipment> findFirstByOrderIdOrderByCreatedAtDesc(String orderId);

    List<Shipment> findByOrderIdOrderByCreatedAtAsc(String orderId);

    /**
     * Conditional transition CREATED to LABEL_PURCHASED.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Shipment s SET s.status = :target, s.carrier = :carrier, s.trackingNumber = :trackingNumber, " +
           "s.labelUrl = :labelUrl, s.labelCreatedAt = :now " +
           "WHERE s.shipmentId = :shipmentId AND s.status = :expected")
    int updateToLabelPurchased(
            @Param("shipmentId") String shipmentId,
            @Param("carrier") String carrier,
            @Param("trackingNumber") String trackingNumber,
            @Param("labelUrl") String labelUrl,
            @Param("now") Instant now,
            @Param("expected") ShipmentStatus expected,
            @Param("target") ShipmentStatus target
    );

    /**
     * Conditional transition from the given status to CANCELED.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Shipment s SET s.status = :target, s.cancellationReason = :reason, s.canceledAt = :now, " +
           "s.openOrderKey = NULL " +
           "WHERE s.shipmentId = :shipmentId AND s.status = :expected")
    int updateToCanceled(
            @Param("shipmentId") String shipmentId,
            @Param("reason") String reason,
            @Param("now") Instant now,
            @Param("expected") ShipmentStatus expected,
            @Param("target") ShipmentStatus target
    );

    default Optional<Shipment> findByOrderId(String orderId) {
        return findFirstByOrderIdOrderByCreatedAtDesc(orderId);
    }

    /**
     * Record the purchased label on a CREATED shipment.
     *
     * @return 1 if this call won the transition, 0 otherwise
     */
    default int purchaseLabel(String shipmentId, String carrier, String trackingNumber, String labelUrl, Instant now) {
        return updateToLabelPurchased(shipmentId, carrier, trackingNumber, labelUrl, now,
                ShipmentStatus.CREATED, ShipmentStatus.LABEL_PURCHASED);
    }

    /**
     * Cancel a shipment that is still in the expected status.
     *
     * @return 1 if this call won the transition, 0 otherwise
     */
    default int cancel(String shipmentId, ShipmentStatus expectedStatus, String reason, Instant now) {
        return updateToCanceled(shipmentId, reason, now, expectedStatus, ShipmentStatus.CANCELED);
    }
}

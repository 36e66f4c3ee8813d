package com.cred.freestyle.ordersaga.repository;

import com.cred.freestyle.ordersaga.domain.model.Reservation;
import com.cred.freestyle.ordersaga.domain.model.Reservation.ReservationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Reservation entity.
 * Every status change goes through a conditional update that only matches
 * ACTIVE rows, so concurrent handlers racing on the same reservation see
 * exactly one winner; the loser's update affects zero rows.
 *
 * @author Order Saga Team
 */
@Repository
public interface ReservationRepository extends JpaRepository<Reservation, String> {

    /**
     * Find the reservation currently holding stock for an order.
     *
     * @param orderId Order ID
     * @param status Reservation status
     * @return Optional containing the reservation if found
     */
    Optional<Reservation> findFirstByOrderIdAndStatusOrderByCreatedAtDesc(String orderId, ReservationStatus status);

    /**
     * Find the most recent reservation for an order in any of the given states.
     *
     * @param orderId Order ID
     * @param statuses Accepted statuses
     * @return Optional containing the reservation if found
     */
    Optional<Reservation> findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(
            String orderId,
            Collection<ReservationStatus> statuses
    );

    List<Reservation> findByOrderIdOrderByCreatedAtAsc(String orderId);

    /**
     * Find ACTIVE reservations whose hold has elapsed.
     * Used by the expiry sweeper.
     *
     * @param now Current timestamp
     * @param pageable Batch limit
     * @return List of expired reservations
     */
    @Query("SELECT r FROM Reservation r WHERE r.status = :status AND r.expiresAt < :now ORDER BY r.expiresAt ASC")
    List<Reservation> findExpiredReservations(
            @Param("status") ReservationStatus status,
            @Param("now") Instant now,
            Pageable pageable
    );

    /**
     * Conditional transition ACTIVE to COMMITTED.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Reservation r SET r.status = :target, r.committedAt = :now, r.activeOrderKey = NULL " +
           "WHERE r.reservationId = :reservationId AND r.status = :expected")
    int updateToCommitted(
            @Param("reservationId") String reservationId,
            @Param("now") Instant now,
            @Param("expected") ReservationStatus expected,
            @Param("target") ReservationStatus target
    );

    /**
     * Conditional transition ACTIVE to RELEASED.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Reservation r SET r.status = :target, r.releasedAt = :now, r.releaseReason = :reason, " +
           "r.activeOrderKey = NULL " +
           "WHERE r.reservationId = :reservationId AND r.status = :expected")
    int updateToReleased(
            @Param("reservationId") String reservationId,
            @Param("now") Instant now,
            @Param("reason") String reason,
            @Param("expected") ReservationStatus expected,
            @Param("target") ReservationStatus target
    );

    default Optional<Reservation> findActiveByOrderId(String orderId) {
        return findFirstByOrderIdAndStatusOrderByCreatedAtDesc(orderId, ReservationStatus.ACTIVE);
    }

    default Optional<Reservation> findActiveOrCommittedByOrderId(String orderId) {
        return findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(
                orderId, List.of(ReservationStatus.ACTIVE, ReservationStatus.COMMITTED));
    }

    /**
     * Commit an ACTIVE reservation.
     *
     * @param reservationId Reservation ID
     * @param now Commit timestamp
     * @return 1 if this call won the transition, 0 if the reservation had already left ACTIVE
     */
    default int commit(String reservationId, Instant now) {
        return updateToCommitted(reservationId, now, ReservationStatus.ACTIVE, ReservationStatus.COMMITTED);
    }

    /**
     * Release an ACTIVE reservation.
     *
     * @param reservationId Reservation ID
     * @param now Release timestamp
     * @param reason Release reason (cancellation reason or reservation_expired)
     * @return 1 if this call won the transition, 0 if the reservation had already left ACTIVE
     */
    default int release(String reservationId, Instant now, String reason) {
        return updateToReleased(reservationId, now, reason, ReservationStatus.ACTIVE, ReservationStatus.RELEASED);
    }
}

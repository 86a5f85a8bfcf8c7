package com.nosota.traitmarket.repository;

import com.nosota.traitmarket.api.model.PurchaseStatus;
import com.nosota.traitmarket.api.model.ReservationStatus;
import com.nosota.traitmarket.model.Purchase;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseRepository extends JpaRepository<Purchase, UUID> {

    Optional<Purchase> findByTxSignature(String txSignature);

    Optional<Purchase> findFirstByReservationIdOrderByCreatedAtDesc(UUID reservationId);

    /**
     * Loads the purchase with a row lock so that concurrent confirmations of the same
     * signature are applied one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Purchase p WHERE p.id = :id")
    Optional<Purchase> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Finds purchases stuck in one of the given statuses since before {@code olderThan}.
     */
    @Query("""
    SELECT p FROM Purchase p
    WHERE p.status IN :statuses
      AND p.createdAt < :olderThan
    ORDER BY p.createdAt ASC
    """)
    List<Purchase> findPending(@Param("statuses") Collection<PurchaseStatus> statuses,
                               @Param("olderThan") LocalDateTime olderThan);

    /**
     * Counts broadcast purchases of a trait that are not final and whose reservation no longer
     * holds a unit (expired, cancelled or consumed). Their transaction may still land, so they
     * keep occupying supply until fulfilled or failed.
     */
    @Query("""
    SELECT COUNT(p) FROM Purchase p
    WHERE p.traitId = :traitId
      AND p.status IN :statuses
      AND p.txSignature IS NOT NULL
      AND NOT EXISTS (
          SELECT r.id FROM Reservation r
          WHERE r.id = p.reservationId
            AND r.status = :held
            AND r.expiresAt > :now)
    """)
    long countInFlightWithoutHold(@Param("traitId") UUID traitId,
                                  @Param("statuses") Collection<PurchaseStatus> statuses,
                                  @Param("held") ReservationStatus held,
                                  @Param("now") LocalDateTime now);
}

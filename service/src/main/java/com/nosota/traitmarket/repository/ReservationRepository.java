package com.nosota.traitmarket.repository;

import com.nosota.traitmarket.api.model.ReservationStatus;
import com.nosota.traitmarket.model.Reservation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reservation storage. Every status change is a single conditional UPDATE whose WHERE clause
 * carries the guard, so concurrent callers race in the database and exactly one wins.
 */
@Repository
public interface ReservationRepository extends JpaRepository<Reservation, UUID> {

    /**
     * Loads the reservation with a row lock; purchase creation for one reservation serializes on it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
    SELECT r FROM Reservation r
    WHERE r.traitId = :traitId
      AND r.walletAddress = :walletAddress
      AND r.assetId = :assetId
      AND r.status = :status
      AND r.expiresAt > :now
    ORDER BY r.createdAt DESC
    """)
    List<Reservation> findActive(@Param("traitId") UUID traitId,
                                 @Param("walletAddress") String walletAddress,
                                 @Param("assetId") String assetId,
                                 @Param("status") ReservationStatus status,
                                 @Param("now") LocalDateTime now);

    @Query("""
    SELECT COUNT(r) FROM Reservation r
    WHERE r.traitId = :traitId
      AND r.status = :status
      AND r.expiresAt > :now
    """)
    long countActive(@Param("traitId") UUID traitId,
                     @Param("status") ReservationStatus status,
                     @Param("now") LocalDateTime now);

    /**
     * Moves a reservation from {@code from} to {@code to} only while it is unexpired.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
    UPDATE Reservation r
    SET r.status = :to
    WHERE r.id = :id
      AND r.status = :from
      AND r.expiresAt > :now
    """)
    int transitionIfUnexpired(@Param("id") UUID id,
                              @Param("from") ReservationStatus from,
                              @Param("to") ReservationStatus to,
                              @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("""
    UPDATE Reservation r
    SET r.status = :to
    WHERE r.id = :id
      AND r.status = :from
    """)
    int transition(@Param("id") UUID id,
                   @Param("from") ReservationStatus from,
                   @Param("to") ReservationStatus to);

    /**
     * Bulk-expires every hold whose TTL has passed.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
    UPDATE Reservation r
    SET r.status = :to
    WHERE r.status = :from
      AND r.expiresAt <= :now
    """)
    int expireAll(@Param("from") ReservationStatus from,
                  @Param("to") ReservationStatus to,
                  @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("""
    UPDATE Reservation r
    SET r.status = :to
    WHERE r.id IN :ids
      AND r.status = :from
    """)
    int transitionAll(@Param("ids") Collection<UUID> ids,
                      @Param("from") ReservationStatus from,
                      @Param("to") ReservationStatus to);
}

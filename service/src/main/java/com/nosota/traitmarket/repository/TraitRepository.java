package com.nosota.traitmarket.repository;

import com.nosota.traitmarket.model.Trait;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TraitRepository extends JpaRepository<Trait, UUID> {

    /**
     * Loads the trait with a row lock (SELECT ... FOR UPDATE).
     * Serializes capacity checks of concurrent reservations for the same trait
     * until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Trait t WHERE t.id = :id")
    Optional<Trait> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Decrements remaining supply of a capped trait by one.
     * Returns 0 for unlimited traits and for traits already at zero.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
    UPDATE Trait t
    SET t.remainingSupply = t.remainingSupply - 1
    WHERE t.id = :id
      AND t.totalSupply IS NOT NULL
      AND t.remainingSupply > 0
    """)
    int decrementRemainingSupply(@Param("id") UUID id);
}

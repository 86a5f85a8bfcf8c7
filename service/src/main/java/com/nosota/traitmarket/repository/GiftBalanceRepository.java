package com.nosota.traitmarket.repository;

import com.nosota.traitmarket.model.GiftBalance;
import com.nosota.traitmarket.model.GiftBalanceId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GiftBalanceRepository extends JpaRepository<GiftBalance, GiftBalanceId> {

    Optional<GiftBalance> findByWalletAddressAndTraitId(String walletAddress, UUID traitId);

    /**
     * Decrements the balance only if enough is left. Returns 0 on insufficient balance.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
    UPDATE GiftBalance g
    SET g.qtyAvailable = g.qtyAvailable - :amount,
        g.updatedAt = :now
    WHERE g.walletAddress = :walletAddress
      AND g.traitId = :traitId
      AND g.qtyAvailable >= :amount
    """)
    int decrement(@Param("walletAddress") String walletAddress,
                  @Param("traitId") UUID traitId,
                  @Param("amount") int amount,
                  @Param("now") LocalDateTime now);

    /**
     * Adds to the balance, creating the row on first grant.
     */
    @Modifying(clearAutomatically = true)
    @Query(value = """
    INSERT INTO gift_balance (wallet_address, trait_id, qty_available, updated_at)
    VALUES (:walletAddress, :traitId, :amount, :now)
    ON CONFLICT (wallet_address, trait_id)
    DO UPDATE SET qty_available = gift_balance.qty_available + EXCLUDED.qty_available,
                  updated_at = EXCLUDED.updated_at
    """, nativeQuery = true)
    int add(@Param("walletAddress") String walletAddress,
            @Param("traitId") UUID traitId,
            @Param("amount") int amount,
            @Param("now") LocalDateTime now);
}

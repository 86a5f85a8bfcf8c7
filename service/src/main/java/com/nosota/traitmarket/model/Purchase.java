package com.nosota.traitmarket.model;

import com.nosota.traitmarket.api.model.PurchaseStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Unit of settlement: one trait applied to one asset by one ledger transaction.
 *
 * <p>Status transitions are validated by {@code PurchaseStatusStateMachine}.
 */
@Entity
@Table(name = "purchase")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Purchase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "wallet_address", nullable = false, length = 44)
    private String walletAddress;

    @Column(name = "asset_id", nullable = false, length = 44)
    private String assetId;

    @Column(name = "trait_id", nullable = false)
    private UUID traitId;

    /**
     * Reservation holding the unit for this purchase.
     * Consumed on fulfillment, cancelled on failure.
     */
    @Column(name = "reservation_id", nullable = false)
    private UUID reservationId;

    /**
     * Amount charged in the token's smallest unit. Zero for gift redemptions.
     */
    @Column(name = "price_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger priceAmount;

    @Column(name = "token_id", nullable = false)
    private UUID tokenId;

    @Column(name = "treasury_wallet", nullable = false, length = 44)
    private String treasuryWallet;

    /**
     * True when a gift balance unit was redeemed instead of charging the buyer.
     */
    @Column(name = "gift_redemption", nullable = false)
    private boolean giftRedemption;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PurchaseStatus status;

    /**
     * Ledger signature of the settling transaction.
     * Unique across all purchases; null until broadcast.
     */
    @Column(name = "tx_signature", unique = true, length = 88)
    private String txSignature;

    /**
     * Last failure reason, kept for support and reconciliation.
     */
    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}

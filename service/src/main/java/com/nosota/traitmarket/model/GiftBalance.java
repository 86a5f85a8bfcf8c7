package com.nosota.traitmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Free-redemption allowance of a wallet for a trait.
 * qtyAvailable never drops below zero (enforced by a conditional update and a CHECK constraint).
 */
@Entity
@Table(name = "gift_balance")
@IdClass(GiftBalanceId.class)
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class GiftBalance {

    @Id
    @Column(name = "wallet_address", nullable = false, length = 44)
    private String walletAddress;

    @Id
    @Column(name = "trait_id", nullable = false)
    private UUID traitId;

    @Column(name = "qty_available", nullable = false)
    private Integer qtyAvailable;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}

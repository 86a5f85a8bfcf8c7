package com.nosota.traitmarket.model;

import com.nosota.traitmarket.api.model.ReservationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Time-bounded hold on one unit of a trait for a wallet/asset pair.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * RESERVED → CONSUMED   (purchase fulfilled)
 * RESERVED → CANCELLED  (released by buyer or failed purchase)
 * RESERVED → EXPIRED    (TTL passed, reclaimed by cleanup sweep)
 * </pre>
 * Status changes are conditional updates in {@code ReservationRepository}; the entity
 * itself is only inserted.
 */
@Entity
@Table(name = "reservation")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trait_id", nullable = false)
    private UUID traitId;

    @Column(name = "wallet_address", nullable = false, length = 44)
    private String walletAddress;

    @Column(name = "asset_id", nullable = false, length = 44)
    private String assetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReservationStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    /**
     * After this instant the hold no longer counts against supply, even before the sweep runs.
     */
    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public boolean isActiveAt(LocalDateTime now) {
        return status == ReservationStatus.RESERVED && expiresAt.isAfter(now);
    }
}

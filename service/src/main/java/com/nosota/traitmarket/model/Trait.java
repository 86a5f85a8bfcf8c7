package com.nosota.traitmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Catalog entry for a purchasable trait.
 *
 * <p>Supply accounting:
 * <ul>
 *   <li>totalSupply == null: unlimited, remainingSupply is ignored</li>
 *   <li>otherwise 0 &lt;= remainingSupply &lt;= totalSupply</li>
 *   <li>remainingSupply is decremented on fulfillment only, never on reservation</li>
 * </ul>
 */
@Entity
@Table(name = "trait")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Trait {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Layer the trait occupies on the asset (background, eyes, ...).
     */
    @Column(name = "slot", nullable = false, length = 64)
    private String slot;

    /**
     * Total number of units ever sellable. Null for unlimited traits.
     */
    @Column(name = "total_supply")
    private Integer totalSupply;

    /**
     * Units not yet fulfilled. Null for unlimited traits.
     */
    @Column(name = "remaining_supply")
    private Integer remainingSupply;

    /**
     * Price in the token's smallest unit.
     */
    @Column(name = "price_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger priceAmount;

    @Column(name = "token_id", nullable = false)
    private UUID tokenId;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public boolean isUnlimited() {
        return totalSupply == null;
    }
}

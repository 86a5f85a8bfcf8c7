package com.nosota.traitmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Currency a trait is priced in.
 */
@Entity
@Table(name = "payment_token")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PaymentToken {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Ticker shown to buyers (e.g. SOL).
     */
    @Column(name = "symbol", nullable = false, length = 16)
    private String symbol;

    /**
     * Mint address of a fungible token. Null means the ledger's native currency.
     */
    @Column(name = "mint_address", length = 44)
    private String mintAddress;

    /**
     * Decimal places of the smallest unit (9 for lamports).
     */
    @Column(name = "decimals", nullable = false)
    private Integer decimals;

    public boolean isNative() {
        return mintAddress == null;
    }
}

package com.nosota.traitmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Transaction bundle handed to the buyer for signing, kept until the signed copy comes back.
 * The payload is the delegate-signed bundle in its wire encoding.
 */
@Entity
@Table(name = "transaction_bundle")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class UnsignedBundle {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "purchase_id", nullable = false, unique = true)
    private UUID purchaseId;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}

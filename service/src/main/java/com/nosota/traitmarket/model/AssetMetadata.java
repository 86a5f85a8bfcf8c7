package com.nosota.traitmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Metadata document published for an asset wearing a trait, served at the URI the
 * metadata-update instruction points the asset at. Content is the JSON document.
 */
@Entity
@Table(name = "asset_metadata",
        uniqueConstraints = @UniqueConstraint(name = "asset_metadata_asset_trait_unique", columnNames = {"asset_id", "trait_id"}))
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AssetMetadata {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "asset_id", nullable = false, length = 44)
    private String assetId;

    @Column(name = "trait_id", nullable = false)
    private UUID traitId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}

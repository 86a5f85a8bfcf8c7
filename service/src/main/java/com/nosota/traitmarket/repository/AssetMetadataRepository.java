package com.nosota.traitmarket.repository;

import com.nosota.traitmarket.model.AssetMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssetMetadataRepository extends JpaRepository<AssetMetadata, UUID> {

    Optional<AssetMetadata> findByAssetIdAndTraitId(String assetId, UUID traitId);

    /**
     * Stores the document for an asset/trait pair, replacing the previous one.
     */
    @Modifying(clearAutomatically = true)
    @Query(value = """
    INSERT INTO asset_metadata (id, asset_id, trait_id, content, created_at, updated_at)
    VALUES (:id, :assetId, :traitId, :content, :now, :now)
    ON CONFLICT (asset_id, trait_id)
    DO UPDATE SET content = EXCLUDED.content,
                  updated_at = EXCLUDED.updated_at
    """, nativeQuery = true)
    int upsert(@Param("id") UUID id,
               @Param("assetId") String assetId,
               @Param("traitId") UUID traitId,
               @Param("content") String content,
               @Param("now") LocalDateTime now);
}

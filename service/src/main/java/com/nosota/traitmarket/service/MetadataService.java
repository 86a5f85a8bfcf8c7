package com.nosota.traitmarket.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.traitmarket.api.response.AssetMetadataResponse;
import com.nosota.traitmarket.collaborator.AssetIndex;
import com.nosota.traitmarket.dto.AssetRecord;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.error.TransactionBuildException;
import com.nosota.traitmarket.model.AssetMetadata;
import com.nosota.traitmarket.model.Trait;
import com.nosota.traitmarket.repository.AssetMetadataRepository;
import com.nosota.traitmarket.repository.TraitRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Metadata documents for assets wearing a purchased trait.
 *
 * <p>The document keeps the asset's current name, description and links and carries its current
 * attributes with the trait applied: the attribute of the trait's slot is replaced, or appended
 * when the asset has none for that slot. It is published before the transaction is handed to the
 * buyer, so the URI in the metadata-update instruction resolves once the transaction lands.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class MetadataService {

    static final String CATEGORY = "image";

    private final AssetIndex assetIndex;
    private final AssetMetadataRepository assetMetadataRepository;
    private final TraitRepository traitRepository;
    private final ObjectMapper objectMapper;

    /**
     * Current state of an asset; {@link NotFoundException} when the index does not know it.
     */
    public Mono<AssetRecord> currentAsset(@NotNull String assetId) {
        return assetIndex.getAsset(assetId)
                .switchIfEmpty(Mono.error(() -> new NotFoundException("Asset", assetId)));
    }

    public AssetMetadataResponse buildMetadata(@NotNull AssetRecord asset, @NotNull Trait trait) {
        List<AssetMetadataResponse.Attribute> attributes = new ArrayList<>();
        boolean replaced = false;
        for (AssetMetadataResponse.Attribute attribute : asset.attributes()) {
            if (attribute.traitType().equalsIgnoreCase(trait.getSlot())) {
                if (!replaced) {
                    attributes.add(new AssetMetadataResponse.Attribute(trait.getSlot(), trait.getName()));
                    replaced = true;
                }
            } else {
                attributes.add(attribute);
            }
        }
        if (!replaced) {
            attributes.add(new AssetMetadataResponse.Attribute(trait.getSlot(), trait.getName()));
        }

        return new AssetMetadataResponse(
                asset.name(),
                asset.description(),
                asset.image(),
                asset.externalUrl(),
                attributes,
                new AssetMetadataResponse.Properties(List.of(), CATEGORY));
    }

    /**
     * Builds and stores the document for the asset with the trait applied, replacing an earlier one.
     */
    @Transactional
    public AssetMetadataResponse publish(@NotNull AssetRecord asset, @NotNull UUID traitId) {
        Trait trait = traitRepository.findById(traitId)
                .orElseThrow(() -> new NotFoundException("Trait", traitId));
        AssetMetadataResponse document = buildMetadata(asset, trait);

        String content;
        try {
            content = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new TransactionBuildException("Failed to serialize metadata for asset " + asset.id(), e);
        }
        assetMetadataRepository.upsert(UUID.randomUUID(), asset.id(), traitId, content, LocalDateTime.now());

        log.info("Metadata published: asset={}, trait={}, slot={}, attributes={}",
                asset.id(), traitId, trait.getSlot(), document.attributes().size());
        return document;
    }

    public AssetMetadataResponse getMetadata(@NotNull String assetId, @NotNull UUID traitId) {
        AssetMetadata stored = assetMetadataRepository.findByAssetIdAndTraitId(assetId, traitId)
                .orElseThrow(() -> new NotFoundException("Metadata", assetId + "/" + traitId));
        try {
            return objectMapper.readValue(stored.getContent(), AssetMetadataResponse.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored metadata for " + assetId + "/" + traitId + " is unreadable", e);
        }
    }
}

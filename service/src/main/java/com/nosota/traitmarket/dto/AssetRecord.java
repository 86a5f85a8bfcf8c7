package com.nosota.traitmarket.dto;

import com.nosota.traitmarket.api.response.AssetMetadataResponse;

import java.util.List;

/**
 * Asset as reported by the asset index.
 *
 * @param id           Asset address
 * @param owner        Current owner wallet
 * @param name         Name from the current metadata
 * @param description  Description from the current metadata
 * @param image        Image link
 * @param externalUrl  External link
 * @param jsonUri      URI of the metadata document the asset points at
 * @param attributes   Current trait attributes
 */
public record AssetRecord(
        String id,
        String owner,
        String name,
        String description,
        String image,
        String externalUrl,
        String jsonUri,
        List<AssetMetadataResponse.Attribute> attributes
) {
}

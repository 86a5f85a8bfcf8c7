package com.nosota.traitmarket.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Off-chain metadata document an asset points at after a trait is applied.
 * Field names follow the token metadata JSON standard.
 *
 * @param name         Asset name
 * @param description  Asset description
 * @param image        Image URI
 * @param externalUrl  Project or asset page
 * @param attributes   Trait attributes, one per slot
 * @param properties   File list and category
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetMetadataResponse(
        String name,
        String description,
        String image,
        @JsonProperty("external_url") String externalUrl,
        List<Attribute> attributes,
        Properties properties
) {

    public record Attribute(
            @JsonProperty("trait_type") String traitType,
            String value
    ) {
    }

    public record Properties(
            List<File> files,
            String category
    ) {
    }

    public record File(
            String uri,
            String type
    ) {
    }
}

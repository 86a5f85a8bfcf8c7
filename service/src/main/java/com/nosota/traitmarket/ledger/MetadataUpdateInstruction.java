package com.nosota.traitmarket.ledger;

import java.util.List;

/**
 * Points an asset at a new metadata document.
 *
 * @param assetId          Asset being updated
 * @param newUri           Location of the metadata reflecting the applied trait
 * @param updateAuthority  Delegate key allowed to update the asset
 */
public record MetadataUpdateInstruction(
        String assetId,
        String newUri,
        String updateAuthority
) implements LedgerInstruction {

    public static final String ASSET_PROGRAM_ID = "CoREENxT6tW1HoK8ypY1SxRMZTcVPm7R94rH4PZNhX7d";

    @Override
    public InstructionType type() {
        return InstructionType.METADATA_UPDATE;
    }

    @Override
    public String programId() {
        return ASSET_PROGRAM_ID;
    }

    @Override
    public List<String> signers() {
        return List.of(updateAuthority);
    }
}

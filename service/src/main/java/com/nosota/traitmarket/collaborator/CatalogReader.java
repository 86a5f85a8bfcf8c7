package com.nosota.traitmarket.collaborator;

import com.nosota.traitmarket.dto.TraitListing;

import java.util.UUID;

/**
 * Read-only view of the trait catalog.
 */
public interface CatalogReader {

    /**
     * @throws com.nosota.traitmarket.error.NotFoundException if the trait does not exist
     */
    TraitListing getTrait(UUID traitId);
}

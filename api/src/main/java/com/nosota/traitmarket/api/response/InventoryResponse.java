package com.nosota.traitmarket.api.response;

import java.util.UUID;

/**
 * Availability snapshot of a trait.
 *
 * @param traitId             Trait UUID
 * @param totalSupply         Total supply, null for unlimited traits
 * @param remainingSupply     Units not yet fulfilled, null for unlimited traits
 * @param activeReservations  Unexpired RESERVED holds
 * @param inFlightPurchases   Broadcast purchases awaiting settlement whose hold has lapsed
 * @param available           Units that can still be reserved, null for unlimited traits
 * @param unlimited           True when the trait has no supply cap
 */
public record InventoryResponse(
        UUID traitId,
        Integer totalSupply,
        Integer remainingSupply,
        long activeReservations,
        long inFlightPurchases,
        Long available,
        boolean unlimited
) {
}

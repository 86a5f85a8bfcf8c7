package com.nosota.traitmarket.ledger;

/**
 * @param address   Account address
 * @param exists    False when the ledger has no account at this address
 * @param lamports  Native balance
 * @param owner     Program owning the account
 */
public record AccountState(
        String address,
        boolean exists,
        long lamports,
        String owner
) {

    public static AccountState missing(String address) {
        return new AccountState(address, false, 0L, null);
    }
}

package com.nosota.traitmarket.ledger;

import java.math.BigInteger;
import java.util.List;

/**
 * Transfer of a fungible token between the token accounts of two wallets.
 *
 * @param mint                Token mint address
 * @param sourceAccount       Buyer's token account for the mint
 * @param destinationAccount  Treasury's token account for the mint
 * @param owner               Buyer wallet owning the source account
 * @param amount              Amount in the token's smallest unit
 */
public record TokenTransferInstruction(
        String mint,
        String sourceAccount,
        String destinationAccount,
        String owner,
        BigInteger amount
) implements LedgerInstruction {

    public static final String TOKEN_PROGRAM_ID = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";

    @Override
    public InstructionType type() {
        return InstructionType.TOKEN_TRANSFER;
    }

    @Override
    public String programId() {
        return TOKEN_PROGRAM_ID;
    }

    @Override
    public List<String> signers() {
        return List.of(owner);
    }
}

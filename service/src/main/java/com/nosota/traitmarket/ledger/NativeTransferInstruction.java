package com.nosota.traitmarket.ledger;

import java.math.BigInteger;
import java.util.List;

/**
 * Transfer of native currency (lamports) between two accounts.
 *
 * @param from      Paying wallet
 * @param to        Receiving wallet
 * @param lamports  Amount in the smallest native unit
 */
public record NativeTransferInstruction(
        String from,
        String to,
        BigInteger lamports
) implements LedgerInstruction {

    public static final String SYSTEM_PROGRAM_ID = "11111111111111111111111111111111";

    @Override
    public InstructionType type() {
        return InstructionType.NATIVE_TRANSFER;
    }

    @Override
    public String programId() {
        return SYSTEM_PROGRAM_ID;
    }

    @Override
    public List<String> signers() {
        return List.of(from);
    }
}

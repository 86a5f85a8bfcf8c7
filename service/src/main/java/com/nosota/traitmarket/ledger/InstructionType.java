package com.nosota.traitmarket.ledger;

/**
 * Discriminant of {@link LedgerInstruction}. Each type belongs to exactly one category.
 */
public enum InstructionType {
    NATIVE_TRANSFER(InstructionCategory.PAYMENT),
    TOKEN_TRANSFER(InstructionCategory.PAYMENT),
    METADATA_UPDATE(InstructionCategory.METADATA_UPDATE);

    private final InstructionCategory category;

    InstructionType(InstructionCategory category) {
        this.category = category;
    }

    public InstructionCategory category() {
        return category;
    }
}

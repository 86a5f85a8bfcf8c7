package com.nosota.traitmarket.ledger;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * One instruction of a ledger transaction.
 *
 * <p>The set of implementations is closed; {@link #type()} is the explicit discriminant and is
 * also written as the {@code type} property of the wire encoding.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NativeTransferInstruction.class, name = "NATIVE_TRANSFER"),
        @JsonSubTypes.Type(value = TokenTransferInstruction.class, name = "TOKEN_TRANSFER"),
        @JsonSubTypes.Type(value = MetadataUpdateInstruction.class, name = "METADATA_UPDATE")
})
public interface LedgerInstruction {

    InstructionType type();

    /**
     * On-ledger program that executes the instruction.
     */
    String programId();

    /**
     * Accounts whose signatures authorize the instruction.
     */
    List<String> signers();
}

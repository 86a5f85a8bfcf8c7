package com.nosota.traitmarket.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ledger transaction coupling the payment leg and the metadata-update leg.
 * The ledger commits or rejects all instructions together.
 *
 * @param id                  Bundle UUID (also the handle returned to the buyer)
 * @param feePayer            Wallet paying fees; its signature becomes the transaction signature
 * @param recentBlockhash     Blockhash the transaction is anchored to
 * @param instructions        Instructions in execution order
 * @param requiredSignatures  Signers the buyer's wallet has to provide
 * @param delegateSignatures  Signers the server applies at build time
 * @param signatures          Applied signatures, signer address → base58 signature
 */
public record TransactionBundle(
        UUID id,
        String feePayer,
        String recentBlockhash,
        List<LedgerInstruction> instructions,
        List<String> requiredSignatures,
        List<String> delegateSignatures,
        Map<String, String> signatures
) {

    public TransactionBundle {
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        requiredSignatures = requiredSignatures == null ? List.of() : List.copyOf(requiredSignatures);
        delegateSignatures = delegateSignatures == null ? List.of() : List.copyOf(delegateSignatures);
        signatures = signatures == null ? Map.of() : Map.copyOf(signatures);
    }

    /**
     * Returns a copy with one more signature applied.
     */
    public TransactionBundle withSignature(String signer, String signature) {
        Map<String, String> applied = new LinkedHashMap<>(signatures);
        applied.put(signer, signature);
        return new TransactionBundle(id, feePayer, recentBlockhash, instructions,
                requiredSignatures, delegateSignatures, applied);
    }

    @JsonIgnore
    public boolean isFullySigned() {
        return requiredSignatures.stream().allMatch(signatures::containsKey)
                && delegateSignatures.stream().allMatch(signatures::containsKey);
    }

    public boolean contains(InstructionCategory category) {
        return instructions.stream().anyMatch(ix -> ix.type().category() == category);
    }
}

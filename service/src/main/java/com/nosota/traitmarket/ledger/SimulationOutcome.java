package com.nosota.traitmarket.ledger;

import java.util.List;

/**
 * Raw dry-run answer of the ledger.
 *
 * @param success                 No error reported
 * @param error                   Ledger error text
 * @param failedInstructionIndex  Index of the instruction that failed, null when unknown
 * @param logs                    Program log lines
 * @param unitsConsumed           Compute units used
 */
public record SimulationOutcome(
        boolean success,
        String error,
        Integer failedInstructionIndex,
        List<String> logs,
        Long unitsConsumed
) {
}

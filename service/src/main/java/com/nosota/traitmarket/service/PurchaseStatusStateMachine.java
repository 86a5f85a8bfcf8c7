package com.nosota.traitmarket.service;

import com.nosota.traitmarket.api.model.PurchaseStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for validating PurchaseStatus transitions.
 *
 * <p>Status only advances forward; FAILED is reachable from every non-terminal status:
 * <pre>
 * CREATED → TX_BUILT → CONFIRMED → FULFILLED
 *    |          |          |
 *    +----------+----------+→ FAILED
 * </pre>
 * FULFILLED and FAILED are final states.
 */
@Component
public class PurchaseStatusStateMachine {

    /**
     * Map of allowed transitions: fromStatus → Set of valid toStatus values.
     */
    private static final Map<PurchaseStatus, Set<PurchaseStatus>> ALLOWED_TRANSITIONS = Map.of(
            PurchaseStatus.CREATED, EnumSet.of(PurchaseStatus.TX_BUILT, PurchaseStatus.FAILED),
            PurchaseStatus.TX_BUILT, EnumSet.of(PurchaseStatus.CONFIRMED, PurchaseStatus.FAILED),
            PurchaseStatus.CONFIRMED, EnumSet.of(PurchaseStatus.FULFILLED, PurchaseStatus.FAILED)
            // FULFILLED and FAILED are final states - no transitions allowed
    );

    /**
     * Validates if a status transition is allowed.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(PurchaseStatus fromStatus, PurchaseStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        Set<PurchaseStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Validates if a status transition is allowed, throwing exception if not.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @throws IllegalStateException if transition is not allowed
     */
    public void validateTransition(PurchaseStatus fromStatus, PurchaseStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid purchase status transition: %s → %s. " +
                                    "Allowed transitions from %s: %s",
                            fromStatus, toStatus, fromStatus,
                            ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()))
            );
        }
    }

    /**
     * Checks if a status is a final state (no further transitions allowed).
     *
     * @param status Status to check
     * @return true for FULFILLED and FAILED
     */
    public boolean isFinalState(PurchaseStatus status) {
        return status == PurchaseStatus.FULFILLED || status == PurchaseStatus.FAILED;
    }

    public Set<PurchaseStatus> getAllowedTransitions(PurchaseStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}

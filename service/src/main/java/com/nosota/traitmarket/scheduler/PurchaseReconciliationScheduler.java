package com.nosota.traitmarket.scheduler;

import com.nosota.traitmarket.service.PurchaseOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Resolves broadcast purchases whose confirmation was not observed in time.
 *
 * <p>Only purchases with an attached signature are resolved, and only from actual ledger
 * state; a purchase is never failed just because it is old.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   scheduler:
 *     purchase-reconciliation:
 *       enabled: true
 *       cron: "0 *&#47;5 * * * *"        # every 5 minutes
 *       older-than-minutes: 30
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "market.scheduler.purchase-reconciliation.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PurchaseReconciliationScheduler {

    private final PurchaseOrchestrator purchaseOrchestrator;

    @Value("${market.scheduler.purchase-reconciliation.older-than-minutes:30}")
    private int olderThanMinutes;

    @Scheduled(cron = "${market.scheduler.purchase-reconciliation.cron:0 */5 * * * *}")
    public void reconcilePendingPurchases() {
        log.info("Starting scheduled job: reconcile pending purchases older than {} minutes", olderThanMinutes);

        try {
            int resolved = purchaseOrchestrator.reconcilePending(olderThanMinutes);

            if (resolved > 0) {
                log.info("Resolved {} pending purchases", resolved);
            } else {
                log.debug("No pending purchases resolved");
            }

        } catch (Exception e) {
            log.error("Failed to reconcile pending purchases: {}", e.getMessage(), e);
        }
    }
}

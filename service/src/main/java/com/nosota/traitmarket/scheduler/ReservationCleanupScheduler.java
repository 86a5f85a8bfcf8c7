package com.nosota.traitmarket.scheduler;

import com.nosota.traitmarket.service.ReservationCleanupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic reservation cleanup sweep.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   scheduler:
 *     reservation-cleanup:
 *       enabled: true          # enable/disable scheduler
 *       cron: "0 * * * * *"    # every minute
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "market.scheduler.reservation-cleanup.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class ReservationCleanupScheduler {

    private final ReservationCleanupService reservationCleanupService;

    @Scheduled(cron = "${market.scheduler.reservation-cleanup.cron:0 * * * * *}")
    public void expireStaleReservations() {
        log.debug("Starting scheduled job: expire stale reservations");

        try {
            int expiredCount = reservationCleanupService.sweep();

            if (expiredCount > 0) {
                log.info("Expired {} stale reservations", expiredCount);
            } else {
                log.debug("No stale reservations found");
            }

        } catch (Exception e) {
            log.error("Failed to expire stale reservations: {}", e.getMessage(), e);
        }
    }
}

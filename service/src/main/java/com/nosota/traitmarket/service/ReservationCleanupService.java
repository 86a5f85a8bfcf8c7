package com.nosota.traitmarket.service;

import com.nosota.traitmarket.api.model.ReservationStatus;
import com.nosota.traitmarket.collaborator.AuditSink;
import com.nosota.traitmarket.model.ActorType;
import com.nosota.traitmarket.repository.ReservationRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Reclaims reservations whose TTL has passed.
 *
 * <p>The sweep is one bulk conditional update (RESERVED and expiresAt &lt;= now → EXPIRED).
 * Running it twice in a row affects rows only the first time; CONSUMED, CANCELLED and
 * EXPIRED rows are never touched.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ReservationCleanupService {

    private final ReservationRepository reservationRepository;
    private final AuditSink auditSink;

    /**
     * Expires every RESERVED hold whose TTL has passed.
     *
     * @return Number of reservations expired by this call
     */
    @Transactional
    public int sweep() {
        LocalDateTime now = LocalDateTime.now();
        int expired = reservationRepository.expireAll(ReservationStatus.RESERVED, ReservationStatus.EXPIRED, now);

        if (expired > 0) {
            log.info("Expired {} stale reservations", expired);
            auditSink.record(ActorType.SYSTEM, "reservation_cleanup", Map.of("expiredCount", expired, "at", now.toString()));
        }
        return expired;
    }

    /**
     * Expires specific reservations regardless of TTL. Only rows still RESERVED are affected.
     *
     * @param reservationIds Reservations to expire
     * @return Number of reservations expired by this call
     */
    @Transactional
    public int forceExpire(@NotEmpty Collection<UUID> reservationIds) {
        int expired = reservationRepository.transitionAll(
                reservationIds, ReservationStatus.RESERVED, ReservationStatus.EXPIRED);

        log.info("Force-expired {} of {} requested reservations", expired, reservationIds.size());
        auditSink.record(ActorType.ADMIN, "reservation_force_cleanup",
                Map.of("requested", reservationIds.size(), "expiredCount", expired));
        return expired;
    }
}

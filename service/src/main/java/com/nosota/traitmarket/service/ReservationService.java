package com.nosota.traitmarket.service;

import com.nosota.traitmarket.api.model.PurchaseStatus;
import com.nosota.traitmarket.api.model.ReservationStatus;
import com.nosota.traitmarket.api.request.Addresses;
import com.nosota.traitmarket.api.response.InventoryResponse;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.error.OutOfStockException;
import com.nosota.traitmarket.error.ReservationExpiredException;
import com.nosota.traitmarket.error.ValidationException;
import com.nosota.traitmarket.model.Reservation;
import com.nosota.traitmarket.model.Trait;
import com.nosota.traitmarket.repository.PurchaseRepository;
import com.nosota.traitmarket.repository.ReservationRepository;
import com.nosota.traitmarket.repository.TraitRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Reservation manager: time-bounded holds on trait supply.
 *
 * <p>Capacity rule for a capped trait:
 * <pre>
 * available = remainingSupply - countActive(traitId) - countInFlight(traitId)
 * </pre>
 * where countActive counts RESERVED rows with expiresAt &gt; now, and countInFlight counts
 * broadcast purchases that are not final but whose reservation no longer holds a unit.
 * Expired rows stop counting immediately, whether or not the cleanup sweep has run; a purchase
 * whose transaction is already on its way to the ledger keeps its unit until it is settled.
 *
 * <p>{@link #reserve} performs the capacity check and the insert inside one database transaction
 * that holds a row lock on the trait, so concurrent reservations of the same trait serialize in
 * the database. Status changes ({@link #consume}, {@link #cancel}) are single conditional
 * updates; among concurrent callers exactly one sees an affected row.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   reservation:
 *     ttl-minutes: 10     # one TTL for every trait
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ReservationService {

    private static final Pattern ADDRESS = Pattern.compile(Addresses.BASE58_ADDRESS);

    private static final List<PurchaseStatus> IN_FLIGHT = List.of(PurchaseStatus.TX_BUILT, PurchaseStatus.CONFIRMED);

    private final ReservationRepository reservationRepository;
    private final TraitRepository traitRepository;
    private final PurchaseRepository purchaseRepository;

    @Value("${market.reservation.ttl-minutes:10}")
    private long ttlMinutes;

    /**
     * Reserves one unit of a trait for a wallet/asset pair.
     *
     * <p>Steps, all under the trait row lock:
     * <ol>
     *   <li>Return the active reservation for the same triple, if any (idempotent retry)</li>
     *   <li>For capped traits, reject when remainingSupply - countActive - countInFlight &lt;= 0</li>
     *   <li>Insert a RESERVED row expiring after the configured TTL</li>
     * </ol>
     *
     * @param traitId       Trait to reserve
     * @param walletAddress Buyer wallet
     * @param assetId       Asset the trait will be applied to
     * @return New or existing active reservation
     * @throws OutOfStockException if no unit is left
     * @throws ValidationException if the trait is inactive or an address is malformed
     * @throws NotFoundException   if the trait does not exist
     */
    @Transactional
    public Reservation reserve(@NotNull UUID traitId, @NotNull String walletAddress, @NotNull String assetId) {
        requireAddress("walletAddress", walletAddress);
        requireAddress("assetId", assetId);

        Trait trait = traitRepository.findByIdForUpdate(traitId)
                .orElseThrow(() -> new NotFoundException("Trait", traitId));
        if (!trait.isActive()) {
            throw new ValidationException("Trait " + traitId + " is not available for sale");
        }

        LocalDateTime now = LocalDateTime.now();

        List<Reservation> existing = reservationRepository.findActive(
                traitId, walletAddress, assetId, ReservationStatus.RESERVED, now);
        if (!existing.isEmpty()) {
            Reservation reservation = existing.get(0);
            log.info("Returning existing reservation {} for trait={}, wallet={}, asset={}",
                    reservation.getId(), traitId, walletAddress, assetId);
            return reservation;
        }

        if (!trait.isUnlimited()) {
            long active = reservationRepository.countActive(traitId, ReservationStatus.RESERVED, now);
            long inFlight = countInFlight(traitId, now);
            long available = trait.getRemainingSupply() - active - inFlight;
            if (available <= 0) {
                log.info("Trait {} out of stock: remaining={}, activeReservations={}, inFlightPurchases={}",
                        traitId, trait.getRemainingSupply(), active, inFlight);
                throw new OutOfStockException(traitId);
            }
        }

        Reservation reservation = new Reservation();
        reservation.setTraitId(traitId);
        reservation.setWalletAddress(walletAddress);
        reservation.setAssetId(assetId);
        reservation.setStatus(ReservationStatus.RESERVED);
        reservation.setCreatedAt(now);
        reservation.setExpiresAt(now.plusMinutes(ttlMinutes));
        reservation = reservationRepository.save(reservation);

        log.info("Reservation created: id={}, trait={}, wallet={}, asset={}, expiresAt={}",
                reservation.getId(), traitId, walletAddress, assetId, reservation.getExpiresAt());

        return reservation;
    }

    /**
     * Marks a reservation CONSUMED if it is still RESERVED and unexpired.
     *
     * @return Consumed reservation, or empty if it had expired, been cancelled or been consumed already
     */
    @Transactional
    public Optional<Reservation> consume(@NotNull UUID reservationId) {
        int updated = reservationRepository.transitionIfUnexpired(
                reservationId, ReservationStatus.RESERVED, ReservationStatus.CONSUMED, LocalDateTime.now());
        if (updated == 0) {
            log.debug("Reservation {} not consumable", reservationId);
            return Optional.empty();
        }
        log.info("Reservation consumed: id={}", reservationId);
        return reservationRepository.findById(reservationId);
    }

    /**
     * Releases a RESERVED hold. No-op for any other status.
     *
     * @return true if this call cancelled the reservation
     */
    @Transactional
    public boolean cancel(@NotNull UUID reservationId) {
        int updated = reservationRepository.transition(
                reservationId, ReservationStatus.RESERVED, ReservationStatus.CANCELLED);
        if (updated > 0) {
            log.info("Reservation cancelled: id={}", reservationId);
            return true;
        }
        return false;
    }

    /**
     * Loads a reservation under a row lock inside the caller's transaction.
     */
    @Transactional
    public Reservation lock(@NotNull UUID reservationId) {
        return reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> new NotFoundException("Reservation", reservationId));
    }

    public long countActive(@NotNull UUID traitId) {
        return reservationRepository.countActive(traitId, ReservationStatus.RESERVED, LocalDateTime.now());
    }

    /**
     * Broadcast, unsettled purchases of the trait whose reservation stopped holding a unit.
     */
    public long countInFlight(@NotNull UUID traitId) {
        return countInFlight(traitId, LocalDateTime.now());
    }

    private long countInFlight(UUID traitId, LocalDateTime now) {
        return purchaseRepository.countInFlightWithoutHold(traitId, IN_FLIGHT, ReservationStatus.RESERVED, now);
    }

    public Optional<Reservation> findActive(@NotNull UUID traitId, @NotNull String walletAddress, @NotNull String assetId) {
        return reservationRepository.findActive(
                        traitId, walletAddress, assetId, ReservationStatus.RESERVED, LocalDateTime.now())
                .stream()
                .findFirst();
    }

    public Reservation getReservation(@NotNull UUID reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new NotFoundException("Reservation", reservationId));
    }

    /**
     * Seconds left on the hold; 0 once expired or no longer RESERVED.
     */
    public long timeRemainingSeconds(Reservation reservation) {
        LocalDateTime now = LocalDateTime.now();
        if (!reservation.isActiveAt(now)) {
            return 0;
        }
        return Duration.between(now, reservation.getExpiresAt()).getSeconds();
    }

    public boolean isExpired(Reservation reservation) {
        return !reservation.getExpiresAt().isAfter(LocalDateTime.now());
    }

    /**
     * Loads a reservation that must still be held.
     *
     * @throws ReservationExpiredException if it is expired, cancelled or consumed
     */
    public Reservation getHeld(@NotNull UUID reservationId) {
        Reservation reservation = getReservation(reservationId);
        if (!reservation.isActiveAt(LocalDateTime.now())) {
            throw new ReservationExpiredException(reservationId);
        }
        return reservation;
    }

    public InventoryResponse getInventory(@NotNull UUID traitId) {
        Trait trait = traitRepository.findById(traitId)
                .orElseThrow(() -> new NotFoundException("Trait", traitId));
        LocalDateTime now = LocalDateTime.now();
        long active = reservationRepository.countActive(traitId, ReservationStatus.RESERVED, now);
        long inFlight = countInFlight(traitId, now);

        if (trait.isUnlimited()) {
            return new InventoryResponse(traitId, null, null, active, inFlight, null, true);
        }
        long available = Math.max(0, trait.getRemainingSupply() - active - inFlight);
        return new InventoryResponse(traitId, trait.getTotalSupply(), trait.getRemainingSupply(),
                active, inFlight, available, false);
    }

    private static void requireAddress(String field, String value) {
        if (!ADDRESS.matcher(value).matches()) {
            throw new ValidationException(field + " is not a valid base58 address: " + value);
        }
    }
}

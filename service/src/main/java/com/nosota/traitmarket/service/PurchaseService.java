package com.nosota.traitmarket.service;

import com.nosota.traitmarket.api.model.PurchaseStatus;
import com.nosota.traitmarket.collaborator.AuditSink;
import com.nosota.traitmarket.dto.TraitListing;
import com.nosota.traitmarket.error.DuplicateSignatureException;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.error.ValidationException;
import com.nosota.traitmarket.model.ActorType;
import com.nosota.traitmarket.model.Purchase;
import com.nosota.traitmarket.model.Reservation;
import com.nosota.traitmarket.model.UnsignedBundle;
import com.nosota.traitmarket.repository.PurchaseRepository;
import com.nosota.traitmarket.repository.TraitRepository;
import com.nosota.traitmarket.repository.UnsignedBundleRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent side of the purchase lifecycle.
 *
 * <p>Each method is one short database transaction; no ledger I/O happens inside them.
 * Status changes lock the purchase row and are validated by {@link PurchaseStatusStateMachine}.
 *
 * <pre>
 * CREATED → TX_BUILT → CONFIRMED → FULFILLED
 *    \          \           \
 *     +----------+-----------+→ FAILED
 * </pre>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class PurchaseService {

    private static final int MAX_REASON_LENGTH = 1000;

    private final PurchaseRepository purchaseRepository;
    private final UnsignedBundleRepository unsignedBundleRepository;
    private final TraitRepository traitRepository;
    private final ReservationService reservationService;
    private final GiftBalanceService giftBalanceService;
    private final PurchaseStatusStateMachine stateMachine;
    private final AuditSink auditSink;

    /**
     * Open (CREATED or TX_BUILT, not yet broadcast) purchase already backing a reservation.
     * A repeated build for the same reservation reuses it instead of settling twice.
     */
    public Optional<Purchase> findOpenForReservation(@NotNull UUID reservationId) {
        return purchaseRepository.findFirstByReservationIdOrderByCreatedAtDesc(reservationId)
                .filter(p -> p.getStatus() == PurchaseStatus.CREATED || p.getStatus() == PurchaseStatus.TX_BUILT);
    }

    /**
     * Creates the purchase for a held reservation, choosing the settlement route.
     *
     * <p>Runs under a row lock on the reservation and returns the open purchase when one already
     * backs it, so concurrent builds for one reservation settle through a single purchase.
     *
     * <p>A unit of the buyer's gift balance is redeemed first (price 0); when none is left,
     * including when a concurrent redemption took the last unit, the listed price applies.
     * The gift decrement and the insert commit together.
     *
     * @param reservation    Held reservation
     * @param listing        Trait price and token
     * @param treasuryWallet Payment destination
     * @return Purchase in CREATED, or the open purchase already created for the reservation
     */
    @Transactional
    public Purchase createPurchase(@NotNull Reservation reservation,
                                   @NotNull TraitListing listing,
                                   @NotNull String treasuryWallet) {
        reservationService.lock(reservation.getId());
        Optional<Purchase> open = findOpenForReservation(reservation.getId());
        if (open.isPresent()) {
            log.info("Reservation {} already backs open purchase {}", reservation.getId(), open.get().getId());
            return open.get();
        }

        boolean giftRedemption = giftBalanceService.decrement(
                reservation.getWalletAddress(), reservation.getTraitId(), 1);
        BigInteger priceAmount = giftRedemption ? BigInteger.ZERO : listing.priceAmount();
        UUID tokenId = listing.tokenId();

        LocalDateTime now = LocalDateTime.now();

        Purchase purchase = new Purchase();
        purchase.setWalletAddress(reservation.getWalletAddress());
        purchase.setAssetId(reservation.getAssetId());
        purchase.setTraitId(reservation.getTraitId());
        purchase.setReservationId(reservation.getId());
        purchase.setPriceAmount(priceAmount);
        purchase.setTokenId(tokenId);
        purchase.setTreasuryWallet(treasuryWallet);
        purchase.setGiftRedemption(giftRedemption);
        purchase.setStatus(PurchaseStatus.CREATED);
        purchase.setCreatedAt(now);
        purchase.setUpdatedAt(now);
        purchase = purchaseRepository.save(purchase);

        log.info("Purchase created: id={}, reservation={}, wallet={}, asset={}, trait={}, price={}, gift={}",
                purchase.getId(), reservation.getId(), purchase.getWalletAddress(), purchase.getAssetId(),
                purchase.getTraitId(), priceAmount, giftRedemption);
        audit(ActorType.USER, "purchase_created", purchase);
        return purchase;
    }

    /**
     * Stores the delegate-signed bundle and moves the purchase to TX_BUILT.
     * A rebuild for a purchase already in TX_BUILT replaces the stored bundle.
     */
    @Transactional
    public Purchase markTxBuilt(@NotNull UUID purchaseId, @NotNull UUID bundleId, @NotNull String payload) {
        Purchase purchase = lock(purchaseId);
        if (purchase.getTxSignature() != null) {
            throw new ValidationException("Purchase " + purchaseId + " was already submitted");
        }
        if (purchase.getStatus() != PurchaseStatus.TX_BUILT) {
            stateMachine.validateTransition(purchase.getStatus(), PurchaseStatus.TX_BUILT);
        }

        unsignedBundleRepository.findByPurchaseId(purchaseId).ifPresent(previous -> {
            unsignedBundleRepository.delete(previous);
            unsignedBundleRepository.flush();
        });
        unsignedBundleRepository.save(new UnsignedBundle(bundleId, purchaseId, payload, LocalDateTime.now()));

        purchase.setStatus(PurchaseStatus.TX_BUILT);
        purchase.setUpdatedAt(LocalDateTime.now());
        purchase = purchaseRepository.save(purchase);

        log.info("Purchase {} → TX_BUILT, bundle={}", purchaseId, bundleId);
        audit(ActorType.SYSTEM, "purchase_tx_built", purchase);
        return purchase;
    }

    public UnsignedBundle getBundle(@NotNull UUID bundleId) {
        return unsignedBundleRepository.findById(bundleId)
                .orElseThrow(() -> new NotFoundException("Transaction bundle", bundleId));
    }

    /**
     * Attaches the broadcast signature to the purchase.
     *
     * <p>Idempotent for the same signature. A signature already settling another purchase raises
     * {@link DuplicateSignatureException}; concurrent attaches that slip past the lookup are
     * rejected by the unique constraint on {@code tx_signature}.
     */
    @Transactional
    public Purchase attachSignature(@NotNull UUID purchaseId, @NotNull String txSignature) {
        Purchase purchase = lock(purchaseId);

        if (txSignature.equals(purchase.getTxSignature())) {
            log.debug("Signature {} already attached to purchase {}", txSignature, purchaseId);
            return purchase;
        }
        if (purchase.getTxSignature() != null) {
            throw new ValidationException("Purchase " + purchaseId + " was already submitted with another signature");
        }

        Optional<Purchase> owner = purchaseRepository.findByTxSignature(txSignature);
        if (owner.isPresent()) {
            throw new DuplicateSignatureException(txSignature, owner.get().getId());
        }
        if (purchase.getStatus() != PurchaseStatus.TX_BUILT) {
            throw new ValidationException("Purchase " + purchaseId + " is " + purchase.getStatus() + " and cannot be submitted");
        }

        purchase.setTxSignature(txSignature);
        purchase.setUpdatedAt(LocalDateTime.now());
        purchase = purchaseRepository.saveAndFlush(purchase);

        log.info("Signature attached: purchase={}, signature={}", purchaseId, txSignature);
        audit(ActorType.USER, "purchase_submitted", purchase);
        return purchase;
    }

    /**
     * Fails a purchase whose transaction never committed: releases the reservation and gives back
     * a redeemed gift unit. No-op on a purchase that is already final.
     */
    @Transactional
    public Purchase markFailed(@NotNull UUID purchaseId, String reason) {
        Purchase purchase = lock(purchaseId);
        if (stateMachine.isFinalState(purchase.getStatus())) {
            log.info("Purchase {} already {}, not marking FAILED", purchaseId, purchase.getStatus());
            return purchase;
        }
        stateMachine.validateTransition(purchase.getStatus(), PurchaseStatus.FAILED);

        reservationService.cancel(purchase.getReservationId());
        if (purchase.isGiftRedemption()) {
            giftBalanceService.restore(purchase.getWalletAddress(), purchase.getTraitId());
        }

        purchase.setStatus(PurchaseStatus.FAILED);
        purchase.setFailureReason(truncate(reason));
        purchase.setUpdatedAt(LocalDateTime.now());
        purchase = purchaseRepository.save(purchase);

        log.warn("Purchase {} → FAILED: {}", purchaseId, reason);
        audit(ActorType.SYSTEM, "purchase_failed", purchase);
        return purchase;
    }

    /**
     * Applies a ledger confirmation: TX_BUILT → CONFIRMED → FULFILLED.
     *
     * <p>Fulfillment decrements remaining supply of a capped trait and consumes the reservation.
     * Runs under the purchase row lock; a second confirmation for the same purchase finds it
     * FULFILLED and returns it unchanged.
     */
    @Transactional
    public Purchase fulfill(@NotNull UUID purchaseId) {
        Purchase purchase = lock(purchaseId);

        if (purchase.getStatus() == PurchaseStatus.FULFILLED) {
            log.info("Purchase {} already FULFILLED, confirmation ignored", purchaseId);
            return purchase;
        }
        if (purchase.getStatus() == PurchaseStatus.FAILED) {
            log.warn("Confirmation received for FAILED purchase {} (signature={})", purchaseId, purchase.getTxSignature());
            return purchase;
        }

        if (purchase.getStatus() != PurchaseStatus.CONFIRMED) {
            stateMachine.validateTransition(purchase.getStatus(), PurchaseStatus.CONFIRMED);
            log.info("Purchase {} → CONFIRMED, signature={}", purchaseId, purchase.getTxSignature());
            purchase.setStatus(PurchaseStatus.CONFIRMED);
            audit(ActorType.SYSTEM, "purchase_confirmed", purchase);
        }
        stateMachine.validateTransition(purchase.getStatus(), PurchaseStatus.FULFILLED);

        // Bulk updates below clear the persistence context; the purchase is saved by merge afterwards.
        int supplyUpdated = traitRepository.decrementRemainingSupply(purchase.getTraitId());
        if (supplyUpdated == 0 && isCapped(purchase.getTraitId())) {
            log.error("Trait {} had no supply left when purchase {} (signature={}) settled on the ledger",
                    purchase.getTraitId(), purchaseId, purchase.getTxSignature());
            audit(ActorType.SYSTEM, "supply_exhausted_on_fulfillment", purchase);
        }

        if (reservationService.consume(purchase.getReservationId()).isEmpty()) {
            log.warn("Reservation {} was no longer held when purchase {} was fulfilled",
                    purchase.getReservationId(), purchaseId);
        }

        purchase.setStatus(PurchaseStatus.FULFILLED);
        purchase.setUpdatedAt(LocalDateTime.now());
        purchase = purchaseRepository.save(purchase);

        log.info("Purchase {} → FULFILLED", purchaseId);
        audit(ActorType.SYSTEM, "purchase_fulfilled", purchase);
        return purchase;
    }

    public Purchase getPurchase(@NotNull UUID purchaseId) {
        return purchaseRepository.findById(purchaseId)
                .orElseThrow(() -> new NotFoundException("Purchase", purchaseId));
    }

    public Optional<Purchase> findBySignature(@NotNull String txSignature) {
        return purchaseRepository.findByTxSignature(txSignature);
    }

    /**
     * Purchases stuck in CREATED or TX_BUILT since before now - {@code olderThanMinutes}.
     */
    public List<Purchase> findPending(int olderThanMinutes) {
        return purchaseRepository.findPending(
                List.of(PurchaseStatus.CREATED, PurchaseStatus.TX_BUILT),
                LocalDateTime.now().minusMinutes(olderThanMinutes));
    }

    private boolean isCapped(UUID traitId) {
        return traitRepository.findById(traitId)
                .map(trait -> !trait.isUnlimited())
                .orElse(false);
    }

    private Purchase lock(UUID purchaseId) {
        return purchaseRepository.findByIdForUpdate(purchaseId)
                .orElseThrow(() -> new NotFoundException("Purchase", purchaseId));
    }

    private void audit(ActorType actor, String action, Purchase purchase) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("purchaseId", purchase.getId());
        payload.put("walletAddress", purchase.getWalletAddress());
        payload.put("assetId", purchase.getAssetId());
        payload.put("traitId", purchase.getTraitId());
        payload.put("status", purchase.getStatus());
        payload.put("priceAmount", purchase.getPriceAmount().toString());
        payload.put("giftRedemption", purchase.isGiftRedemption());
        if (purchase.getTxSignature() != null) {
            payload.put("txSignature", purchase.getTxSignature());
        }
        auditSink.record(actor, action, payload);
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}

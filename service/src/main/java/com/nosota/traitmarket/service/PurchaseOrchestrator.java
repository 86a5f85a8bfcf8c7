package com.nosota.traitmarket.service;

import com.nosota.traitmarket.api.model.PaymentMethod;
import com.nosota.traitmarket.api.model.PurchaseStatus;
import com.nosota.traitmarket.collaborator.AssetOwnershipVerifier;
import com.nosota.traitmarket.collaborator.CatalogReader;
import com.nosota.traitmarket.dto.AssetRecord;
import com.nosota.traitmarket.dto.BuiltTransaction;
import com.nosota.traitmarket.dto.SubmissionOutcome;
import com.nosota.traitmarket.dto.TraitListing;
import com.nosota.traitmarket.error.BroadcastException;
import com.nosota.traitmarket.error.ConfirmationTimeoutException;
import com.nosota.traitmarket.error.DuplicateSignatureException;
import com.nosota.traitmarket.error.MarketException;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.error.OwnershipException;
import com.nosota.traitmarket.error.ReservationExpiredException;
import com.nosota.traitmarket.error.SimulationException;
import com.nosota.traitmarket.error.TransactionBuildException;
import com.nosota.traitmarket.error.ValidationException;
import com.nosota.traitmarket.ledger.BundleValidation;
import com.nosota.traitmarket.ledger.InstructionCategory;
import com.nosota.traitmarket.ledger.SignatureStatus;
import com.nosota.traitmarket.ledger.SimulationResult;
import com.nosota.traitmarket.ledger.TransactionBundle;
import com.nosota.traitmarket.ledger.TransactionCodec;
import com.nosota.traitmarket.model.Purchase;
import com.nosota.traitmarket.model.Reservation;
import com.nosota.traitmarket.model.UnsignedBundle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Drives a purchase from a held reservation to fulfillment.
 *
 * <p>Flow:
 * <ol>
 *   <li>{@link #buildTransaction}: reservation held → purchase CREATED (gift route when a gift unit
 *       is available) → ownership check → metadata document published → bundle built, validated
 *       and simulated → TX_BUILT</li>
 *   <li>{@link #submitTransaction}: user signature verified → broadcast → signature attached →
 *       confirmation awaited → FULFILLED, or FAILED on an observed ledger error</li>
 *   <li>{@link #processConfirmation} / {@link #reconcile}: resolve a broadcast purchase against
 *       actual ledger state</li>
 * </ol>
 *
 * <p>This class is not transactional. Database steps are short transactions in
 * {@link PurchaseService}; ledger calls happen between them, so no row lock is held across I/O.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   treasury:
 *     wallet: 9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin
 *   ledger:
 *     simulate-on-build: true
 *     await-timeout-ms: 90000   # upper bound for blocking on a ledger call
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseOrchestrator {

    private final ReservationService reservationService;
    private final PurchaseService purchaseService;
    private final TransactionBuilderService transactionBuilderService;
    private final TransactionCodec transactionCodec;
    private final CatalogReader catalogReader;
    private final AssetOwnershipVerifier ownershipVerifier;
    private final MetadataService metadataService;

    @Value("${market.treasury.wallet}")
    private String treasuryWallet;

    @Value("${market.ledger.simulate-on-build:true}")
    private boolean simulateOnBuild;

    @Value("${market.ledger.await-timeout-ms:90000}")
    private long awaitTimeoutMs;

    // ==================== Build ====================

    /**
     * Builds the bundle the buyer has to sign for a held reservation.
     *
     * @throws ReservationExpiredException if the reservation is no longer held
     * @throws OwnershipException          if the wallet no longer owns the asset (purchase FAILED)
     * @throws TransactionBuildException   if the bundle misses a required leg (purchase FAILED)
     * @throws SimulationException         if the ledger dry run rejects the bundle (purchase FAILED)
     * @throws BroadcastException          if the asset index or the ledger cannot be reached (purchase stays open)
     */
    public BuiltTransaction buildTransaction(UUID reservationId) {
        Reservation reservation = reservationService.getHeld(reservationId);
        TraitListing listing = catalogReader.getTrait(reservation.getTraitId());
        if (!listing.active()) {
            throw new ValidationException("Trait " + listing.traitId() + " is not available for sale");
        }

        Purchase purchase = purchaseService.findOpenForReservation(reservationId)
                .orElseGet(() -> purchaseService.createPurchase(reservation, listing, treasuryWallet));
        UUID purchaseId = purchase.getId();

        boolean owner = await(ownershipVerifier.isOwner(reservation.getWalletAddress(), reservation.getAssetId()),
                "ownership verification");
        if (!owner) {
            purchaseService.markFailed(purchaseId, "Wallet no longer owns asset " + reservation.getAssetId());
            throw new OwnershipException(reservation.getWalletAddress(), reservation.getAssetId());
        }

        // lookup or index failures leave the purchase open for a retried build
        AssetRecord asset = await(metadataService.currentAsset(reservation.getAssetId()), "asset lookup");
        metadataService.publish(asset, purchase.getTraitId());

        boolean paymentRequired = purchase.getPriceAmount().signum() > 0;

        TransactionBundle bundle;
        try {
            bundle = await(transactionBuilderService.build(
                    purchase.getWalletAddress(),
                    purchase.getAssetId(),
                    purchase.getTraitId(),
                    purchase.getPriceAmount(),
                    listing.tokenMint(),
                    purchase.getTreasuryWallet()), "transaction build");
        } catch (MarketException e) {
            purchaseService.markFailed(purchaseId, e.getMessage());
            throw e;
        }

        BundleValidation validation = transactionBuilderService.validate(bundle, paymentRequired);
        if (!validation.valid()) {
            purchaseService.markFailed(purchaseId, validation.error());
            throw new TransactionBuildException(validation.error());
        }

        if (simulateOnBuild) {
            SimulationResult simulation;
            try {
                simulation = await(transactionBuilderService.simulate(bundle), "simulation");
            } catch (MarketException e) {
                purchaseService.markFailed(purchaseId, e.getMessage());
                throw e;
            }
            if (!simulation.success()) {
                purchaseService.markFailed(purchaseId, "Simulation failed: " + simulation.error());
                throw new SimulationException("Transaction simulation failed: " + simulation.error(),
                        simulation.paymentExecuted(), simulation.updateExecuted());
            }
        }

        purchase = purchaseService.markTxBuilt(purchaseId, bundle.id(), transactionCodec.toStoredForm(bundle));

        return new BuiltTransaction(
                purchase,
                bundle,
                transactionCodec.encodeMessage(bundle),
                validation,
                paymentMethod(purchase, listing),
                reservation.getExpiresAt());
    }

    private static PaymentMethod paymentMethod(Purchase purchase, TraitListing listing) {
        if (purchase.isGiftRedemption()) {
            return PaymentMethod.GIFT;
        }
        return listing.isNativePayment() ? PaymentMethod.NATIVE : PaymentMethod.TOKEN;
    }

    // ==================== Submit ====================

    /**
     * Broadcasts a signed bundle and settles the purchase.
     *
     * <p>A signature that already settles a purchase returns that purchase unchanged.
     * When confirmation is not observed in time the purchase stays TX_BUILT with its signature
     * attached and the outcome is reported as pending.
     */
    public SubmissionOutcome submitTransaction(UUID bundleId, String userSignature) {
        UnsignedBundle stored = purchaseService.getBundle(bundleId);
        Purchase purchase = purchaseService.getPurchase(stored.getPurchaseId());

        Purchase settled = purchaseService.findBySignature(userSignature).orElse(null);
        if (settled != null) {
            log.info("Signature {} already processed for purchase {}, returning it unchanged",
                    userSignature, settled.getId());
            return alreadyProcessed(settled);
        }

        if (purchase.getStatus() != PurchaseStatus.TX_BUILT || purchase.getTxSignature() != null) {
            throw new ValidationException("Purchase " + purchase.getId() + " is " + purchase.getStatus()
                    + " and cannot be submitted; reserve the trait again");
        }

        Reservation reservation = reservationService.getReservation(purchase.getReservationId());
        if (!reservation.isActiveAt(LocalDateTime.now())) {
            purchaseService.markFailed(purchase.getId(), "Reservation expired before submission");
            throw new ReservationExpiredException(reservation.getId());
        }

        TransactionBundle bundle = transactionCodec.fromStoredForm(stored.getPayload());
        String signature = broadcast(purchase, bundle, userSignature);

        try {
            purchase = purchaseService.attachSignature(purchase.getId(), signature);
        } catch (DuplicateSignatureException e) {
            log.info("Signature {} already settles purchase {}", signature, e.getExistingPurchaseId());
            return alreadyProcessed(purchaseService.getPurchase(e.getExistingPurchaseId()));
        } catch (DataIntegrityViolationException e) {
            Purchase existing = purchaseService.findBySignature(signature).orElseThrow(() -> e);
            log.info("Signature {} attached concurrently to purchase {}", signature, existing.getId());
            return alreadyProcessed(existing);
        }

        SignatureStatus status;
        try {
            status = await(transactionBuilderService.awaitConfirmation(signature), "confirmation");
        } catch (ConfirmationTimeoutException e) {
            log.warn("Purchase {} left pending for reconciliation: {}", purchase.getId(), e.getMessage());
            return new SubmissionOutcome(purchase, false, false, true,
                    "Transaction sent; confirmation is still pending");
        }

        return settle(purchase, bundle, status);
    }

    private String broadcast(Purchase purchase, TransactionBundle bundle, String userSignature) {
        try {
            return await(transactionBuilderService.broadcast(bundle, userSignature), "broadcast");
        } catch (ValidationException e) {
            // Wrong signature: the buyer may sign again, the purchase stays TX_BUILT
            throw e;
        } catch (BroadcastException e) {
            if (observedOnLedger(userSignature)) {
                log.warn("Broadcast of purchase {} reported failure but signature {} is on the ledger",
                        purchase.getId(), userSignature);
                return userSignature;
            }
            purchaseService.markFailed(purchase.getId(), "Broadcast failed: " + e.getMessage());
            throw e;
        } catch (MarketException e) {
            purchaseService.markFailed(purchase.getId(), e.getMessage());
            throw e;
        }
    }

    private boolean observedOnLedger(String signature) {
        try {
            return await(transactionBuilderService.getStatus(signature), "status query").observed();
        } catch (MarketException e) {
            log.warn("Could not query status of {}: {}", signature, e.getMessage());
            return false;
        }
    }

    private SubmissionOutcome settle(Purchase purchase, TransactionBundle bundle, SignatureStatus status) {
        if (status.failed()) {
            Purchase failed = purchaseService.markFailed(purchase.getId(), "Ledger error: " + status.error());
            return new SubmissionOutcome(failed, false, false, false, "Transaction failed on ledger: " + status.error());
        }
        Purchase fulfilled = purchaseService.fulfill(purchase.getId());
        return new SubmissionOutcome(fulfilled,
                bundle.contains(InstructionCategory.PAYMENT),
                bundle.contains(InstructionCategory.METADATA_UPDATE),
                false,
                "Trait applied");
    }

    private static SubmissionOutcome alreadyProcessed(Purchase purchase) {
        boolean fulfilled = purchase.getStatus() == PurchaseStatus.FULFILLED;
        boolean paid = purchase.getPriceAmount().signum() > 0;
        return new SubmissionOutcome(purchase, fulfilled && paid, fulfilled,
                !fulfilled && purchase.getStatus() != PurchaseStatus.FAILED,
                "Transaction already processed");
    }

    // ==================== Confirmation & Reconciliation ====================

    /**
     * Applies a confirmation callback for a broadcast signature. The ledger is queried rather than
     * trusting the caller; repeated callbacks return the purchase unchanged.
     */
    public Purchase processConfirmation(String txSignature) {
        Purchase purchase = purchaseService.findBySignature(txSignature)
                .orElseThrow(() -> new NotFoundException("Purchase with signature", txSignature));
        return resolve(purchase);
    }

    /**
     * Resolves one pending purchase against actual ledger state.
     *
     * <p>A purchase without a signature never reached the ledger from this service's point of view,
     * but the buyer may still broadcast it; it is reported and left as is.
     */
    public Purchase reconcile(UUID purchaseId) {
        Purchase purchase = purchaseService.getPurchase(purchaseId);
        if (purchase.getTxSignature() == null) {
            log.info("Purchase {} has no signature ({}), left for manual review", purchaseId, purchase.getStatus());
            return purchase;
        }
        return resolve(purchase);
    }

    /**
     * Reconciles every pending purchase older than the grace window.
     *
     * @return Number of purchases moved to a final state
     */
    public int reconcilePending(int olderThanMinutes) {
        List<Purchase> pending = purchaseService.findPending(olderThanMinutes);
        int resolved = 0;
        for (Purchase purchase : pending) {
            try {
                Purchase after = reconcile(purchase.getId());
                if (after.getStatus() == PurchaseStatus.FULFILLED || after.getStatus() == PurchaseStatus.FAILED) {
                    resolved++;
                }
            } catch (MarketException | IllegalStateException e) {
                log.warn("Failed to reconcile purchase {}: {}", purchase.getId(), e.getMessage());
            }
        }
        if (!pending.isEmpty()) {
            log.info("Reconciled {} of {} pending purchases", resolved, pending.size());
        }
        return resolved;
    }

    public List<Purchase> getPendingPurchases(int olderThanMinutes) {
        return purchaseService.findPending(olderThanMinutes);
    }

    public SignatureStatus getTransactionStatus(String signature) {
        return await(transactionBuilderService.getStatus(signature), "status query");
    }

    private Purchase resolve(Purchase purchase) {
        if (purchase.getStatus() == PurchaseStatus.FULFILLED || purchase.getStatus() == PurchaseStatus.FAILED) {
            log.info("Purchase {} already {}, nothing to do", purchase.getId(), purchase.getStatus());
            return purchase;
        }

        SignatureStatus status = await(transactionBuilderService.getStatus(purchase.getTxSignature()), "status query");
        if (status.failed()) {
            return purchaseService.markFailed(purchase.getId(), "Ledger error: " + status.error());
        }
        if (status.confirmed()) {
            return purchaseService.fulfill(purchase.getId());
        }
        log.info("Signature {} of purchase {} not confirmed yet (observed={})",
                purchase.getTxSignature(), purchase.getId(), status.observed());
        return purchase;
    }

    private <T> T await(Mono<T> call, String operation) {
        T value;
        try {
            value = call.block(Duration.ofMillis(awaitTimeoutMs));
        } catch (IllegalStateException e) {
            throw new BroadcastException("Timed out waiting for " + operation, e);
        }
        if (value == null) {
            throw new BroadcastException("Ledger returned no result for " + operation);
        }
        return value;
    }
}

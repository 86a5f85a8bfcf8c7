package com.nosota.traitmarket.api;

import com.nosota.traitmarket.api.request.ForceCleanupRequest;
import com.nosota.traitmarket.api.request.GrantGiftRequest;
import com.nosota.traitmarket.api.response.CleanupResponse;
import com.nosota.traitmarket.api.response.GiftBalanceResponse;
import com.nosota.traitmarket.api.response.PurchaseResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Operational API for reservation cleanup, purchase reconciliation and gift grants.
 *
 * <p>Implemented by MarketAdminController (service module) and MarketAdminClient (api module).
 */
@RequestMapping("/api/v1/admin")
public interface MarketAdminApi {

    // ==================== Reservation Cleanup ====================

    /**
     * Expires every RESERVED hold whose TTL has passed.
     *
     * @return Number of reservations expired by this call
     */
    @PostMapping("/reservations/cleanup")
    ResponseEntity<CleanupResponse> cleanupReservations();

    /**
     * Expires the given reservations regardless of their TTL.
     *
     * @param request Reservation IDs
     * @return Number of reservations expired by this call
     */
    @PostMapping("/reservations/cleanup/force")
    ResponseEntity<CleanupResponse> forceCleanupReservations(@Valid @RequestBody ForceCleanupRequest request);

    // ==================== Reconciliation ====================

    /**
     * Lists purchases stuck in CREATED or TX_BUILT longer than the grace window.
     *
     * @param olderThanMinutes Grace window in minutes (default 30)
     * @return Pending purchases, oldest first
     */
    @GetMapping("/purchases/pending")
    ResponseEntity<List<PurchaseResponse>> getPendingPurchases(
            @RequestParam(value = "olderThanMinutes", defaultValue = "30") int olderThanMinutes);

    /**
     * Resolves a pending purchase against actual ledger state.
     *
     * @param purchaseId Purchase UUID
     * @return Purchase after reconciliation
     */
    @PostMapping("/purchases/{purchaseId}/reconcile")
    ResponseEntity<PurchaseResponse> reconcilePurchase(@PathVariable("purchaseId") UUID purchaseId);

    // ==================== Gift Balances ====================

    /**
     * Adds free redemptions of a trait to a wallet.
     *
     * @param request Wallet, trait and quantity
     * @return Balance after the grant
     */
    @PostMapping("/gifts")
    ResponseEntity<GiftBalanceResponse> grantGift(@Valid @RequestBody GrantGiftRequest request);
}

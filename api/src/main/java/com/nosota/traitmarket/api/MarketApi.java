package com.nosota.traitmarket.api;

import com.nosota.traitmarket.api.request.BuildTransactionRequest;
import com.nosota.traitmarket.api.request.ConfirmationRequest;
import com.nosota.traitmarket.api.request.ReserveRequest;
import com.nosota.traitmarket.api.request.SubmitTransactionRequest;
import com.nosota.traitmarket.api.response.AssetMetadataResponse;
import com.nosota.traitmarket.api.response.BuildTransactionResponse;
import com.nosota.traitmarket.api.response.GiftBalanceResponse;
import com.nosota.traitmarket.api.response.InventoryResponse;
import com.nosota.traitmarket.api.response.PurchaseResponse;
import com.nosota.traitmarket.api.response.ReservationResponse;
import com.nosota.traitmarket.api.response.ReservationStatusResponse;
import com.nosota.traitmarket.api.response.SubmitTransactionResponse;
import com.nosota.traitmarket.api.response.TransactionStatusResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Checkout API for trait purchases.
 *
 * <p>Defines REST endpoints for:
 * <ul>
 *   <li>Reservations (time-bounded holds on trait supply)</li>
 *   <li>Transaction building and submission (atomic payment + metadata update)</li>
 *   <li>Purchase status and confirmation callbacks</li>
 *   <li>Gift balance lookup</li>
 *   <li>Metadata documents of assets wearing a purchased trait</li>
 * </ul>
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>MarketController - in service module (server-side implementation)</li>
 *   <li>MarketClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/market")
public interface MarketApi {

    // ==================== Reservations ====================

    /**
     * Reserves one unit of a trait for a wallet/asset pair.
     * Repeating the call for the same triple while the hold is active returns the same reservation.
     *
     * @param request Trait, wallet and asset
     * @return Created (or existing) reservation; 409 when the trait is out of stock
     */
    @PostMapping("/reservations")
    ResponseEntity<ReservationResponse> reserve(@Valid @RequestBody ReserveRequest request);

    /**
     * Gets a reservation with its remaining hold time.
     *
     * @param reservationId Reservation UUID
     * @return Reservation status
     */
    @GetMapping("/reservations/{reservationId}")
    ResponseEntity<ReservationStatusResponse> getReservation(
            @PathVariable("reservationId") UUID reservationId);

    /**
     * Finds the active hold for a wallet/asset/trait triple.
     *
     * @return Active reservation, or 404 when none is held
     */
    @GetMapping("/reservations/active")
    ResponseEntity<ReservationResponse> getActiveReservation(
            @RequestParam("traitId") UUID traitId,
            @RequestParam("walletAddress") String walletAddress,
            @RequestParam("assetId") String assetId);

    /**
     * Releases a held reservation. No-op when it is no longer RESERVED.
     *
     * @param reservationId Reservation UUID
     * @return Reservation after the call
     */
    @DeleteMapping("/reservations/{reservationId}")
    ResponseEntity<ReservationResponse> cancelReservation(
            @PathVariable("reservationId") UUID reservationId);

    /**
     * Gets current availability of a trait.
     *
     * @param traitId Trait UUID
     * @return Supply and active hold counts
     */
    @GetMapping("/inventory/{traitId}")
    ResponseEntity<InventoryResponse> getInventory(@PathVariable("traitId") UUID traitId);

    // ==================== Transactions ====================

    /**
     * Builds the unsigned bundle for a held reservation.
     * Uses the buyer's gift balance when one is available, otherwise the paid route.
     *
     * @param request Reservation to settle
     * @return Bundle to sign and the purchase it belongs to
     */
    @PostMapping("/transactions/build")
    ResponseEntity<BuildTransactionResponse> buildTransaction(
            @Valid @RequestBody BuildTransactionRequest request);

    /**
     * Submits the buyer's signature, broadcasts the bundle and waits for confirmation.
     *
     * @param request Bundle ID and user signature
     * @return Purchase outcome
     */
    @PostMapping("/transactions/submit")
    ResponseEntity<SubmitTransactionResponse> submitTransaction(
            @Valid @RequestBody SubmitTransactionRequest request);

    /**
     * Queries the ledger for a signature's confirmation depth.
     *
     * @param signature Transaction signature
     * @return Confirmation status
     */
    @GetMapping("/transactions/{signature}/status")
    ResponseEntity<TransactionStatusResponse> getTransactionStatus(
            @PathVariable("signature") String signature);

    // ==================== Purchases ====================

    /**
     * Gets a purchase by ID.
     *
     * @param purchaseId Purchase UUID
     * @return Purchase with current status and signature
     */
    @GetMapping("/purchases/{purchaseId}")
    ResponseEntity<PurchaseResponse> getPurchase(@PathVariable("purchaseId") UUID purchaseId);

    /**
     * Confirmation callback for a broadcast signature.
     * Repeated callbacks for the same signature return the purchase unchanged.
     *
     * @param request Confirmed signature
     * @return Purchase after processing
     */
    @PostMapping("/purchases/confirmations")
    ResponseEntity<PurchaseResponse> confirmPurchase(@Valid @RequestBody ConfirmationRequest request);

    // ==================== Gift Balances ====================

    /**
     * Gets the free-redemption allowance of a wallet for a trait.
     *
     * @return Balance (quantity 0 when none was ever granted)
     */
    @GetMapping("/gifts")
    ResponseEntity<GiftBalanceResponse> getGiftBalance(
            @RequestParam("walletAddress") String walletAddress,
            @RequestParam("traitId") UUID traitId);

    // ==================== Metadata ====================

    /**
     * Serves the metadata document an asset points at once the trait is applied.
     * This is the URI carried by the metadata-update instruction.
     *
     * @param assetId Asset address
     * @param traitId Trait UUID
     * @return Metadata document, or 404 when none was published
     */
    @GetMapping("/metadata/{assetId}/{traitId}.json")
    ResponseEntity<AssetMetadataResponse> getMetadata(
            @PathVariable("assetId") String assetId,
            @PathVariable("traitId") UUID traitId);
}

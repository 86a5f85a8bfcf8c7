package com.nosota.traitmarket.controller;

import com.nosota.traitmarket.api.MarketApi;
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
import com.nosota.traitmarket.dto.BuiltTransaction;
import com.nosota.traitmarket.dto.SubmissionOutcome;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.mapper.MarketMapper;
import com.nosota.traitmarket.model.Purchase;
import com.nosota.traitmarket.model.Reservation;
import com.nosota.traitmarket.service.GiftBalanceService;
import com.nosota.traitmarket.service.MetadataService;
import com.nosota.traitmarket.service.PurchaseOrchestrator;
import com.nosota.traitmarket.service.PurchaseService;
import com.nosota.traitmarket.service.ReservationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for the checkout flow.
 *
 * <p>Implements {@link MarketApi}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class MarketController implements MarketApi {

    private final ReservationService reservationService;
    private final PurchaseOrchestrator purchaseOrchestrator;
    private final PurchaseService purchaseService;
    private final GiftBalanceService giftBalanceService;
    private final MetadataService metadataService;

    // ==================== Reservations ====================

    @Override
    public ResponseEntity<ReservationResponse> reserve(ReserveRequest request) {
        Reservation reservation = reservationService.reserve(
                request.traitId(), request.walletAddress(), request.assetId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(MarketMapper.INSTANCE.toReservationResponse(reservation));
    }

    @Override
    public ResponseEntity<ReservationStatusResponse> getReservation(UUID reservationId) {
        Reservation reservation = reservationService.getReservation(reservationId);
        ReservationStatusResponse response = new ReservationStatusResponse(
                MarketMapper.INSTANCE.toReservationResponse(reservation),
                reservationService.isExpired(reservation),
                reservationService.timeRemainingSeconds(reservation)
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<ReservationResponse> getActiveReservation(UUID traitId, String walletAddress, String assetId) {
        Reservation reservation = reservationService.findActive(traitId, walletAddress, assetId)
                .orElseThrow(() -> new NotFoundException("Active reservation",
                        traitId + "/" + walletAddress + "/" + assetId));
        return ResponseEntity.ok(MarketMapper.INSTANCE.toReservationResponse(reservation));
    }

    @Override
    public ResponseEntity<ReservationResponse> cancelReservation(UUID reservationId) {
        boolean cancelled = reservationService.cancel(reservationId);
        Reservation reservation = reservationService.getReservation(reservationId);
        log.info("Cancel requested for reservation {}: cancelled={}, status={}",
                reservationId, cancelled, reservation.getStatus());
        return ResponseEntity.ok(MarketMapper.INSTANCE.toReservationResponse(reservation));
    }

    @Override
    public ResponseEntity<InventoryResponse> getInventory(UUID traitId) {
        return ResponseEntity.ok(reservationService.getInventory(traitId));
    }

    // ==================== Transactions ====================

    @Override
    public ResponseEntity<BuildTransactionResponse> buildTransaction(BuildTransactionRequest request) {
        BuiltTransaction built = purchaseOrchestrator.buildTransaction(request.reservationId());
        BuildTransactionResponse response = new BuildTransactionResponse(
                built.bundle().id(),
                built.purchase().getId(),
                built.serializedMessage(),
                built.bundle().requiredSignatures(),
                built.bundle().delegateSignatures(),
                built.purchase().getPriceAmount(),
                built.paymentMethod(),
                built.validation().hasPaymentInstruction(),
                built.validation().hasUpdateInstruction(),
                built.reservationExpiresAt()
        );
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<SubmitTransactionResponse> submitTransaction(SubmitTransactionRequest request) {
        SubmissionOutcome outcome = purchaseOrchestrator.submitTransaction(request.bundleId(), request.userSignature());
        Purchase purchase = outcome.purchase();
        SubmitTransactionResponse response = new SubmitTransactionResponse(
                purchase.getId(),
                purchase.getStatus(),
                purchase.getTxSignature(),
                outcome.paymentExecuted(),
                outcome.updateExecuted(),
                outcome.message()
        );
        HttpStatus status = outcome.pending() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @Override
    public ResponseEntity<TransactionStatusResponse> getTransactionStatus(String signature) {
        return ResponseEntity.ok(MarketMapper.INSTANCE.toTransactionStatusResponse(
                purchaseOrchestrator.getTransactionStatus(signature)));
    }

    // ==================== Purchases ====================

    @Override
    public ResponseEntity<PurchaseResponse> getPurchase(UUID purchaseId) {
        return ResponseEntity.ok(MarketMapper.INSTANCE.toPurchaseResponse(purchaseService.getPurchase(purchaseId)));
    }

    @Override
    public ResponseEntity<PurchaseResponse> confirmPurchase(ConfirmationRequest request) {
        Purchase purchase = purchaseOrchestrator.processConfirmation(request.txSignature());
        return ResponseEntity.ok(MarketMapper.INSTANCE.toPurchaseResponse(purchase));
    }

    // ==================== Gift Balances ====================

    @Override
    public ResponseEntity<GiftBalanceResponse> getGiftBalance(String walletAddress, UUID traitId) {
        GiftBalanceResponse response = giftBalanceService.findBalance(walletAddress, traitId)
                .map(MarketMapper.INSTANCE::toGiftBalanceResponse)
                .orElseGet(() -> new GiftBalanceResponse(walletAddress, traitId, 0));
        return ResponseEntity.ok(response);
    }

    // ==================== Metadata ====================

    @Override
    public ResponseEntity<AssetMetadataResponse> getMetadata(String assetId, UUID traitId) {
        return ResponseEntity.ok(metadataService.getMetadata(assetId, traitId));
    }
}

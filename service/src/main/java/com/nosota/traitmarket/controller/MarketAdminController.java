package com.nosota.traitmarket.controller;

import com.nosota.traitmarket.api.MarketAdminApi;
import com.nosota.traitmarket.api.request.ForceCleanupRequest;
import com.nosota.traitmarket.api.request.GrantGiftRequest;
import com.nosota.traitmarket.api.response.CleanupResponse;
import com.nosota.traitmarket.api.response.GiftBalanceResponse;
import com.nosota.traitmarket.api.response.PurchaseResponse;
import com.nosota.traitmarket.mapper.MarketMapper;
import com.nosota.traitmarket.model.GiftBalance;
import com.nosota.traitmarket.service.GiftBalanceService;
import com.nosota.traitmarket.service.PurchaseOrchestrator;
import com.nosota.traitmarket.service.ReservationCleanupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for operational endpoints. Implements {@link MarketAdminApi}.
 */
@RestController
@Validated
@RequiredArgsConstructor
public class MarketAdminController implements MarketAdminApi {

    private final ReservationCleanupService reservationCleanupService;
    private final PurchaseOrchestrator purchaseOrchestrator;
    private final GiftBalanceService giftBalanceService;

    @Override
    public ResponseEntity<CleanupResponse> cleanupReservations() {
        return ResponseEntity.ok(new CleanupResponse(reservationCleanupService.sweep()));
    }

    @Override
    public ResponseEntity<CleanupResponse> forceCleanupReservations(ForceCleanupRequest request) {
        return ResponseEntity.ok(new CleanupResponse(reservationCleanupService.forceExpire(request.reservationIds())));
    }

    @Override
    public ResponseEntity<List<PurchaseResponse>> getPendingPurchases(int olderThanMinutes) {
        return ResponseEntity.ok(MarketMapper.INSTANCE.toPurchaseResponses(
                purchaseOrchestrator.getPendingPurchases(olderThanMinutes)));
    }

    @Override
    public ResponseEntity<PurchaseResponse> reconcilePurchase(UUID purchaseId) {
        return ResponseEntity.ok(MarketMapper.INSTANCE.toPurchaseResponse(purchaseOrchestrator.reconcile(purchaseId)));
    }

    @Override
    public ResponseEntity<GiftBalanceResponse> grantGift(GrantGiftRequest request) {
        GiftBalance balance = giftBalanceService.grant(request.walletAddress(), request.traitId(), request.quantity());
        return ResponseEntity.ok(MarketMapper.INSTANCE.toGiftBalanceResponse(balance));
    }
}

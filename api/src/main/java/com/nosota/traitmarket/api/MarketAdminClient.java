package com.nosota.traitmarket.api;

import com.nosota.traitmarket.api.request.ForceCleanupRequest;
import com.nosota.traitmarket.api.request.GrantGiftRequest;
import com.nosota.traitmarket.api.response.CleanupResponse;
import com.nosota.traitmarket.api.response.GiftBalanceResponse;
import com.nosota.traitmarket.api.response.PurchaseResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of MarketAdminApi for operational tooling.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Register it as a bean
 * the same way as {@link MarketClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class MarketAdminClient implements MarketAdminApi {

    private final WebClient webClient;

    // ==================== Reservation Cleanup ====================

    @Override
    public ResponseEntity<CleanupResponse> cleanupReservations() {
        log.debug("Calling cleanupReservations");

        return webClient.post()
                .uri("/api/v1/admin/reservations/cleanup")
                .retrieve()
                .toEntity(CleanupResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<CleanupResponse> forceCleanupReservations(ForceCleanupRequest request) {
        log.debug("Calling forceCleanupReservations: count={}", request.reservationIds().size());

        return webClient.post()
                .uri("/api/v1/admin/reservations/cleanup/force")
                .bodyValue(request)
                .retrieve()
                .toEntity(CleanupResponse.class)
                .block();
    }

    // ==================== Reconciliation ====================

    @Override
    public ResponseEntity<List<PurchaseResponse>> getPendingPurchases(int olderThanMinutes) {
        log.debug("Calling getPendingPurchases: olderThanMinutes={}", olderThanMinutes);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/admin/purchases/pending")
                        .queryParam("olderThanMinutes", olderThanMinutes)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<PurchaseResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<PurchaseResponse> reconcilePurchase(UUID purchaseId) {
        log.debug("Calling reconcilePurchase: purchaseId={}", purchaseId);

        return webClient.post()
                .uri("/api/v1/admin/purchases/{purchaseId}/reconcile", purchaseId)
                .retrieve()
                .toEntity(PurchaseResponse.class)
                .block();
    }

    // ==================== Gift Balances ====================

    @Override
    public ResponseEntity<GiftBalanceResponse> grantGift(GrantGiftRequest request) {
        log.debug("Calling grantGift: wallet={}, traitId={}, quantity={}",
                request.walletAddress(), request.traitId(), request.quantity());

        return webClient.post()
                .uri("/api/v1/admin/gifts")
                .bodyValue(request)
                .retrieve()
                .toEntity(GiftBalanceResponse.class)
                .block();
    }
}

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of MarketApi for consuming the trait market service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * manually register it as a bean in their configuration.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Configuration
 * public class TraitMarketClientConfig {
 *     @Bean
 *     public WebClient traitMarketWebClient(WebClient.Builder builder,
 *                                           @Value("${services.trait-market.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public MarketClient marketClient(WebClient traitMarketWebClient) {
 *         return new MarketClient(traitMarketWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class MarketClient implements MarketApi {

    private final WebClient webClient;

    // ==================== Reservations ====================

    @Override
    public ResponseEntity<ReservationResponse> reserve(ReserveRequest request) {
        log.debug("Calling reserve: traitId={}, wallet={}, asset={}",
                request.traitId(), request.walletAddress(), request.assetId());

        return webClient.post()
                .uri("/api/v1/market/reservations")
                .bodyValue(request)
                .retrieve()
                .toEntity(ReservationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReservationStatusResponse> getReservation(UUID reservationId) {
        log.debug("Calling getReservation: reservationId={}", reservationId);

        return webClient.get()
                .uri("/api/v1/market/reservations/{reservationId}", reservationId)
                .retrieve()
                .toEntity(ReservationStatusResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReservationResponse> getActiveReservation(UUID traitId, String walletAddress, String assetId) {
        log.debug("Calling getActiveReservation: traitId={}, wallet={}, asset={}", traitId, walletAddress, assetId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/market/reservations/active")
                        .queryParam("traitId", traitId)
                        .queryParam("walletAddress", walletAddress)
                        .queryParam("assetId", assetId)
                        .build())
                .retrieve()
                .toEntity(ReservationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ReservationResponse> cancelReservation(UUID reservationId) {
        log.debug("Calling cancelReservation: reservationId={}", reservationId);

        return webClient.delete()
                .uri("/api/v1/market/reservations/{reservationId}", reservationId)
                .retrieve()
                .toEntity(ReservationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<InventoryResponse> getInventory(UUID traitId) {
        log.debug("Calling getInventory: traitId={}", traitId);

        return webClient.get()
                .uri("/api/v1/market/inventory/{traitId}", traitId)
                .retrieve()
                .toEntity(InventoryResponse.class)
                .block();
    }

    // ==================== Transactions ====================

    @Override
    public ResponseEntity<BuildTransactionResponse> buildTransaction(BuildTransactionRequest request) {
        log.debug("Calling buildTransaction: reservationId={}", request.reservationId());

        return webClient.post()
                .uri("/api/v1/market/transactions/build")
                .bodyValue(request)
                .retrieve()
                .toEntity(BuildTransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<SubmitTransactionResponse> submitTransaction(SubmitTransactionRequest request) {
        log.debug("Calling submitTransaction: bundleId={}", request.bundleId());

        return webClient.post()
                .uri("/api/v1/market/transactions/submit")
                .bodyValue(request)
                .retrieve()
                .toEntity(SubmitTransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransactionStatusResponse> getTransactionStatus(String signature) {
        log.debug("Calling getTransactionStatus: signature={}", signature);

        return webClient.get()
                .uri("/api/v1/market/transactions/{signature}/status", signature)
                .retrieve()
                .toEntity(TransactionStatusResponse.class)
                .block();
    }

    // ==================== Purchases ====================

    @Override
    public ResponseEntity<PurchaseResponse> getPurchase(UUID purchaseId) {
        log.debug("Calling getPurchase: purchaseId={}", purchaseId);

        return webClient.get()
                .uri("/api/v1/market/purchases/{purchaseId}", purchaseId)
                .retrieve()
                .toEntity(PurchaseResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PurchaseResponse> confirmPurchase(ConfirmationRequest request) {
        log.debug("Calling confirmPurchase: txSignature={}", request.txSignature());

        return webClient.post()
                .uri("/api/v1/market/purchases/confirmations")
                .bodyValue(request)
                .retrieve()
                .toEntity(PurchaseResponse.class)
                .block();
    }

    // ==================== Gift Balances ====================

    @Override
    public ResponseEntity<GiftBalanceResponse> getGiftBalance(String walletAddress, UUID traitId) {
        log.debug("Calling getGiftBalance: wallet={}, traitId={}", walletAddress, traitId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/market/gifts")
                        .queryParam("walletAddress", walletAddress)
                        .queryParam("traitId", traitId)
                        .build())
                .retrieve()
                .toEntity(GiftBalanceResponse.class)
                .block();
    }

    // ==================== Metadata ====================

    @Override
    public ResponseEntity<AssetMetadataResponse> getMetadata(String assetId, UUID traitId) {
        log.debug("Calling getMetadata: assetId={}, traitId={}", assetId, traitId);

        return webClient.get()
                .uri("/api/v1/market/metadata/{assetId}/{traitId}.json", assetId, traitId)
                .retrieve()
                .toEntity(AssetMetadataResponse.class)
                .block();
    }
}

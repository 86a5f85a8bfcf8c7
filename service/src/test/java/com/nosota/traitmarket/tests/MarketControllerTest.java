package com.nosota.traitmarket.tests;

import com.nosota.traitmarket.TestBase;
import com.nosota.traitmarket.api.model.PaymentMethod;
import com.nosota.traitmarket.api.model.PurchaseStatus;
import com.nosota.traitmarket.api.model.ReservationStatus;
import com.nosota.traitmarket.api.request.BuildTransactionRequest;
import com.nosota.traitmarket.api.request.ConfirmationRequest;
import com.nosota.traitmarket.api.request.ForceCleanupRequest;
import com.nosota.traitmarket.api.request.GrantGiftRequest;
import com.nosota.traitmarket.api.request.ReserveRequest;
import com.nosota.traitmarket.api.request.SubmitTransactionRequest;
import com.nosota.traitmarket.api.response.AssetMetadataResponse;
import com.nosota.traitmarket.api.response.BuildTransactionResponse;
import com.nosota.traitmarket.api.response.CleanupResponse;
import com.nosota.traitmarket.api.response.GiftBalanceResponse;
import com.nosota.traitmarket.api.response.InventoryResponse;
import com.nosota.traitmarket.api.response.PurchaseResponse;
import com.nosota.traitmarket.api.response.ReservationResponse;
import com.nosota.traitmarket.api.response.ReservationStatusResponse;
import com.nosota.traitmarket.api.response.SubmitTransactionResponse;
import com.nosota.traitmarket.dto.AssetRecord;
import com.nosota.traitmarket.dto.BuiltTransaction;
import com.nosota.traitmarket.ledger.MetadataUpdateInstruction;
import com.nosota.traitmarket.model.Purchase;
import com.nosota.traitmarket.model.Reservation;
import com.nosota.traitmarket.model.Trait;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigInteger;
import java.security.KeyPair;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for MarketController and MarketAdminController via REST API with MockMvc.
 *
 * <p>Covers the checkout endpoints end to end, the admin endpoints and the mapping of
 * domain errors to HTTP statuses.
 */
public class MarketControllerTest extends TestBase {

    private static final BigInteger PRICE = BigInteger.valueOf(100_000_000L);

    // ==================== Reservations ====================

    @Test
    void reserve_WhenUnitAvailable_ShouldReturnCreated() throws Exception {
        Trait trait = createTrait(3, PRICE);
        ReserveRequest request = new ReserveRequest(trait.getId(), addressOf(newWallet()), newAsset());

        MvcResult result = mockMvc.perform(post("/api/v1/market/reservations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("RESERVED"))
                .andReturn();

        ReservationResponse reservation = read(result, ReservationResponse.class);
        assertThat(reservation.traitId()).isEqualTo(trait.getId());
        assertThat(reservation.expiresAt()).isAfter(reservation.createdAt());
    }

    @Test
    void reserve_WhenSoldOut_ShouldReturnConflict() throws Exception {
        Trait trait = createTrait(1, PRICE);
        reservationService.reserve(trait.getId(), addressOf(newWallet()), newAsset());
        ReserveRequest request = new ReserveRequest(trait.getId(), addressOf(newWallet()), newAsset());

        mockMvc.perform(post("/api/v1/market/reservations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Out Of Stock"))
                .andExpect(jsonPath("$.message").value("This trait is no longer available"))
                .andExpect(jsonPath("$.path").value("/api/v1/market/reservations"));
    }

    @Test
    void reserve_WhenWalletMalformed_ShouldReturnBadRequest() throws Exception {
        Trait trait = createTrait(1, PRICE);
        ReserveRequest request = new ReserveRequest(trait.getId(), "0xNotBase58", newAsset());

        mockMvc.perform(post("/api/v1/market/reservations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getReservation_WhenHeld_ShouldReportTimeRemaining() throws Exception {
        Trait trait = createTrait(1, PRICE);
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(newWallet()), newAsset());

        MvcResult result = mockMvc.perform(get("/api/v1/market/reservations/{reservationId}", reservation.getId()))
                .andExpect(status().isOk())
                .andReturn();

        ReservationStatusResponse response = read(result, ReservationStatusResponse.class);
        assertThat(response.expired()).isFalse();
        assertThat(response.timeRemainingSeconds()).isPositive();
        assertThat(response.reservation().reservationId()).isEqualTo(reservation.getId());
    }

    @Test
    void getActiveReservation_WhenNoneHeld_ShouldReturnNotFound() throws Exception {
        Trait trait = createTrait(1, PRICE);

        mockMvc.perform(get("/api/v1/market/reservations/active")
                        .param("traitId", trait.getId().toString())
                        .param("walletAddress", addressOf(newWallet()))
                        .param("assetId", newAsset()))
                .andExpect(status().isNotFound());
    }

    @Test
    void cancelReservation_WhenHeld_ShouldReleaseUnit() throws Exception {
        Trait trait = createTrait(1, PRICE);
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(newWallet()), newAsset());

        mockMvc.perform(delete("/api/v1/market/reservations/{reservationId}", reservation.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(ReservationStatus.CANCELLED.name()));

        MvcResult result = mockMvc.perform(get("/api/v1/market/inventory/{traitId}", trait.getId()))
                .andExpect(status().isOk())
                .andReturn();
        InventoryResponse inventory = read(result, InventoryResponse.class);
        assertThat(inventory.available()).isEqualTo(1L);
        assertThat(inventory.activeReservations()).isZero();
    }

    // ==================== Checkout ====================

    @Test
    void checkout_WhenSignedByBuyer_ShouldFulfillPurchase() throws Exception {
        Trait trait = createTrait(2, PRICE);
        KeyPair wallet = newWallet();
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(wallet), newAsset());

        MvcResult buildResult = mockMvc.perform(post("/api/v1/market/transactions/build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new BuildTransactionRequest(reservation.getId()))))
                .andExpect(status().isOk())
                .andReturn();
        BuildTransactionResponse built = read(buildResult, BuildTransactionResponse.class);

        assertThat(built.paymentMethod()).isEqualTo(PaymentMethod.NATIVE);
        assertThat(built.priceAmount()).isEqualTo(PRICE);
        assertThat(built.hasPaymentInstruction()).isTrue();
        assertThat(built.hasUpdateInstruction()).isTrue();
        assertThat(built.requiredSignatures()).containsExactly(addressOf(wallet));

        String signature = sign(wallet, built.serializedTransaction());
        MvcResult submitResult = mockMvc.perform(post("/api/v1/market/transactions/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SubmitTransactionRequest(built.bundleId(), signature))))
                .andExpect(status().isOk())
                .andReturn();
        SubmitTransactionResponse submitted = read(submitResult, SubmitTransactionResponse.class);

        assertThat(submitted.status()).isEqualTo(PurchaseStatus.FULFILLED);
        assertThat(submitted.txSignature()).isEqualTo(signature);
        assertThat(submitted.paymentExecuted()).isTrue();
        assertThat(submitted.updateExecuted()).isTrue();

        mockMvc.perform(get("/api/v1/market/purchases/{purchaseId}", built.purchaseId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FULFILLED"))
                .andExpect(jsonPath("$.txSignature").value(signature));

        mockMvc.perform(get("/api/v1/market/transactions/{signature}/status", signature))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmed").value(true));
    }

    @Test
    void submit_WhenConfirmationWithheld_ShouldReturnAccepted() throws Exception {
        Trait trait = createTrait(2, PRICE);
        KeyPair wallet = newWallet();
        ledger.withholdConfirmations();
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(wallet), newAsset());
        BuiltTransaction built = purchaseOrchestrator.buildTransaction(reservation.getId());
        String signature = sign(wallet, built.serializedMessage());

        mockMvc.perform(post("/api/v1/market/transactions/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new SubmitTransactionRequest(built.bundle().id(), signature))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("TX_BUILT"));

        ledger.confirm(signature);

        MvcResult result = mockMvc.perform(post("/api/v1/market/purchases/confirmations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ConfirmationRequest(signature))))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(read(result, PurchaseResponse.class).status()).isEqualTo(PurchaseStatus.FULFILLED);
    }

    @Test
    void build_WhenAssetTransferred_ShouldReturnForbidden() throws Exception {
        Trait trait = createTrait(2, PRICE);
        String wallet = addressOf(newWallet());
        String asset = newAsset();
        Reservation reservation = reservationService.reserve(trait.getId(), wallet, asset);
        ownershipVerifier.revoke(wallet, asset);

        mockMvc.perform(post("/api/v1/market/transactions/build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new BuildTransactionRequest(reservation.getId()))))
                .andExpect(status().isForbidden());
    }

    @Test
    void build_WhenReservationExpired_ShouldReturnGone() throws Exception {
        Trait trait = createTrait(2, PRICE);
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(newWallet()), newAsset());
        reservationCleanupService.forceExpire(List.of(reservation.getId()));

        mockMvc.perform(post("/api/v1/market/transactions/build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new BuildTransactionRequest(reservation.getId()))))
                .andExpect(status().isGone());
    }

    @Test
    void submit_WhenBroadcastKeepsFailing_ShouldReturnServiceUnavailable() throws Exception {
        Trait trait = createTrait(2, PRICE);
        KeyPair wallet = newWallet();
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(wallet), newAsset());
        BuiltTransaction built = purchaseOrchestrator.buildTransaction(reservation.getId());
        ledger.failNextBroadcasts(10);

        mockMvc.perform(post("/api/v1/market/transactions/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SubmitTransactionRequest(built.bundle().id(), sign(wallet, built.serializedMessage())))))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void confirm_WhenSignatureUnknown_ShouldReturnNotFound() throws Exception {
        String unknown = sign(newWallet(), "AAAA");

        mockMvc.perform(post("/api/v1/market/purchases/confirmations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ConfirmationRequest(unknown))))
                .andExpect(status().isNotFound());
    }

    @Test
    void anyRequest_ShouldEchoCorrelationId() throws Exception {
        mockMvc.perform(get("/api/v1/market/purchases/{purchaseId}", UUID.randomUUID())
                        .header("X-Correlation-Id", "test-correlation"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Correlation-Id", "test-correlation"));
    }

    // ==================== Gifts & Admin ====================

    @Test
    void grantGift_ThenGetGiftBalance_ShouldReturnQuantity() throws Exception {
        Trait trait = createTrait(null, PRICE);
        String wallet = addressOf(newWallet());

        mockMvc.perform(get("/api/v1/market/gifts")
                        .param("walletAddress", wallet)
                        .param("traitId", trait.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.qtyAvailable").value(0));

        mockMvc.perform(post("/api/v1/admin/gifts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new GrantGiftRequest(wallet, trait.getId(), 3))))
                .andExpect(status().isOk());

        MvcResult result = mockMvc.perform(get("/api/v1/market/gifts")
                        .param("walletAddress", wallet)
                        .param("traitId", trait.getId().toString()))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(read(result, GiftBalanceResponse.class).qtyAvailable()).isEqualTo(3);
    }

    @Test
    void grantGift_WhenQuantityNotPositive_ShouldReturnBadRequest() throws Exception {
        Trait trait = createTrait(null, PRICE);

        mockMvc.perform(post("/api/v1/admin/gifts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new GrantGiftRequest(addressOf(newWallet()), trait.getId(), 0))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void forceCleanup_WhenHoldLive_ShouldExpireIt() throws Exception {
        Trait trait = createTrait(2, PRICE);
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(newWallet()), newAsset());

        MvcResult result = mockMvc.perform(post("/api/v1/admin/reservations/cleanup/force")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ForceCleanupRequest(List.of(reservation.getId())))))
                .andExpect(status().isOk())
                .andReturn();

        assertThat(read(result, CleanupResponse.class).expiredCount()).isEqualTo(1);
        assertThat(reservationService.getReservation(reservation.getId()).getStatus())
                .isEqualTo(ReservationStatus.EXPIRED);
    }

    @Test
    void cleanup_ShouldReturnExpiredCount() throws Exception {
        mockMvc.perform(post("/api/v1/admin/reservations/cleanup"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiredCount").isNumber());
    }

    @Test
    void reconcile_WhenPurchaseUnsubmitted_ShouldLeaveItBuilt() throws Exception {
        Trait trait = createTrait(2, PRICE);
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(newWallet()), newAsset());
        BuiltTransaction built = purchaseOrchestrator.buildTransaction(reservation.getId());

        mockMvc.perform(post("/api/v1/admin/purchases/{purchaseId}/reconcile", built.purchase().getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("TX_BUILT"));

        mockMvc.perform(get("/api/v1/admin/purchases/pending").param("olderThanMinutes", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    // ==================== Metadata ====================

    @Test
    void getMetadata_AfterBuild_ShouldServeAttributesWithTraitApplied() throws Exception {
        Trait trait = createTrait(2, PRICE);
        String wallet = addressOf(newWallet());
        String asset = newAsset();
        assetIndex.register(new AssetRecord(asset, wallet, "Cat #7", "A cat", "https://images.test/cat7.png",
                "https://cats.test/7", "https://old.test/7.json", List.of(
                        new AssetMetadataResponse.Attribute("Background", "Blue"),
                        new AssetMetadataResponse.Attribute("Eyes", "Laser"))));
        Reservation reservation = reservationService.reserve(trait.getId(), wallet, asset);

        BuiltTransaction built = purchaseOrchestrator.buildTransaction(reservation.getId());

        MetadataUpdateInstruction update = built.bundle().instructions().stream()
                .filter(MetadataUpdateInstruction.class::isInstance)
                .map(MetadataUpdateInstruction.class::cast)
                .findFirst()
                .orElseThrow();
        assertThat(update.newUri()).isEqualTo("https://metadata.test/assets/" + asset + "/" + trait.getId() + ".json");

        mockMvc.perform(get("/api/v1/market/metadata/{assetId}/{traitId}.json", asset, trait.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Cat #7"))
                .andExpect(jsonPath("$.image").value("https://images.test/cat7.png"))
                .andExpect(jsonPath("$.external_url").value("https://cats.test/7"))
                .andExpect(jsonPath("$.attributes.length()").value(2))
                .andExpect(jsonPath("$.attributes[0].trait_type").value("background"))
                .andExpect(jsonPath("$.attributes[0].value").value(trait.getName()))
                .andExpect(jsonPath("$.attributes[1].trait_type").value("Eyes"))
                .andExpect(jsonPath("$.attributes[1].value").value("Laser"))
                .andExpect(jsonPath("$.properties.category").value("image"));
    }

    @Test
    void getMetadata_WhenNothingPublished_ShouldReturnNotFound() throws Exception {
        Trait trait = createTrait(2, PRICE);

        mockMvc.perform(get("/api/v1/market/metadata/{assetId}/{traitId}.json", newAsset(), trait.getId()))
                .andExpect(status().isNotFound());
    }

    @Test
    void build_WhenAssetUnknownToIndex_ShouldReturnNotFoundAndKeepPurchaseOpen() throws Exception {
        Trait trait = createTrait(2, PRICE);
        String asset = newAsset();
        Reservation reservation = reservationService.reserve(trait.getId(), addressOf(newWallet()), asset);
        assetIndex.remove(asset);

        mockMvc.perform(post("/api/v1/market/transactions/build")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new BuildTransactionRequest(reservation.getId()))))
                .andExpect(status().isNotFound());

        Purchase open = purchaseService.findOpenForReservation(reservation.getId()).orElseThrow();
        assertThat(open.getStatus()).isEqualTo(PurchaseStatus.CREATED);
    }

    private <T> T read(MvcResult result, Class<T> type) throws Exception {
        return objectMapper.readValue(result.getResponse().getContentAsString(), type);
    }
}

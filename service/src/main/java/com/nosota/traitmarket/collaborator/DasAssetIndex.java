package com.nosota.traitmarket.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.nosota.traitmarket.api.response.AssetMetadataResponse;
import com.nosota.traitmarket.dto.AssetRecord;
import com.nosota.traitmarket.error.BroadcastException;
import com.nosota.traitmarket.error.MarketException;
import com.nosota.traitmarket.ledger.JsonRpcRequest;
import com.nosota.traitmarket.ledger.JsonRpcResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Digital Asset Standard (DAS) index client using {@code getAsset}.
 *
 * <p>An unknown asset (null result, or an error saying it was not found) completes empty.
 * Any other RPC error, HTTP failure or timeout is a {@link BroadcastException}.
 */
@Component
@Slf4j
public class DasAssetIndex implements AssetIndex {

    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public DasAssetIndex(@Qualifier("assetIndexWebClient") WebClient webClient,
                         @Value("${market.ledger.request-timeout-ms:10000}") long timeoutMs) {
        this.webClient = webClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<AssetRecord> getAsset(String assetId) {
        JsonRpcRequest request = JsonRpcRequest.of(requestIds.incrementAndGet(), "getAsset", Map.of("id", assetId));
        log.debug("Looking up asset {}", assetId);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder.build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonRpcResponse.class)
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof MarketException),
                        e -> new BroadcastException("Asset index unavailable: " + e.getMessage(), e))
                .flatMap(response -> {
                    JsonRpcResponse.Error error = response.error();
                    if (error != null) {
                        if (isNotFound(error)) {
                            log.info("Asset {} not known to the index: {}", assetId, error.message());
                            return Mono.empty();
                        }
                        return Mono.error(new BroadcastException(
                                "Asset index error " + error.code() + ": " + error.message()));
                    }
                    if (response.result() == null || response.result().isNull()) {
                        log.info("Asset {} not known to the index: empty result", assetId);
                        return Mono.empty();
                    }
                    return Mono.just(toRecord(assetId, response.result()));
                });
    }

    private static boolean isNotFound(JsonRpcResponse.Error error) {
        return error.message() != null && error.message().toLowerCase(Locale.ROOT).contains("not found");
    }

    static AssetRecord toRecord(String assetId, JsonNode asset) {
        JsonNode content = asset.path("content");
        JsonNode metadata = content.path("metadata");
        JsonNode links = content.path("links");

        List<AssetMetadataResponse.Attribute> attributes = new ArrayList<>();
        for (JsonNode attribute : metadata.path("attributes")) {
            String traitType = text(attribute.path("trait_type"));
            if (traitType != null) {
                attributes.add(new AssetMetadataResponse.Attribute(traitType, text(attribute.path("value"))));
            }
        }

        return new AssetRecord(
                asset.path("id").asText(assetId),
                text(asset.path("ownership").path("owner")),
                text(metadata.path("name")),
                text(metadata.path("description")),
                text(links.path("image")),
                text(links.path("external_url")),
                text(content.path("json_uri")),
                attributes);
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}

package com.nosota.traitmarket.collaborator;

import com.nosota.traitmarket.api.response.AssetMetadataResponse;
import com.nosota.traitmarket.error.BroadcastException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Asset parsing and error mapping of the DAS client against canned index answers.
 */
class DasAssetIndexTest {

    private static final String ASSET = "AssetXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgA";
    private static final String OWNER = "7xKXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgAsU";

    private DasAssetIndex indexAnswering(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
        return new DasAssetIndex(webClient, 5000);
    }

    private DasAssetIndex indexAnswering(String body) {
        return indexAnswering(HttpStatus.OK, body);
    }

    @Test
    void getAsset_parsesOwnerContentAndAttributes() {
        DasAssetIndex index = indexAnswering("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"id\":\"" + ASSET + "\","
                + "\"ownership\":{\"owner\":\"" + OWNER + "\",\"frozen\":false},"
                + "\"content\":{\"json_uri\":\"https://meta.test/1.json\","
                + "\"metadata\":{\"name\":\"Cat #1\",\"description\":\"A cat\",\"attributes\":["
                + "{\"trait_type\":\"Background\",\"value\":\"Blue\"},{\"trait_type\":\"Level\",\"value\":3},{\"value\":\"orphan\"}]},"
                + "\"links\":{\"image\":\"https://img.test/1.png\",\"external_url\":\"https://cats.test/1\"}}}}");

        StepVerifier.create(index.getAsset(ASSET))
                .assertNext(asset -> {
                    assertThat(asset.id()).isEqualTo(ASSET);
                    assertThat(asset.owner()).isEqualTo(OWNER);
                    assertThat(asset.name()).isEqualTo("Cat #1");
                    assertThat(asset.description()).isEqualTo("A cat");
                    assertThat(asset.image()).isEqualTo("https://img.test/1.png");
                    assertThat(asset.externalUrl()).isEqualTo("https://cats.test/1");
                    assertThat(asset.jsonUri()).isEqualTo("https://meta.test/1.json");
                    assertThat(asset.attributes()).containsExactly(
                            new AssetMetadataResponse.Attribute("Background", "Blue"),
                            new AssetMetadataResponse.Attribute("Level", "3"));
                })
                .verifyComplete();
    }

    @Test
    void getAsset_nullResult_isEmpty() {
        StepVerifier.create(indexAnswering("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}").getAsset(ASSET))
                .verifyComplete();
    }

    @Test
    void getAsset_notFoundError_isEmpty() {
        DasAssetIndex index = indexAnswering(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"Asset Not Found\"}}");

        StepVerifier.create(index.getAsset(ASSET))
                .verifyComplete();
    }

    @Test
    void getAsset_otherRpcError_isBroadcastError() {
        DasAssetIndex index = indexAnswering(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32603,\"message\":\"Internal error\"}}");

        StepVerifier.create(index.getAsset(ASSET))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(BroadcastException.class)
                        .hasMessageContaining("-32603"))
                .verify();
    }

    @Test
    void getAsset_rateLimited_isBroadcastError() {
        StepVerifier.create(indexAnswering(HttpStatus.TOO_MANY_REQUESTS, "{}").getAsset(ASSET))
                .expectError(BroadcastException.class)
                .verify();
    }
}

package com.nosota.traitmarket.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.nosota.traitmarket.error.BroadcastException;
import com.nosota.traitmarket.error.MarketException;
import com.nosota.traitmarket.error.SimulationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 implementation of {@link LedgerRpcClient} for a Solana-compatible node.
 *
 * <p>This client is NOT a Spring @Component; it is registered in {@code LedgerClientConfig}.
 */
@RequiredArgsConstructor
@Slf4j
public class SolanaRpcLedgerClient implements LedgerRpcClient {

    // Node rejected the transaction in its preflight simulation
    private static final int PREFLIGHT_FAILURE = -32002;

    private static final String COMMITMENT = "confirmed";

    private final WebClient webClient;
    private final Duration requestTimeout;
    private final AtomicLong requestIds = new AtomicLong();

    @Override
    public Mono<String> broadcast(String encodedTransaction) {
        Map<String, Object> config = Map.of(
                "encoding", "base64",
                "preflightCommitment", COMMITMENT);

        return call("sendTransaction", List.of(encodedTransaction, config))
                .map(JsonNode::asText)
                .doOnNext(signature -> log.info("Transaction broadcast: signature={}", signature));
    }

    @Override
    public Mono<SimulationOutcome> simulate(String encodedTransaction) {
        Map<String, Object> config = Map.of(
                "encoding", "base64",
                "sigVerify", false,
                "replaceRecentBlockhash", true,
                "commitment", COMMITMENT);

        return call("simulateTransaction", List.of(encodedTransaction, config))
                .map(result -> {
                    JsonNode value = result.path("value");
                    JsonNode err = value.path("err");
                    boolean success = err.isMissingNode() || err.isNull();

                    Integer failedIndex = null;
                    JsonNode instructionError = err.path("InstructionError");
                    if (instructionError.isArray() && instructionError.path(0).isInt()) {
                        failedIndex = instructionError.path(0).asInt();
                    }

                    List<String> logs = new ArrayList<>();
                    value.path("logs").forEach(line -> logs.add(line.asText()));

                    Long units = value.hasNonNull("unitsConsumed") ? value.get("unitsConsumed").asLong() : null;

                    return new SimulationOutcome(success, success ? null : err.toString(), failedIndex, logs, units);
                });
    }

    @Override
    public Mono<SignatureStatus> getSignatureStatus(String signature) {
        Map<String, Object> config = Map.of("searchTransactionHistory", true);

        return call("getSignatureStatuses", List.of(List.of(signature), config))
                .map(result -> {
                    JsonNode status = result.path("value").path(0);
                    if (status.isMissingNode() || status.isNull()) {
                        return SignatureStatus.notFound(signature);
                    }
                    String confirmationStatus = status.path("confirmationStatus").asText("");
                    boolean finalized = "finalized".equals(confirmationStatus);
                    boolean confirmed = finalized || "confirmed".equals(confirmationStatus);
                    JsonNode err = status.path("err");
                    String error = err.isMissingNode() || err.isNull() ? null : err.toString();
                    return new SignatureStatus(signature, true, confirmed, finalized, error);
                });
    }

    @Override
    public Mono<AccountState> getAccountState(String address) {
        Map<String, Object> config = Map.of("encoding", "base64", "commitment", COMMITMENT);

        return call("getAccountInfo", List.of(address, config))
                .map(result -> {
                    JsonNode value = result.path("value");
                    if (value.isMissingNode() || value.isNull()) {
                        return AccountState.missing(address);
                    }
                    return new AccountState(address, true, value.path("lamports").asLong(), value.path("owner").asText(null));
                });
    }

    @Override
    public Mono<String> getLatestBlockhash() {
        return call("getLatestBlockhash", List.of(Map.of("commitment", COMMITMENT)))
                .map(result -> result.path("value").path("blockhash").asText())
                .filter(blockhash -> !blockhash.isEmpty())
                .switchIfEmpty(Mono.error(new BroadcastException("Ledger returned no blockhash")));
    }

    @Override
    public Mono<String> findTokenAccount(String owner, String mint) {
        return call("getTokenAccountsByOwner", List.of(owner, Map.of("mint", mint), Map.of("encoding", "jsonParsed")))
                .flatMap(result -> {
                    JsonNode first = result.path("value").path(0);
                    if (first.isMissingNode() || first.isNull()) {
                        return Mono.empty();
                    }
                    return Mono.just(first.path("pubkey").asText());
                });
    }

    private Mono<JsonNode> call(String method, List<?> params) {
        JsonRpcRequest request = JsonRpcRequest.of(requestIds.incrementAndGet(), method, params);
        log.debug("Calling ledger RPC: method={}, id={}", method, request.id());

        return webClient.post()
                .uri(uriBuilder -> uriBuilder.build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonRpcResponse.class)
                .timeout(requestTimeout)
                .onErrorMap(e -> !(e instanceof MarketException),
                        e -> new BroadcastException("Ledger RPC " + method + " failed: " + e.getMessage(), e))
                .flatMap(response -> {
                    if (response.error() != null) {
                        return Mono.error(toException(method, response.error()));
                    }
                    if (response.result() == null) {
                        return Mono.error(new BroadcastException("Ledger RPC " + method + " returned no result"));
                    }
                    return Mono.just(response.result());
                });
    }

    private MarketException toException(String method, JsonRpcResponse.Error error) {
        log.warn("Ledger RPC error: method={}, code={}, message={}", method, error.code(), error.message());
        if ("sendTransaction".equals(method) && error.code() == PREFLIGHT_FAILURE) {
            return new SimulationException("Transaction rejected by ledger: " + error.message(), false, false);
        }
        return new BroadcastException("Ledger RPC " + method + " error " + error.code() + ": " + error.message());
    }
}

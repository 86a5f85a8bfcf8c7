package com.nosota.traitmarket.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 response envelope. Exactly one of {@code result} and {@code error} is set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        Long id,
        JsonNode result,
        Error error
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Error(int code, String message, JsonNode data) {
    }
}

package com.nosota.traitmarket.ledger;

/**
 * JSON-RPC 2.0 request envelope.
 *
 * @param params  Positional parameters (a list) or named parameters (a map)
 */
public record JsonRpcRequest(
        String jsonrpc,
        long id,
        String method,
        Object params
) {

    public static JsonRpcRequest of(long id, String method, Object params) {
        return new JsonRpcRequest("2.0", id, method, params);
    }
}

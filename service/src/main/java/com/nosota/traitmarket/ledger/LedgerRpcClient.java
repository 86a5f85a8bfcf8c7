package com.nosota.traitmarket.ledger;

import reactor.core.publisher.Mono;

/**
 * Remote ledger node. Every call is a non-blocking network request.
 *
 * <p>Transport and RPC failures are signalled as {@code BroadcastException};
 * a broadcast rejected by the node's preflight check is signalled as {@code SimulationException}.
 */
public interface LedgerRpcClient {

    /**
     * Sends a fully signed transaction.
     *
     * @param encodedTransaction Wire encoding of the signed bundle
     * @return Transaction signature
     */
    Mono<String> broadcast(String encodedTransaction);

    /**
     * Dry-runs a transaction against current state without committing it.
     * Signatures are not verified.
     */
    Mono<SimulationOutcome> simulate(String encodedTransaction);

    Mono<SignatureStatus> getSignatureStatus(String signature);

    Mono<AccountState> getAccountState(String address);

    Mono<String> getLatestBlockhash();

    /**
     * Finds the token account holding {@code mint} for {@code owner}.
     *
     * @return Token account address, or an empty Mono when the owner has none
     */
    Mono<String> findTokenAccount(String owner, String mint);
}

package com.nosota.traitmarket.config;

import com.nosota.traitmarket.ledger.LedgerRpcClient;
import com.nosota.traitmarket.ledger.SolanaRpcLedgerClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the WebClient-based ledger collaborators.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   ledger:
 *     rpc-url: https://api.devnet.solana.com
 *     request-timeout-ms: 10000
 *   ownership:
 *     das-url: https://api.devnet.solana.com   # asset index (DAS) endpoint
 * </pre>
 */
@Configuration
public class LedgerClientConfig {

    @Bean
    public LedgerRpcClient ledgerRpcClient(WebClient.Builder builder,
                                           @Value("${market.ledger.rpc-url:http://localhost:8899}") String rpcUrl,
                                           @Value("${market.ledger.request-timeout-ms:10000}") long timeoutMs) {
        return new SolanaRpcLedgerClient(builder.clone().baseUrl(rpcUrl).build(), Duration.ofMillis(timeoutMs));
    }

    @Bean
    public WebClient assetIndexWebClient(WebClient.Builder builder,
                                         @Value("${market.ownership.das-url:${market.ledger.rpc-url:http://localhost:8899}}") String dasUrl) {
        return builder.clone().baseUrl(dasUrl).build();
    }
}

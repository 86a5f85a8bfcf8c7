package com.nosota.traitmarket.service;

import com.nosota.traitmarket.error.BroadcastException;
import com.nosota.traitmarket.error.ConfirmationTimeoutException;
import com.nosota.traitmarket.error.MarketException;
import com.nosota.traitmarket.error.SimulationException;
import com.nosota.traitmarket.error.TransactionBuildException;
import com.nosota.traitmarket.error.ValidationException;
import com.nosota.traitmarket.ledger.AccountState;
import com.nosota.traitmarket.ledger.BundleValidation;
import com.nosota.traitmarket.ledger.DelegateSigner;
import com.nosota.traitmarket.ledger.InstructionCategory;
import com.nosota.traitmarket.ledger.LedgerInstruction;
import com.nosota.traitmarket.ledger.LedgerKeys;
import com.nosota.traitmarket.ledger.LedgerRpcClient;
import com.nosota.traitmarket.ledger.MetadataUpdateInstruction;
import com.nosota.traitmarket.ledger.NativeTransferInstruction;
import com.nosota.traitmarket.ledger.SignatureStatus;
import com.nosota.traitmarket.ledger.SimulationOutcome;
import com.nosota.traitmarket.ledger.SimulationResult;
import com.nosota.traitmarket.ledger.SubmitResult;
import com.nosota.traitmarket.ledger.TokenTransferInstruction;
import com.nosota.traitmarket.ledger.TransactionBundle;
import com.nosota.traitmarket.ledger.TransactionCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Atomic transaction builder.
 *
 * <p>A purchase settles in ONE ledger transaction holding both legs:
 * <ul>
 *   <li>payment: native or token transfer from the buyer to the treasury</li>
 *   <li>metadata update: points the asset at the metadata of the applied trait,
 *       authorized by the server's delegate key</li>
 * </ul>
 * The ledger commits or rejects the transaction as a whole, so payment happens if and only if
 * the asset is updated. Gift redemptions carry the metadata update alone.
 *
 * <p>Every ledger call is non-blocking; callers compose the returned {@link Mono}s.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   metadata:
 *     base-uri: http://localhost:8080/api/v1/market/metadata   # served by MarketApi#getMetadata
 *   ledger:
 *     broadcast:
 *       max-attempts: 3
 *       initial-backoff-ms: 500
 *       max-backoff-ms: 5000
 *     confirmation:
 *       poll-interval-ms: 2000
 *       max-retries: 30
 *       timeout-ms: 60000
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionBuilderService {

    private final LedgerRpcClient ledgerRpcClient;
    private final TransactionCodec transactionCodec;
    private final DelegateSigner delegateSigner;

    @Value("${market.metadata.base-uri:http://localhost:8080/api/v1/market/metadata}")
    private String metadataBaseUri;

    @Value("${market.ledger.broadcast.max-attempts:3}")
    private int broadcastMaxAttempts;

    @Value("${market.ledger.broadcast.initial-backoff-ms:500}")
    private long broadcastInitialBackoffMs;

    @Value("${market.ledger.broadcast.max-backoff-ms:5000}")
    private long broadcastMaxBackoffMs;

    @Value("${market.ledger.confirmation.poll-interval-ms:2000}")
    private long confirmationPollIntervalMs;

    @Value("${market.ledger.confirmation.max-retries:30}")
    private int confirmationMaxRetries;

    @Value("${market.ledger.confirmation.timeout-ms:60000}")
    private long confirmationTimeoutMs;

    // ==================== Build ====================

    /**
     * Composes the bundle and applies the delegate signature.
     *
     * @param walletAddress  Buyer wallet; fee payer and payment source
     * @param assetId        Asset receiving the trait
     * @param traitId        Trait being applied
     * @param paymentAmount  Amount in the token's smallest unit; 0 omits the payment leg (gift route)
     * @param tokenMint      Mint of the payment token, null for the native currency
     * @param treasuryWallet Payment destination
     * @return Bundle awaiting the buyer's signature
     */
    public Mono<TransactionBundle> build(String walletAddress,
                                         String assetId,
                                         UUID traitId,
                                         BigInteger paymentAmount,
                                         String tokenMint,
                                         String treasuryWallet) {
        if (paymentAmount == null || paymentAmount.signum() < 0) {
            return Mono.error(new TransactionBuildException("Payment amount must be zero or positive"));
        }

        return Mono.zip(ledgerRpcClient.getLatestBlockhash(),
                        paymentInstruction(walletAddress, paymentAmount, tokenMint, treasuryWallet),
                        ledgerRpcClient.getAccountState(walletAddress))
                .map(tuple -> {
                    requireFunded(tuple.getT3(), tokenMint == null ? paymentAmount : BigInteger.ZERO);

                    List<LedgerInstruction> instructions = new ArrayList<>();
                    tuple.getT2().ifPresent(instructions::add);
                    instructions.add(new MetadataUpdateInstruction(
                            assetId, metadataUri(assetId, traitId), delegateSigner.address()));

                    TransactionBundle bundle = new TransactionBundle(
                            UUID.randomUUID(),
                            walletAddress,
                            tuple.getT1(),
                            instructions,
                            List.of(walletAddress),
                            List.of(delegateSigner.address()),
                            Map.of());

                    String delegateSignature = delegateSigner.sign(transactionCodec.messageBytes(bundle));
                    TransactionBundle signed = bundle.withSignature(delegateSigner.address(), delegateSignature);

                    log.info("Transaction bundle built: id={}, wallet={}, asset={}, trait={}, amount={}, instructions={}",
                            signed.id(), walletAddress, assetId, traitId, paymentAmount, instructions.size());
                    return signed;
                });
    }

    /**
     * The fee payer must exist on the ledger and, for native payments, hold at least the price.
     * Token balances are left to the simulation.
     */
    private static void requireFunded(AccountState payer, BigInteger nativeAmount) {
        if (!payer.exists()) {
            throw new TransactionBuildException("Wallet " + payer.address() + " has no account on the ledger");
        }
        if (BigInteger.valueOf(payer.lamports()).compareTo(nativeAmount) < 0) {
            throw new SimulationException("Insufficient balance: wallet " + payer.address() + " holds "
                    + payer.lamports() + ", price is " + nativeAmount, false, false);
        }
    }

    private Mono<Optional<LedgerInstruction>> paymentInstruction(String walletAddress,
                                                                 BigInteger amount,
                                                                 String tokenMint,
                                                                 String treasuryWallet) {
        if (amount.signum() == 0) {
            return Mono.just(Optional.empty());
        }
        if (tokenMint == null) {
            return Mono.just(Optional.of(new NativeTransferInstruction(walletAddress, treasuryWallet, amount)));
        }

        Mono<String> source = ledgerRpcClient.findTokenAccount(walletAddress, tokenMint)
                .switchIfEmpty(Mono.error(() -> new TransactionBuildException(
                        "Wallet " + walletAddress + " has no token account for mint " + tokenMint)));
        Mono<String> destination = ledgerRpcClient.findTokenAccount(treasuryWallet, tokenMint)
                .switchIfEmpty(Mono.error(() -> new TransactionBuildException(
                        "Treasury " + treasuryWallet + " has no token account for mint " + tokenMint)));

        return Mono.zip(source, destination)
                .map(accounts -> Optional.of(new TokenTransferInstruction(
                        tokenMint, accounts.getT1(), accounts.getT2(), walletAddress, amount)));
    }

    String metadataUri(String assetId, UUID traitId) {
        String base = metadataBaseUri.endsWith("/")
                ? metadataBaseUri.substring(0, metadataBaseUri.length() - 1)
                : metadataBaseUri;
        return base + "/" + assetId + "/" + traitId + ".json";
    }

    // ==================== Validate ====================

    /**
     * Checks that a paid bundle carries both the payment and the metadata-update leg.
     */
    public BundleValidation validate(TransactionBundle bundle) {
        return validate(bundle, true);
    }

    /**
     * Checks the bundle for the legs its settlement route needs.
     *
     * @param bundle          Bundle to check
     * @param paymentRequired true for the paid route; false for gift redemptions, which must
     *                        carry the metadata update alone
     */
    public BundleValidation validate(TransactionBundle bundle, boolean paymentRequired) {
        if (bundle == null || bundle.instructions().isEmpty()) {
            return BundleValidation.invalid("Transaction has no instructions", false, false);
        }

        boolean hasPayment = false;
        boolean hasUpdate = false;
        for (LedgerInstruction instruction : bundle.instructions()) {
            switch (instruction.type().category()) {
                case PAYMENT -> hasPayment = true;
                case METADATA_UPDATE -> hasUpdate = true;
            }
        }

        if (paymentRequired && !hasPayment) {
            return BundleValidation.invalid("Transaction is missing the payment instruction", false, hasUpdate);
        }
        if (!paymentRequired && hasPayment) {
            return BundleValidation.invalid("Gift redemption must not carry a payment instruction", true, hasUpdate);
        }
        if (!hasUpdate) {
            return BundleValidation.invalid("Transaction is missing the metadata update instruction", hasPayment, false);
        }
        return BundleValidation.ok(hasPayment, true);
    }

    // ==================== Simulate ====================

    /**
     * Dry-runs the bundle without committing it and attributes a failure to the leg that caused it.
     * Instructions before the failing one count as executed.
     */
    public Mono<SimulationResult> simulate(TransactionBundle bundle) {
        return Mono.fromCallable(() -> transactionCodec.encodeTransaction(bundle))
                .flatMap(ledgerRpcClient::simulate)
                .map(outcome -> attribute(bundle, outcome));
    }

    SimulationResult attribute(TransactionBundle bundle, SimulationOutcome outcome) {
        boolean hasPayment = bundle.contains(InstructionCategory.PAYMENT);
        boolean hasUpdate = bundle.contains(InstructionCategory.METADATA_UPDATE);

        if (outcome.success()) {
            log.debug("Simulation succeeded: bundle={}, units={}", bundle.id(), outcome.unitsConsumed());
            return new SimulationResult(true, hasPayment, hasUpdate, null);
        }

        Integer failedIndex = outcome.failedInstructionIndex();
        boolean paymentExecuted = hasPayment && ranBefore(bundle, InstructionCategory.PAYMENT, failedIndex);
        boolean updateExecuted = hasUpdate && ranBefore(bundle, InstructionCategory.METADATA_UPDATE, failedIndex);

        log.warn("Simulation failed: bundle={}, failedInstruction={}, error={}, logs={}",
                bundle.id(), failedIndex, outcome.error(), outcome.logs());
        return new SimulationResult(false, paymentExecuted, updateExecuted, outcome.error());
    }

    private static boolean ranBefore(TransactionBundle bundle, InstructionCategory category, Integer failedIndex) {
        if (failedIndex == null) {
            return false;
        }
        List<LedgerInstruction> instructions = bundle.instructions();
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i).type().category() == category && i >= failedIndex) {
                return false;
            }
        }
        return true;
    }

    // ==================== Submit ====================

    /**
     * Applies the user's signature and broadcasts the bundle.
     * Broadcast failures are retried with exponential backoff; other errors are not.
     *
     * @return Transaction signature
     * @throws ValidationException if the signature was not made by the fee payer over this bundle
     */
    public Mono<String> broadcast(TransactionBundle bundle, String userSignature) {
        return Mono.fromCallable(() -> sign(bundle, userSignature))
                .flatMap(signed -> {
                    String encoded = transactionCodec.encodeTransaction(signed);
                    return ledgerRpcClient.broadcast(encoded)
                            .doOnError(BroadcastException.class,
                                    e -> log.warn("Broadcast attempt failed for bundle {}: {}", bundle.id(), e.getMessage()))
                            .retryWhen(Retry.backoff(Math.max(0, broadcastMaxAttempts - 1), Duration.ofMillis(broadcastInitialBackoffMs))
                                    .maxBackoff(Duration.ofMillis(broadcastMaxBackoffMs))
                                    .filter(e -> e instanceof BroadcastException)
                                    .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
                })
                .map(signature -> {
                    if (!signature.equals(userSignature)) {
                        log.warn("Ledger reported signature {} for bundle {}, expected {}",
                                signature, bundle.id(), userSignature);
                    }
                    return signature;
                });
    }

    private TransactionBundle sign(TransactionBundle bundle, String userSignature) {
        byte[] message = transactionCodec.messageBytes(bundle);
        if (!LedgerKeys.verify(bundle.feePayer(), message, userSignature)) {
            throw new ValidationException("Signature does not match the transaction or was not made by wallet " + bundle.feePayer());
        }
        TransactionBundle signed = bundle.withSignature(bundle.feePayer(), userSignature);
        if (!signed.isFullySigned()) {
            throw new TransactionBuildException("Transaction " + bundle.id() + " is missing required signatures");
        }
        return signed;
    }

    /**
     * Polls the ledger until the signature is confirmed or observed as failed.
     *
     * <p>Not-yet-observed answers and transient RPC errors are polled again every
     * poll interval, up to the configured number of retries and overall timeout.
     *
     * @throws ConfirmationTimeoutException when neither outcome is observed in time
     */
    public Mono<SignatureStatus> awaitConfirmation(String signature) {
        return Mono.defer(() -> ledgerRpcClient.getSignatureStatus(signature))
                .onErrorResume(BroadcastException.class, e -> {
                    log.warn("Status query for {} failed, polling again: {}", signature, e.getMessage());
                    return Mono.empty();
                })
                .filter(status -> status.confirmed() || status.failed())
                .repeatWhenEmpty(confirmationMaxRetries,
                        attempts -> attempts.delayElements(Duration.ofMillis(confirmationPollIntervalMs)))
                .timeout(Duration.ofMillis(confirmationTimeoutMs))
                .onErrorMap(e -> !(e instanceof MarketException), e -> {
                    log.warn("Confirmation of {} not observed: {}", signature, e.getMessage());
                    return new ConfirmationTimeoutException(signature);
                });
    }

    /**
     * Signs, broadcasts and waits for confirmation. Ledger instruction errors are returned
     * verbatim in {@link SubmitResult#error()}.
     */
    public Mono<SubmitResult> submit(TransactionBundle bundle, String userSignature) {
        return broadcast(bundle, userSignature)
                .flatMap(signature -> awaitConfirmation(signature)
                        .map(status -> toSubmitResult(bundle, status)));
    }

    SubmitResult toSubmitResult(TransactionBundle bundle, SignatureStatus status) {
        boolean success = status.confirmed() && !status.failed();
        return new SubmitResult(
                success,
                status.signature(),
                success && bundle.contains(InstructionCategory.PAYMENT),
                success && bundle.contains(InstructionCategory.METADATA_UPDATE),
                status.error());
    }

    public Mono<SignatureStatus> getStatus(String signature) {
        return ledgerRpcClient.getSignatureStatus(signature);
    }
}

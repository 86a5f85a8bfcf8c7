package com.nosota.traitmarket.ledger;

import com.nosota.traitmarket.error.TransactionBuildException;
import com.nosota.traitmarket.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionCodecTest {

    private static final String TREASURY = "9xQeWvG816bUx9EPjHmaT23yvVM2ZWbrrpZb9PusVFin";
    private static final String ASSET = "AssetXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgA";
    private static final String BLOCKHASH = "GHtXQBsoZHVnNFa9YevAzFr17DJjgHXk3ycTKD5xD3Zi";
    private static final String URI = "https://metadata.test/a.json";

    // header (3) + key count (1) + six keys
    private static final int BLOCKHASH_OFFSET = 4 + 6 * 32;

    private final TransactionCodec codec = new TransactionCodec();

    private KeyPair buyer;
    private KeyPair delegate;
    private String buyerAddress;
    private String delegateAddress;
    private TransactionBundle bundle;

    @BeforeEach
    void setUp() throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(LedgerKeys.ALGORITHM);
        buyer = generator.generateKeyPair();
        delegate = generator.generateKeyPair();
        buyerAddress = LedgerKeys.addressOf(buyer.getPublic());
        delegateAddress = LedgerKeys.addressOf(delegate.getPublic());
        bundle = bundleWith(new NativeTransferInstruction(buyerAddress, TREASURY, BigInteger.valueOf(1_500_000_000L)),
                new MetadataUpdateInstruction(ASSET, URI, delegateAddress));
    }

    private TransactionBundle bundleWith(LedgerInstruction... instructions) {
        return new TransactionBundle(UUID.fromString("6f1c2d3e-4b5a-4c7d-8e9f-0a1b2c3d4e5f"), buyerAddress, BLOCKHASH,
                List.of(instructions), List.of(buyerAddress), List.of(delegateAddress), Map.of());
    }

    private static byte[] key(byte[] message, int index) {
        return Arrays.copyOfRange(message, 4 + index * 32, 4 + (index + 1) * 32);
    }

    @Test
    void messageBytes_ignoreAppliedSignatures() {
        byte[] unsigned = codec.messageBytes(bundle);
        byte[] signed = codec.messageBytes(bundle.withSignature(delegateAddress, "sig1").withSignature(buyerAddress, "sig2"));

        assertThat(signed).isEqualTo(unsigned);
    }

    @Test
    void messageBytes_orderSignersFirstWithFeePayerLeading() {
        byte[] message = codec.messageBytes(bundle);

        // two signers, the delegate read-only; system and asset programs read-only
        assertThat(Arrays.copyOfRange(message, 0, 4)).containsExactly(2, 1, 2, 6);
        assertThat(key(message, 0)).isEqualTo(Base58.decode(buyerAddress));
        assertThat(key(message, 1)).isEqualTo(Base58.decode(delegateAddress));
        assertThat(key(message, 2)).isEqualTo(Base58.decode(TREASURY));
        assertThat(key(message, 3)).isEqualTo(Base58.decode(ASSET));
        assertThat(key(message, 4)).isEqualTo(Base58.decode(NativeTransferInstruction.SYSTEM_PROGRAM_ID));
        assertThat(key(message, 5)).isEqualTo(Base58.decode(MetadataUpdateInstruction.ASSET_PROGRAM_ID));
        assertThat(Arrays.copyOfRange(message, BLOCKHASH_OFFSET, BLOCKHASH_OFFSET + 32)).isEqualTo(Base58.decode(BLOCKHASH));
    }

    @Test
    void messageBytes_compileTransferAndUpdateInstructions() {
        byte[] message = codec.messageBytes(bundle);
        ByteBuffer buffer = ByteBuffer.wrap(message, BLOCKHASH_OFFSET + 32, message.length - BLOCKHASH_OFFSET - 32)
                .order(ByteOrder.LITTLE_ENDIAN);

        assertThat(buffer.get()).isEqualTo((byte) 2);

        // system transfer: program 4, accounts buyer and treasury, data tag 2 then lamports
        assertThat(buffer.get()).isEqualTo((byte) 4);
        assertThat(buffer.get()).isEqualTo((byte) 2);
        assertThat(new byte[]{buffer.get(), buffer.get()}).containsExactly(0, 2);
        assertThat(buffer.get()).isEqualTo((byte) 12);
        assertThat(buffer.getInt()).isEqualTo(2);
        assertThat(buffer.getLong()).isEqualTo(1_500_000_000L);

        // asset update: program 5, accounts asset, collection placeholder, payer, authority, system, log wrapper
        assertThat(buffer.get()).isEqualTo((byte) 5);
        assertThat(buffer.get()).isEqualTo((byte) 6);
        byte[] accounts = new byte[6];
        buffer.get(accounts);
        assertThat(accounts).containsExactly(3, 5, 0, 1, 4, 5);
        byte[] uri = URI.getBytes(StandardCharsets.UTF_8);
        assertThat(buffer.get()).isEqualTo((byte) (8 + uri.length));
        assertThat(buffer.get()).isEqualTo((byte) 15);
        assertThat(buffer.get()).isEqualTo((byte) 0);
        assertThat(buffer.get()).isEqualTo((byte) 1);
        assertThat(buffer.getInt()).isEqualTo(uri.length);
        byte[] encodedUri = new byte[uri.length];
        buffer.get(encodedUri);
        assertThat(new String(encodedUri, StandardCharsets.UTF_8)).isEqualTo(URI);
        assertThat(buffer.get()).isEqualTo((byte) 0);
        assertThat(buffer.hasRemaining()).isFalse();
    }

    @Test
    void messageBytes_tokenTransferSignsWithOwner() {
        String source = "BuyerTokenAccount11111111111111111111111111";
        String destination = "TreasuryTokenAccount11111111111111111111111";
        byte[] message = codec.messageBytes(bundleWith(new TokenTransferInstruction(
                "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v", source, destination, buyerAddress, BigInteger.TEN)));

        // buyer is the only signer; token program is the only read-only account
        assertThat(Arrays.copyOfRange(message, 0, 4)).containsExactly(1, 0, 1, 4);
        assertThat(key(message, 1)).isEqualTo(Base58.decode(source));
        assertThat(key(message, 3)).isEqualTo(Base58.decode(TokenTransferInstruction.TOKEN_PROGRAM_ID));
        int data = 4 + 4 * 32 + 32 + 1 + 1 + 1 + 3 + 1;
        assertThat(message[data]).isEqualTo((byte) 3);
        assertThat(ByteBuffer.wrap(message, data + 1, 8).order(ByteOrder.LITTLE_ENDIAN).getLong()).isEqualTo(10L);
    }

    @Test
    void messageBytes_amountBeyondU64_isRejected() {
        TransactionBundle oversized = bundleWith(
                new NativeTransferInstruction(buyerAddress, TREASURY, new BigInteger("18446744073709551616")),
                new MetadataUpdateInstruction(ASSET, URI, delegateAddress));

        assertThatThrownBy(() -> codec.messageBytes(oversized))
                .isInstanceOf(TransactionBuildException.class)
                .hasMessageContaining("unsigned 64-bit");
    }

    @Test
    void messageBytes_malformedAddress_isRejected() {
        TransactionBundle malformed = bundleWith(new MetadataUpdateInstruction("not-base58-0OIl", URI, delegateAddress));

        assertThatThrownBy(() -> codec.messageBytes(malformed))
                .isInstanceOf(TransactionBuildException.class);
    }

    @Test
    void messageBytes_transactionOverSizeLimit_isRejected() {
        TransactionBundle tooLarge = bundleWith(new MetadataUpdateInstruction(ASSET,
                "https://metadata.test/" + "a".repeat(TransactionCodec.MAX_TRANSACTION_SIZE), delegateAddress));

        assertThatThrownBy(() -> codec.messageBytes(tooLarge))
                .isInstanceOf(TransactionBuildException.class)
                .hasMessageContaining("exceeds");
    }

    @Test
    void transactionBytes_placeSignaturesInSignerOrder() throws GeneralSecurityException {
        byte[] message = codec.messageBytes(bundle);
        String buyerSignature = LedgerKeys.sign(buyer.getPrivate(), message);
        String delegateSignature = LedgerKeys.sign(delegate.getPrivate(), message);

        byte[] transaction = codec.transactionBytes(bundle
                .withSignature(delegateAddress, delegateSignature)
                .withSignature(buyerAddress, buyerSignature));

        assertThat(transaction[0]).isEqualTo((byte) 2);
        assertThat(Arrays.copyOfRange(transaction, 1, 65)).isEqualTo(Base58.decode(buyerSignature));
        assertThat(Arrays.copyOfRange(transaction, 65, 129)).isEqualTo(Base58.decode(delegateSignature));
        assertThat(Arrays.copyOfRange(transaction, 129, transaction.length)).isEqualTo(message);
        assertThat(Base64.getDecoder().decode(codec.encodeTransaction(bundle))).hasSize(transaction.length);
    }

    @Test
    void transactionBytes_missingSignatureIsZeroFilled() throws GeneralSecurityException {
        String delegateSignature = LedgerKeys.sign(delegate.getPrivate(), codec.messageBytes(bundle));

        byte[] transaction = codec.transactionBytes(bundle.withSignature(delegateAddress, delegateSignature));

        assertThat(Arrays.copyOfRange(transaction, 1, 65)).containsOnly(0);
        assertThat(Arrays.copyOfRange(transaction, 65, 129)).isEqualTo(Base58.decode(delegateSignature));
    }

    @Test
    void transactionBytes_truncatedSignature_isValidationError() {
        assertThatThrownBy(() -> codec.transactionBytes(bundle.withSignature(buyerAddress, "3yZe7d")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void encodeMessage_isBase64OfMessageBytes() {
        assertThat(Base64.getDecoder().decode(codec.encodeMessage(bundle))).isEqualTo(codec.messageBytes(bundle));
    }

    @Test
    void storedForm_restoresInstructionsAndSignatures() {
        TransactionBundle signed = bundle.withSignature(delegateAddress, "delegateSig");

        TransactionBundle restored = codec.fromStoredForm(codec.toStoredForm(signed));

        assertThat(restored).isEqualTo(signed);
        assertThat(restored.instructions().get(0)).isInstanceOf(NativeTransferInstruction.class);
        assertThat(restored.contains(InstructionCategory.METADATA_UPDATE)).isTrue();
        assertThat(codec.messageBytes(restored)).isEqualTo(codec.messageBytes(bundle));
    }

    @Test
    void fromStoredForm_garbage_isValidationError() {
        assertThatThrownBy(() -> codec.fromStoredForm("%%%not-base64%%%"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> codec.fromStoredForm(Base64.getEncoder().encodeToString("{\"id\":42".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(ValidationException.class);
    }
}

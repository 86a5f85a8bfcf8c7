package com.nosota.traitmarket.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.nosota.traitmarket.error.TransactionBuildException;
import com.nosota.traitmarket.error.ValidationException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encoding of transaction bundles.
 *
 * <p>Three forms are produced:
 * <ul>
 *   <li>message: Solana legacy message (header, account keys, blockhash, compiled instructions);
 *       the bytes every signer signs</li>
 *   <li>transaction: compact signature array followed by the message; what is simulated and broadcast</li>
 *   <li>stored form: the whole bundle as canonical JSON, kept between build and submit</li>
 * </ul>
 * All three travel as base64.
 *
 * <p>Account keys are ordered writable signers, read-only signers, writable non-signers,
 * read-only non-signers, with the fee payer first.
 */
@Component
public class TransactionCodec {

    /** Largest transaction a ledger node accepts. */
    public static final int MAX_TRANSACTION_SIZE = 1232;

    static final int KEY_LENGTH = 32;
    static final int SIGNATURE_LENGTH = 64;

    // System program: Transfer
    private static final int SYSTEM_TRANSFER = 2;
    // Token program: Transfer
    private static final int TOKEN_TRANSFER = 3;
    // Asset program: UpdateV1
    private static final int ASSET_UPDATE_V1 = 15;

    private static final BigInteger MAX_U64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    // ==================== Message and transaction ====================

    public byte[] messageBytes(TransactionBundle bundle) {
        return compile(bundle).bytes();
    }

    public String encodeMessage(TransactionBundle bundle) {
        return Base64.getEncoder().encodeToString(messageBytes(bundle));
    }

    /**
     * Serializes the signed transaction. Signers that have not signed yet get an all-zero
     * signature, which simulation without signature verification accepts.
     */
    public byte[] transactionBytes(TransactionBundle bundle) {
        CompiledMessage message = compile(bundle);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeLength(out, message.signers().size());
        for (String signer : message.signers()) {
            String signature = bundle.signatures().get(signer);
            out.writeBytes(signature == null ? new byte[SIGNATURE_LENGTH] : signatureBytes(signer, signature));
        }
        out.writeBytes(message.bytes());
        return out.toByteArray();
    }

    public String encodeTransaction(TransactionBundle bundle) {
        return Base64.getEncoder().encodeToString(transactionBytes(bundle));
    }

    // ==================== Stored form ====================

    public String toStoredForm(TransactionBundle bundle) {
        try {
            return Base64.getEncoder().encodeToString(mapper.writeValueAsBytes(bundle));
        } catch (JsonProcessingException e) {
            throw new TransactionBuildException("Failed to serialize transaction: " + e.getOriginalMessage(), e);
        }
    }

    public TransactionBundle fromStoredForm(String encoded) {
        try {
            return mapper.readValue(Base64.getDecoder().decode(encoded), TransactionBundle.class);
        } catch (IllegalArgumentException | IOException e) {
            throw new ValidationException("Invalid transaction encoding", e);
        }
    }

    // ==================== Compilation ====================

    private CompiledMessage compile(TransactionBundle bundle) {
        List<Instruction> instructions = new ArrayList<>();
        for (LedgerInstruction instruction : bundle.instructions()) {
            instructions.add(toInstruction(instruction, bundle.feePayer()));
        }

        Map<String, AccountMeta> metas = new LinkedHashMap<>();
        merge(metas, new AccountMeta(bundle.feePayer(), true, true));
        for (Instruction instruction : instructions) {
            for (AccountMeta account : instruction.accounts()) {
                merge(metas, account);
            }
            merge(metas, new AccountMeta(instruction.programId(), false, false));
        }

        // List.sort is stable, so the fee payer stays first among writable signers
        List<AccountMeta> keys = new ArrayList<>(metas.values());
        keys.sort(Comparator.comparingInt(TransactionCodec::rank));

        Map<String, Integer> indexes = new HashMap<>();
        List<String> signers = new ArrayList<>();
        int readonlySigned = 0;
        int readonlyUnsigned = 0;
        for (AccountMeta key : keys) {
            indexes.put(key.address(), indexes.size());
            if (key.signer()) {
                signers.add(key.address());
                if (!key.writable()) {
                    readonlySigned++;
                }
            } else if (!key.writable()) {
                readonlyUnsigned++;
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(signers.size());
        out.write(readonlySigned);
        out.write(readonlyUnsigned);
        writeLength(out, keys.size());
        for (AccountMeta key : keys) {
            out.writeBytes(keyBytes(key.address()));
        }
        out.writeBytes(keyBytes(bundle.recentBlockhash()));
        writeLength(out, instructions.size());
        for (Instruction instruction : instructions) {
            out.write(indexes.get(instruction.programId()));
            writeLength(out, instruction.accounts().size());
            for (AccountMeta account : instruction.accounts()) {
                out.write(indexes.get(account.address()));
            }
            writeLength(out, instruction.data().length);
            out.writeBytes(instruction.data());
        }

        byte[] message = out.toByteArray();
        int transactionSize = lengthPrefixSize(signers.size()) + signers.size() * SIGNATURE_LENGTH + message.length;
        if (transactionSize > MAX_TRANSACTION_SIZE) {
            throw new TransactionBuildException("Transaction of " + transactionSize
                    + " bytes exceeds the ledger limit of " + MAX_TRANSACTION_SIZE);
        }
        return new CompiledMessage(message, signers);
    }

    private static Instruction toInstruction(LedgerInstruction instruction, String feePayer) {
        switch (instruction.type()) {
            case NATIVE_TRANSFER -> {
                NativeTransferInstruction transfer = (NativeTransferInstruction) instruction;
                byte[] data = littleEndian(12)
                        .putInt(SYSTEM_TRANSFER)
                        .putLong(u64(transfer.lamports()))
                        .array();
                return new Instruction(transfer.programId(), List.of(
                        new AccountMeta(transfer.from(), true, true),
                        new AccountMeta(transfer.to(), false, true)), data);
            }
            case TOKEN_TRANSFER -> {
                TokenTransferInstruction transfer = (TokenTransferInstruction) instruction;
                byte[] data = littleEndian(9)
                        .put((byte) TOKEN_TRANSFER)
                        .putLong(u64(transfer.amount()))
                        .array();
                return new Instruction(transfer.programId(), List.of(
                        new AccountMeta(transfer.sourceAccount(), false, true),
                        new AccountMeta(transfer.destinationAccount(), false, true),
                        new AccountMeta(transfer.owner(), true, false)), data);
            }
            case METADATA_UPDATE -> {
                MetadataUpdateInstruction update = (MetadataUpdateInstruction) instruction;
                byte[] uri = update.newUri().getBytes(StandardCharsets.UTF_8);
                // UpdateV1 args: newName None, newUri Some(uri), newUpdateAuthority None
                byte[] data = littleEndian(8 + uri.length)
                        .put((byte) ASSET_UPDATE_V1)
                        .put((byte) 0)
                        .put((byte) 1)
                        .putInt(uri.length)
                        .put(uri)
                        .put((byte) 0)
                        .array();
                // Absent optional accounts (collection, log wrapper) are passed as the program id
                String program = update.programId();
                return new Instruction(program, List.of(
                        new AccountMeta(update.assetId(), false, true),
                        new AccountMeta(program, false, false),
                        new AccountMeta(feePayer, true, true),
                        new AccountMeta(update.updateAuthority(), true, false),
                        new AccountMeta(NativeTransferInstruction.SYSTEM_PROGRAM_ID, false, false),
                        new AccountMeta(program, false, false)), data);
            }
            default -> throw new TransactionBuildException("Unsupported instruction type " + instruction.type());
        }
    }

    private static void merge(Map<String, AccountMeta> metas, AccountMeta account) {
        metas.merge(account.address(), account, (existing, added) -> new AccountMeta(existing.address(),
                existing.signer() || added.signer(), existing.writable() || added.writable()));
    }

    private static int rank(AccountMeta account) {
        if (account.signer()) {
            return account.writable() ? 0 : 1;
        }
        return account.writable() ? 2 : 3;
    }

    /**
     * Compact-u16 length prefix: 7 bits per byte, high bit set while more bytes follow.
     */
    static void writeLength(ByteArrayOutputStream out, int length) {
        int remaining = length;
        while (remaining >= 0x80) {
            out.write((remaining & 0x7f) | 0x80);
            remaining >>>= 7;
        }
        out.write(remaining);
    }

    private static int lengthPrefixSize(int length) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeLength(out, length);
        return out.size();
    }

    private static ByteBuffer littleEndian(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static long u64(BigInteger amount) {
        if (amount.signum() < 0 || amount.compareTo(MAX_U64) > 0) {
            throw new TransactionBuildException("Amount " + amount + " does not fit an unsigned 64-bit integer");
        }
        return amount.longValue();
    }

    private static byte[] keyBytes(String address) {
        byte[] key;
        try {
            key = Base58.decode(address);
        } catch (IllegalArgumentException e) {
            throw new TransactionBuildException("Invalid ledger address " + address, e);
        }
        if (key.length != KEY_LENGTH) {
            throw new TransactionBuildException("Ledger address " + address + " is not " + KEY_LENGTH + " bytes");
        }
        return key;
    }

    private static byte[] signatureBytes(String signer, String signature) {
        byte[] bytes;
        try {
            bytes = Base58.decode(signature);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed signature for " + signer, e);
        }
        if (bytes.length != SIGNATURE_LENGTH) {
            throw new ValidationException("Signature for " + signer + " is not " + SIGNATURE_LENGTH + " bytes");
        }
        return bytes;
    }

    private record AccountMeta(String address, boolean signer, boolean writable) {
    }

    private record Instruction(String programId, List<AccountMeta> accounts, byte[] data) {
    }

    private record CompiledMessage(byte[] bytes, List<String> signers) {
    }
}

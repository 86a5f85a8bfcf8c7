package com.nosota.traitmarket.ledger;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/**
 * Ed25519 helpers. A ledger address is the base58 encoding of the raw 32-byte public key.
 */
public final class LedgerKeys {

    public static final String ALGORITHM = "Ed25519";

    // X.509 SubjectPublicKeyInfo header for a raw Ed25519 key
    private static final byte[] X509_PREFIX = {
            0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };
    private static final int RAW_KEY_LENGTH = 32;

    private LedgerKeys() {
    }

    public static String addressOf(PublicKey publicKey) {
        byte[] encoded = publicKey.getEncoded();
        return Base58.encode(Arrays.copyOfRange(encoded, encoded.length - RAW_KEY_LENGTH, encoded.length));
    }

    public static PublicKey publicKeyOf(String address) throws GeneralSecurityException {
        byte[] raw = Base58.decode(address);
        if (raw.length != RAW_KEY_LENGTH) {
            throw new GeneralSecurityException("Address " + address + " is not a 32-byte public key");
        }
        byte[] encoded = new byte[X509_PREFIX.length + RAW_KEY_LENGTH];
        System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
        System.arraycopy(raw, 0, encoded, X509_PREFIX.length, RAW_KEY_LENGTH);
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }

    /**
     * Signs {@code message} and returns the base58 signature.
     */
    public static String sign(PrivateKey privateKey, byte[] message) throws GeneralSecurityException {
        Signature signer = Signature.getInstance(ALGORITHM);
        signer.initSign(privateKey);
        signer.update(message);
        return Base58.encode(signer.sign());
    }

    /**
     * Verifies a base58 signature made by the key behind {@code address}.
     * Returns false for malformed addresses or signatures.
     */
    public static boolean verify(String address, byte[] message, String signature) {
        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKeyOf(address));
            verifier.update(message);
            return verifier.verify(Base58.decode(signature));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }
}

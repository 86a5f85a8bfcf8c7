package com.nosota.traitmarket.ledger;

import com.nosota.traitmarket.error.TransactionBuildException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

/**
 * Server-held delegate authority allowed to update asset metadata.
 *
 * <p>Configuration:
 * <pre>
 * market:
 *   delegate:
 *     private-key: MC4CAQAwBQYDK2VwBCIEI...   # base64 PKCS#8 Ed25519 key
 *     address: 7xKXtg2CW87d97TXJSDpbD5jBkheTqA83TZRuJosgAsU
 * </pre>
 * Without a configured key an ephemeral one is generated; updates signed with it are only
 * accepted by assets that delegate to it, so this is for local runs and tests.
 */
@Component
@Slf4j
public class DelegateSigner {

    private final PrivateKey privateKey;
    private final String address;

    public DelegateSigner(@Value("${market.delegate.private-key:}") String encodedPrivateKey,
                          @Value("${market.delegate.address:}") String configuredAddress) throws GeneralSecurityException {
        if (encodedPrivateKey.isBlank()) {
            KeyPair keyPair = KeyPairGenerator.getInstance(LedgerKeys.ALGORITHM).generateKeyPair();
            this.privateKey = keyPair.getPrivate();
            this.address = LedgerKeys.addressOf(keyPair.getPublic());
            log.warn("No delegate key configured, using ephemeral delegate {}", address);
        } else {
            if (configuredAddress.isBlank()) {
                throw new IllegalStateException("market.delegate.address is required when market.delegate.private-key is set");
            }
            byte[] der = Base64.getDecoder().decode(encodedPrivateKey.trim());
            this.privateKey = KeyFactory.getInstance(LedgerKeys.ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(der));
            this.address = configuredAddress.trim();
            log.info("Loaded delegate authority {}", address);
        }
    }

    public String address() {
        return address;
    }

    /**
     * Signs a transaction message and returns the base58 signature.
     */
    public String sign(byte[] message) {
        try {
            return LedgerKeys.sign(privateKey, message);
        } catch (GeneralSecurityException e) {
            throw new TransactionBuildException("Delegate signing failed: " + e.getMessage(), e);
        }
    }
}

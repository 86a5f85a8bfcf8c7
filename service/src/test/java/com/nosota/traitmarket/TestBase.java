package com.nosota.traitmarket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.traitmarket.ledger.LedgerKeys;
import com.nosota.traitmarket.model.PaymentToken;
import com.nosota.traitmarket.model.Trait;
import com.nosota.traitmarket.repository.PaymentTokenRepository;
import com.nosota.traitmarket.repository.TraitRepository;
import com.nosota.traitmarket.service.GiftBalanceService;
import com.nosota.traitmarket.service.PurchaseOrchestrator;
import com.nosota.traitmarket.service.PurchaseService;
import com.nosota.traitmarket.service.ReservationCleanupService;
import com.nosota.traitmarket.service.ReservationService;
import com.nosota.traitmarket.tests.FakeAssetIndex;
import com.nosota.traitmarket.tests.FakeLedgerConfig;
import com.nosota.traitmarket.tests.FakeOwnershipVerifier;
import com.nosota.traitmarket.tests.InMemoryLedgerClient;
import com.nosota.traitmarket.tests.TestAsyncConfig;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.UUID;

@SpringBootTest(
        classes = TraitMarketApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"spring.main.allow-bean-definition-overriding=true"}
)
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@Import({TestAsyncConfig.class, FakeLedgerConfig.class})
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    @Autowired
    protected ReservationService reservationService;

    @Autowired
    protected ReservationCleanupService reservationCleanupService;

    @Autowired
    protected GiftBalanceService giftBalanceService;

    @Autowired
    protected PurchaseService purchaseService;

    @Autowired
    protected PurchaseOrchestrator purchaseOrchestrator;

    @Autowired
    protected TraitRepository traitRepository;

    @Autowired
    protected PaymentTokenRepository paymentTokenRepository;

    @Autowired
    protected InMemoryLedgerClient ledger;

    @Autowired
    protected FakeOwnershipVerifier ownershipVerifier;

    @Autowired
    protected FakeAssetIndex assetIndex;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @BeforeEach
    public void resetCollaborators() {
        ledger.reset();
        ownershipVerifier.reset();
        assetIndex.reset();
    }

    /**
     * Native-currency token shared by all tests (created on first use).
     */
    protected PaymentToken nativeToken() {
        return paymentTokenRepository.findBySymbol("SOL").orElseGet(() -> {
            PaymentToken token = new PaymentToken();
            token.setSymbol("SOL");
            token.setMintAddress(null);
            token.setDecimals(9);
            return paymentTokenRepository.save(token);
        });
    }

    /**
     * Creates an active trait priced in the native currency.
     *
     * @param totalSupply Supply cap, null for unlimited
     */
    protected Trait createTrait(Integer totalSupply, BigInteger price) {
        Trait trait = new Trait();
        trait.setName("Trait " + UUID.randomUUID().toString().substring(0, 8));
        trait.setSlot("background");
        trait.setTotalSupply(totalSupply);
        trait.setRemainingSupply(totalSupply);
        trait.setPriceAmount(price);
        trait.setTokenId(nativeToken().getId());
        trait.setActive(true);
        trait.setCreatedAt(LocalDateTime.now());
        return traitRepository.save(trait);
    }

    protected static KeyPair newWallet() {
        try {
            return KeyPairGenerator.getInstance(LedgerKeys.ALGORITHM).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    protected static String addressOf(KeyPair wallet) {
        return LedgerKeys.addressOf(wallet.getPublic());
    }

    /**
     * Random asset address.
     */
    protected static String newAsset() {
        return addressOf(newWallet());
    }

    /**
     * Signs the base64 message returned by the build step, as the buyer's wallet would.
     */
    protected static String sign(KeyPair wallet, String serializedMessage) {
        try {
            return LedgerKeys.sign(wallet.getPrivate(), Base64.getDecoder().decode(serializedMessage));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}

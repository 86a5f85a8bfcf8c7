package com.nosota.traitmarket.tests;

import com.nosota.traitmarket.TestBase;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.model.GiftBalance;
import com.nosota.traitmarket.model.Trait;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Gift Balance Tests")
public class GiftBalanceServiceTest extends TestBase {

    @Autowired
    private ConcurrentMarketCalls concurrentMarketCalls;

    @Test
    @DisplayName("GFT-001: Grants accumulate on one balance row")
    void grantsAccumulate() {
        Trait trait = createTrait(null, BigInteger.TEN);
        String wallet = addressOf(newWallet());

        assertThat(giftBalanceService.getAvailable(wallet, trait.getId())).isZero();

        giftBalanceService.grant(wallet, trait.getId(), 2);
        GiftBalance balance = giftBalanceService.grant(wallet, trait.getId(), 3);

        assertThat(balance.getQtyAvailable()).isEqualTo(5);
        assertThat(giftBalanceService.getAvailable(wallet, trait.getId())).isEqualTo(5);
    }

    @Test
    @DisplayName("GFT-002: Decrement succeeds while units are left and reports false afterwards")
    void decrementStopsAtZero() {
        Trait trait = createTrait(null, BigInteger.TEN);
        String wallet = addressOf(newWallet());
        giftBalanceService.grant(wallet, trait.getId(), 1);

        assertThat(giftBalanceService.decrement(wallet, trait.getId(), 1)).isTrue();
        assertThat(giftBalanceService.decrement(wallet, trait.getId(), 1)).isFalse();
        assertThat(giftBalanceService.getAvailable(wallet, trait.getId())).isZero();
    }

    @Test
    @DisplayName("GFT-003: Decrement without any balance row reports false")
    void decrementWithoutBalance() {
        Trait trait = createTrait(null, BigInteger.TEN);

        assertThat(giftBalanceService.decrement(addressOf(newWallet()), trait.getId(), 1)).isFalse();
    }

    @Test
    @DisplayName("GFT-004: Decrement larger than the balance leaves it unchanged")
    void decrementLargerThanBalance() {
        Trait trait = createTrait(null, BigInteger.TEN);
        String wallet = addressOf(newWallet());
        giftBalanceService.grant(wallet, trait.getId(), 2);

        assertThat(giftBalanceService.decrement(wallet, trait.getId(), 3)).isFalse();
        assertThat(giftBalanceService.getAvailable(wallet, trait.getId())).isEqualTo(2);
    }

    @Test
    @DisplayName("GFT-005: Concurrent redemptions never take more units than granted")
    void concurrentDecrementsNeverGoNegative() {
        Trait trait = createTrait(null, BigInteger.TEN);
        String wallet = addressOf(newWallet());
        giftBalanceService.grant(wallet, trait.getId(), 3);

        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(concurrentMarketCalls.decrementGift(start, wallet, trait.getId()));
        }
        start.countDown();

        long succeeded = futures.stream().map(CompletableFuture::join).filter(Boolean::booleanValue).count();

        assertThat(succeeded).isEqualTo(3);
        assertThat(giftBalanceService.getAvailable(wallet, trait.getId())).isZero();
    }

    @Test
    @DisplayName("GFT-006: Restore gives back one unit")
    void restoreAddsOneUnit() {
        Trait trait = createTrait(null, BigInteger.TEN);
        String wallet = addressOf(newWallet());
        giftBalanceService.grant(wallet, trait.getId(), 1);
        giftBalanceService.decrement(wallet, trait.getId(), 1);

        giftBalanceService.restore(wallet, trait.getId());

        assertThat(giftBalanceService.getAvailable(wallet, trait.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("GFT-007: Grant for an unknown trait is rejected")
    void grantForUnknownTrait() {
        assertThatThrownBy(() -> giftBalanceService.grant(addressOf(newWallet()), UUID.randomUUID(), 1))
                .isInstanceOf(NotFoundException.class);
    }
}

package com.nosota.traitmarket.service;

import com.nosota.traitmarket.collaborator.AuditSink;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.model.ActorType;
import com.nosota.traitmarket.model.GiftBalance;
import com.nosota.traitmarket.repository.GiftBalanceRepository;
import com.nosota.traitmarket.repository.TraitRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Gift balance ledger: per wallet and trait free-redemption allowances.
 *
 * <p>All changes are single statements; the balance never goes below zero.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class GiftBalanceService {

    private final GiftBalanceRepository giftBalanceRepository;
    private final TraitRepository traitRepository;
    private final AuditSink auditSink;

    public Optional<GiftBalance> findBalance(@NotNull String walletAddress, @NotNull UUID traitId) {
        return giftBalanceRepository.findByWalletAddressAndTraitId(walletAddress, traitId);
    }

    public int getAvailable(@NotNull String walletAddress, @NotNull UUID traitId) {
        return findBalance(walletAddress, traitId)
                .map(GiftBalance::getQtyAvailable)
                .orElse(0);
    }

    /**
     * Takes {@code amount} units from the balance if enough are left.
     *
     * @return false on insufficient (or missing) balance; never throws for that case
     */
    @Transactional
    public boolean decrement(@NotNull String walletAddress, @NotNull UUID traitId, @Positive int amount) {
        int updated = giftBalanceRepository.decrement(walletAddress, traitId, amount, LocalDateTime.now());
        if (updated == 0) {
            log.debug("Gift balance insufficient: wallet={}, trait={}, amount={}", walletAddress, traitId, amount);
            return false;
        }
        log.info("Gift balance decremented: wallet={}, trait={}, amount={}", walletAddress, traitId, amount);
        return true;
    }

    /**
     * Adds free redemptions, creating the balance on first grant.
     */
    @Transactional
    public GiftBalance grant(@NotNull String walletAddress, @NotNull UUID traitId, @Positive int quantity) {
        if (!traitRepository.existsById(traitId)) {
            throw new NotFoundException("Trait", traitId);
        }
        giftBalanceRepository.add(walletAddress, traitId, quantity, LocalDateTime.now());

        GiftBalance balance = giftBalanceRepository.findByWalletAddressAndTraitId(walletAddress, traitId)
                .orElseThrow(() -> new IllegalStateException("Gift balance missing after grant"));

        log.info("Gift granted: wallet={}, trait={}, quantity={}, balance={}",
                walletAddress, traitId, quantity, balance.getQtyAvailable());
        auditSink.record(ActorType.ADMIN, "gift_grant",
                Map.of("walletAddress", walletAddress, "traitId", traitId, "quantity", quantity));
        return balance;
    }

    /**
     * Gives back one unit taken by a gift redemption that never reached the ledger.
     */
    @Transactional
    public void restore(@NotNull String walletAddress, @NotNull UUID traitId) {
        giftBalanceRepository.add(walletAddress, traitId, 1, LocalDateTime.now());
        log.info("Gift balance restored: wallet={}, trait={}", walletAddress, traitId);
    }
}

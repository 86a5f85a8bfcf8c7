package com.nosota.traitmarket.repository;

import com.nosota.traitmarket.model.PaymentToken;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface PaymentTokenRepository extends JpaRepository<PaymentToken, UUID> {

    Optional<PaymentToken> findBySymbol(String symbol);
}

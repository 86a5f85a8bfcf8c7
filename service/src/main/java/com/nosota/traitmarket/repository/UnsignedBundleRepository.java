package com.nosota.traitmarket.repository;

import com.nosota.traitmarket.model.UnsignedBundle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface UnsignedBundleRepository extends JpaRepository<UnsignedBundle, UUID> {

    Optional<UnsignedBundle> findByPurchaseId(UUID purchaseId);
}

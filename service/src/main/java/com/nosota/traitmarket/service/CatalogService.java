package com.nosota.traitmarket.service;

import com.nosota.traitmarket.collaborator.CatalogReader;
import com.nosota.traitmarket.dto.TraitListing;
import com.nosota.traitmarket.error.NotFoundException;
import com.nosota.traitmarket.model.PaymentToken;
import com.nosota.traitmarket.model.Trait;
import com.nosota.traitmarket.repository.PaymentTokenRepository;
import com.nosota.traitmarket.repository.TraitRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CatalogService implements CatalogReader {

    private final TraitRepository traitRepository;
    private final PaymentTokenRepository paymentTokenRepository;

    @Override
    public TraitListing getTrait(UUID traitId) {
        Trait trait = traitRepository.findById(traitId)
                .orElseThrow(() -> new NotFoundException("Trait", traitId));
        PaymentToken token = paymentTokenRepository.findById(trait.getTokenId())
                .orElseThrow(() -> new NotFoundException("Payment token", trait.getTokenId()));

        return new TraitListing(
                trait.getId(),
                trait.getName(),
                trait.getPriceAmount(),
                token.getId(),
                token.getSymbol(),
                token.getMintAddress(),
                trait.getTotalSupply(),
                trait.getRemainingSupply(),
                trait.isActive()
        );
    }
}

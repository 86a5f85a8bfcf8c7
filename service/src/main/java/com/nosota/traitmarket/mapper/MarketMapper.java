package com.nosota.traitmarket.mapper;

import com.nosota.traitmarket.api.response.GiftBalanceResponse;
import com.nosota.traitmarket.api.response.PurchaseResponse;
import com.nosota.traitmarket.api.response.ReservationResponse;
import com.nosota.traitmarket.api.response.TransactionStatusResponse;
import com.nosota.traitmarket.ledger.SignatureStatus;
import com.nosota.traitmarket.model.GiftBalance;
import com.nosota.traitmarket.model.Purchase;
import com.nosota.traitmarket.model.Reservation;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper from entities to API responses.
 */
@Mapper
public interface MarketMapper {

    MarketMapper INSTANCE = Mappers.getMapper(MarketMapper.class);

    @Mapping(source = "id", target = "reservationId")
    ReservationResponse toReservationResponse(Reservation reservation);

    @Mapping(source = "id", target = "purchaseId")
    PurchaseResponse toPurchaseResponse(Purchase purchase);

    List<PurchaseResponse> toPurchaseResponses(List<Purchase> purchases);

    GiftBalanceResponse toGiftBalanceResponse(GiftBalance giftBalance);

    TransactionStatusResponse toTransactionStatusResponse(SignatureStatus status);
}

package com.ricemill.stockkeeper.dto;

import com.ricemill.stockkeeper.model.MovementType;
import com.ricemill.stockkeeper.model.StockMovement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Read model for a stock-in or stock-out row. Money fields are null when redacted.
 */
public record MovementView(
        Long id,
        MovementType type,
        LocalDate date,
        Long productId,
        String productName,
        String partyName,
        String partyContact,
        String vehicleNumber,
        int numOfBags,
        BigDecimal netWeightPerBagKg,
        BigDecimal totalQuintals,
        BigDecimal pricePerQuintal,
        BigDecimal totalPrice,
        LocalDateTime recordedAt) {

    public static MovementView of(StockMovement movement) {
        return new MovementView(
                movement.getId(),
                movement.getMovementType(),
                movement.getDate(),
                movement.getProduct().getId(),
                movement.getProduct().getName(),
                movement.getPartyName(),
                movement.getPartyContact(),
                movement.getVehicleNumber(),
                movement.getNumOfBags(),
                movement.getNetWeightPerBagKg(),
                movement.getTotalQuintals(),
                movement.getPricePerQuintal(),
                movement.getTotalPrice(),
                movement.getInsertedAt());
    }

    public MovementView withoutAmounts() {
        return new MovementView(id, type, date, productId, productName, partyName, partyContact, vehicleNumber,
                numOfBags, netWeightPerBagKg, totalQuintals, null, null, recordedAt);
    }
}

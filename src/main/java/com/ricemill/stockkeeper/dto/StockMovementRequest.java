package com.ricemill.stockkeeper.dto;

import jakarta.validation.constraints.*;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Input for recording a stock-in (party = farmer) or stock-out (party = customer).
 * A null price means "use the product's current price".
 */
public record StockMovementRequest(
        @NotNull Long productId,
        @NotNull LocalDate date,
        @NotBlank @Size(max = 255) String partyName,
        @Size(max = 20) String partyContact,
        @Size(max = 50) String vehicleNumber,
        @NotNull @Positive Integer numOfBags,
        @NotNull @Positive @Digits(integer = 8, fraction = 2) BigDecimal netWeightPerBagKg,
        @Positive @Digits(integer = 10, fraction = 2) BigDecimal pricePerQuintal) {
}

package com.ricemill.stockkeeper.dto;

import jakarta.validation.constraints.*;

import java.math.BigDecimal;

public record ProductRequest(
        @NotBlank @Size(max = 255) String name,
        @NotBlank @Size(max = 64) String sku,
        String category,
        String unit,
        @NotNull @Positive @Digits(integer = 10, fraction = 2) BigDecimal pricePerQuintal) {
}

package com.ricemill.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Shared shape of {@link StockIn} and {@link StockOut}.
 *
 * <p>Rows are written once. {@code totalQuintals} and {@code totalPrice} are derived
 * from the inputs at insert time and never recomputed, so a later product price
 * change cannot alter a recorded movement. Corrections are new compensating
 * movements.
 */
@MappedSuperclass
@Data
public abstract class StockMovement implements TenantOwned {
    public static final int WEIGHT_SCALE = 2;
    public static final int PRICE_SCALE = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private Long tenantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", nullable = false, updatable = false)
    private Product product;

    @Column(name = "movement_date", nullable = false, updatable = false)
    private LocalDate date;

    // farmer for stock-in, customer for stock-out
    @Column(nullable = false, updatable = false)
    private String partyName;

    @Column(length = 20, updatable = false)
    private String partyContact;

    @Column(length = 50, updatable = false)
    private String vehicleNumber;

    @Column(nullable = false, updatable = false)
    private Integer numOfBags;

    @Column(nullable = false, updatable = false, precision = 10, scale = WEIGHT_SCALE)
    private BigDecimal netWeightPerBagKg;

    // Copied from the product when the movement is recorded
    @Column(nullable = false, updatable = false, precision = 12, scale = PRICE_SCALE)
    private BigDecimal pricePerQuintal;

    // Wide enough to hold bags * kg / 100 and quintals * price without rounding
    @Column(nullable = false, updatable = false, precision = 18, scale = 4)
    private BigDecimal totalQuintals;

    @Column(nullable = false, updatable = false, precision = 24, scale = 6)
    private BigDecimal totalPrice;

    @Column(nullable = false, updatable = false)
    private LocalDateTime insertedAt;

    public abstract MovementType getMovementType();

    /** {@code bags * kgPerBag / 100}, exact. */
    public static BigDecimal quintalsFor(int numOfBags, BigDecimal netWeightPerBagKg) {
        return BigDecimal.valueOf(numOfBags).multiply(netWeightPerBagKg).movePointLeft(2);
    }

    /** {@code quintals * pricePerQuintal}, exact. */
    public static BigDecimal priceFor(BigDecimal totalQuintals, BigDecimal pricePerQuintal) {
        return totalQuintals.multiply(pricePerQuintal);
    }

    public void applyDerivedTotals() {
        if (numOfBags == null || netWeightPerBagKg == null || pricePerQuintal == null) {
            throw new IllegalStateException("Bags, weight per bag and price are required to derive totals");
        }
        totalQuintals = quintalsFor(numOfBags, netWeightPerBagKg);
        totalPrice = priceFor(totalQuintals, pricePerQuintal);
    }

    @PrePersist
    protected void onCreate() {
        applyDerivedTotals();
        if (insertedAt == null) {
            insertedAt = LocalDateTime.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        throw new IllegalStateException("Stock movements are immutable; record a compensating movement instead");
    }
}

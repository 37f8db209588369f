package com.ricemill.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "products",
        uniqueConstraints = @UniqueConstraint(name = "uk_products_tenant_sku", columnNames = { "tenant_id", "sku" }),
        indexes = @Index(name = "idx_products_tenant", columnList = "tenant_id"))
@Data
public class Product implements TenantOwned {
    public static final String DEFAULT_CATEGORY = "Paddy";
    public static final String DEFAULT_UNIT = "quintal";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private Long tenantId;

    @Column(nullable = false)
    private String name;

    // Unique within the tenant only
    @Column(nullable = false)
    private String sku;

    // Fixed at creation
    @Column(nullable = false, updatable = false)
    private String category = DEFAULT_CATEGORY;

    @Column(nullable = false)
    private String unit = DEFAULT_UNIT;

    // Live price; movements keep their own copy
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal pricePerQuintal;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (category == null) {
            category = DEFAULT_CATEGORY;
        }
        if (unit == null) {
            unit = DEFAULT_UNIT;
        }
    }
}

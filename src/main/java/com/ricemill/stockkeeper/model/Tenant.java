package com.ricemill.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "tenants")
@Data
public class Tenant implements TenantOwned {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // lowercase letters, digits and hyphens only
    @Column(unique = true, nullable = false)
    private String slug;

    // Deactivated rather than deleted to suspend access
    private boolean active = true;

    private String contactEmail;
    private String contactPhone;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tenant_settings", joinColumns = @JoinColumn(name = "tenant_id"))
    @MapKeyColumn(name = "setting_key")
    @Column(name = "setting_value", nullable = false)
    private Map<String, String> settings = new HashMap<>();

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @Override
    public Long getTenantId() {
        return id;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (slug == null || !slug.matches("^[a-z0-9-]+$")) {
            throw new IllegalStateException("Tenant slug must contain only lowercase letters, numbers and hyphens");
        }
    }
}

package com.ricemill.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "users")
@Data
public class User implements TenantOwned {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String email;

    private String passwordHash;

    private String fullName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserRole role;

    // Null only for SUPER_ADMIN
    private Long tenantId;

    // Users are never hard-deleted so the audit trail stays valid
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserStatus status = UserStatus.ACTIVE;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    public boolean isSuperAdmin() {
        return role == UserRole.SUPER_ADMIN;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        checkTenantAssignment();
    }

    @PreUpdate
    protected void onUpdate() {
        checkTenantAssignment();
    }

    private void checkTenantAssignment() {
        if (role != UserRole.SUPER_ADMIN && tenantId == null) {
            throw new IllegalStateException("User with role " + role + " must belong to a tenant");
        }
    }
}

package com.ricemill.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs", indexes = @Index(name = "idx_audit_logs_tenant_time", columnList = "tenant_id, timestamp"))
@Immutable
@Data
public class AuditLog implements TenantOwned {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Nullable: the user or tenant may later be deactivated
    private Long userId;

    @Column(name = "tenant_id")
    private Long tenantId;

    @Column(nullable = false)
    private String action; // e.g. "stock_in.create", "tenant.settings.update"

    private String resourceType;
    private Long resourceId;

    @Column(length = 4000)
    private String changes; // JSON object

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}

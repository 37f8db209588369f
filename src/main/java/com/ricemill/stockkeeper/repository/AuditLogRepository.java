package com.ricemill.stockkeeper.repository;

import com.ricemill.stockkeeper.model.AuditLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByTenantIdOrderByTimestampDescIdDesc(Long tenantId, Pageable page);
}

package com.ricemill.stockkeeper.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ricemill.stockkeeper.exception.UnauthorizedException;
import com.ricemill.stockkeeper.model.AuditLog;
import com.ricemill.stockkeeper.model.Tenant;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.model.UserRole;
import com.ricemill.stockkeeper.repository.AuditLogRepository;
import com.ricemill.stockkeeper.security.AuthorizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;
    @Mock
    private TenantScopedQueryService queries;

    private AuditService auditService;
    private User companyAdmin;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(auditLogRepository, new AuthorizationService(), queries, new ObjectMapper());
        companyAdmin = new User();
        companyAdmin.setId(20L);
        companyAdmin.setRole(UserRole.COMPANY_ADMIN);
        companyAdmin.setTenantId(1L);
    }

    @Test
    void record_ShouldStoreChangesAsJson() {
        auditService.record(companyAdmin, 1L, "product.create", "product", 100L, Map.of("sku", "PADDY-SM"));

        ArgumentCaptor<AuditLog> entry = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(entry.capture());
        assertEquals(20L, entry.getValue().getUserId());
        assertEquals(1L, entry.getValue().getTenantId());
        assertEquals("{\"sku\":\"PADDY-SM\"}", entry.getValue().getChanges());
    }

    @Test
    void record_ShouldSwallowStoreFailures() {
        when(auditLogRepository.save(any(AuditLog.class))).thenThrow(new DataIntegrityViolationException("nope"));

        assertDoesNotThrow(() -> auditService.record(companyAdmin, 1L, "stock_in.create", "stock_in", 5L, null));
    }

    @Test
    void listForTenant_ShouldBoundLimit() {
        Tenant tenant = new Tenant();
        tenant.setId(1L);
        TenantScope scope = new TenantScope(tenant, companyAdmin);
        when(queries.scope(companyAdmin, 1L)).thenReturn(scope);
        when(queries.auditLogs(scope, AuditService.DEFAULT_LIMIT)).thenReturn(List.of());

        assertTrue(auditService.listForTenant(companyAdmin, 1L, 5000).isEmpty());
    }

    @Test
    void listForTenant_ShouldRejectOtherTenantAndOperators() {
        User operator = new User();
        operator.setId(21L);
        operator.setRole(UserRole.OPERATOR);
        operator.setTenantId(1L);

        assertThrows(UnauthorizedException.class, () -> auditService.listForTenant(companyAdmin, 2L, null));
        assertThrows(UnauthorizedException.class, () -> auditService.listForTenant(operator, 1L, null));
        verifyNoInteractions(queries);
    }
}

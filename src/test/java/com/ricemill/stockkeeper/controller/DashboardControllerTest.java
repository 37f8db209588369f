package com.ricemill.stockkeeper.controller;

import com.ricemill.stockkeeper.dto.DateRange;
import com.ricemill.stockkeeper.dto.InventoryMetrics;
import com.ricemill.stockkeeper.dto.PeriodSelector;
import com.ricemill.stockkeeper.event.ChangeType;
import com.ricemill.stockkeeper.event.TenantDataChangedEvent;
import com.ricemill.stockkeeper.event.TenantEventBus;
import com.ricemill.stockkeeper.exception.DegradedDataException;
import com.ricemill.stockkeeper.exception.NotFoundException;
import com.ricemill.stockkeeper.exception.TenantMismatchException;
import com.ricemill.stockkeeper.exception.UnauthorizedException;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.model.UserRole;
import com.ricemill.stockkeeper.security.CurrentActorResolver;
import com.ricemill.stockkeeper.service.DashboardService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DashboardService dashboardService;
    @MockBean
    private CurrentActorResolver actorResolver;

    private User viewer;

    @BeforeEach
    void setUp() {
        viewer = new User();
        viewer.setId(11L);
        viewer.setEmail("viewer@mill.local");
        viewer.setRole(UserRole.VIEWER);
        viewer.setTenantId(1L);
        when(actorResolver.currentActor()).thenReturn(viewer);
    }

    @Test
    void inventory_ShouldRequireAuthentication() throws Exception {
        mockMvc.perform(get("/api/tenants/1/dashboard/inventory"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void inventory_ShouldReturnMetrics() throws Exception {
        when(dashboardService.getInventoryMetrics(1L, viewer))
                .thenReturn(new InventoryMetrics(new BigDecimal("70"), 1, new BigDecimal("140000")));

        mockMvc.perform(get("/api/tenants/1/dashboard/inventory"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalStock").value(70))
                .andExpect(jsonPath("$.productCount").value(1));
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void financial_ShouldMapUnauthorizedToForbidden() throws Exception {
        when(dashboardService.getFinancialMetrics(eq(1L), eq(viewer), any(PeriodSelector.class)))
                .thenThrow(new UnauthorizedException("Not permitted: VIEW_FINANCIAL_METRICS"));

        mockMvc.perform(get("/api/tenants/1/dashboard/financial"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Access denied"));
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void inventory_ShouldNotDistinguishForeignTenantFromMissingPermission() throws Exception {
        when(dashboardService.getInventoryMetrics(2L, viewer)).thenThrow(new TenantMismatchException(11L, 2L));

        mockMvc.perform(get("/api/tenants/2/dashboard/inventory"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Access denied"));
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void trend_ShouldRejectInvertedCustomRange() throws Exception {
        mockMvc.perform(get("/api/tenants/1/dashboard/trend")
                        .param("period", "custom")
                        .param("start", "2026-03-10")
                        .param("end", "2026-03-01"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(dashboardService);
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void trend_ShouldRejectUnknownPeriod() throws Exception {
        mockMvc.perform(get("/api/tenants/1/dashboard/trend").param("period", "fortnight"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void top_ShouldRejectUnknownRanking() throws Exception {
        mockMvc.perform(get("/api/tenants/1/dashboard/top/villages"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void alerts_ShouldMapDegradedDataToServiceUnavailable() throws Exception {
        when(dashboardService.getStockAlerts(1L, viewer)).thenThrow(new DegradedDataException("down", null));

        mockMvc.perform(get("/api/tenants/1/dashboard/alerts"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @WithMockUser(username = "admin@mill.local", roles = "SUPER_ADMIN")
    void inventory_ShouldMapMissingTenantToNotFound() throws Exception {
        when(dashboardService.getInventoryMetrics(eq(99L), any())).thenThrow(new NotFoundException("Tenant", 99L));

        mockMvc.perform(get("/api/tenants/99/dashboard/inventory"))
                .andExpect(status().isNotFound());
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void period_ShouldResolveCustomRange() throws Exception {
        DateRange current = new DateRange(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 11));
        DateRange previous = new DateRange(LocalDate.of(2026, 2, 19), LocalDate.of(2026, 3, 1));
        when(dashboardService.resolvePeriod(any())).thenReturn(
                new com.ricemill.stockkeeper.dto.ResolvedPeriod(PeriodSelector.custom(current.start(), current.end()),
                        current, previous));

        mockMvc.perform(get("/api/tenants/1/dashboard/period")
                        .param("period", "custom")
                        .param("start", "2026-03-01")
                        .param("end", "2026-03-11"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current.start").value("2026-03-01"))
                .andExpect(jsonPath("$.previous.start").value("2026-02-19"));
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void events_ShouldStreamChangesForSubscribedTenant() throws Exception {
        TenantEventBus.Subscription subscription = mock(TenantEventBus.Subscription.class);
        AtomicReference<Consumer<TenantDataChangedEvent>> listener = new AtomicReference<>();
        when(dashboardService.subscribe(eq(1L), eq(viewer), any())).thenAnswer(invocation -> {
            listener.set(invocation.getArgument(2));
            return subscription;
        });

        MvcResult result = mockMvc.perform(get("/api/tenants/1/dashboard/events"))
                .andExpect(request().asyncStarted())
                .andReturn();
        listener.get().accept(new TenantDataChangedEvent(1L, ChangeType.STOCK_IN_RECORDED, 5L, Instant.EPOCH));

        String body = result.getResponse().getContentAsString();
        assertThat(body, containsString("event:tenant-data-changed"));
        assertThat(body, containsString("\"resourceId\":5"));
    }

    @Test
    @WithMockUser(username = "viewer@mill.local", roles = "VIEWER")
    void events_ShouldRejectForeignTenant() throws Exception {
        when(dashboardService.subscribe(eq(2L), eq(viewer), any())).thenThrow(new TenantMismatchException(11L, 2L));

        mockMvc.perform(get("/api/tenants/2/dashboard/events"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Access denied"));
    }
}

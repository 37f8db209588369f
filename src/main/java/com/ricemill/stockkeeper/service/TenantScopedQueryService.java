package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.dto.DateRange;
import com.ricemill.stockkeeper.dto.MovementTotals;
import com.ricemill.stockkeeper.dto.RankingRow;
import com.ricemill.stockkeeper.exception.DegradedDataException;
import com.ricemill.stockkeeper.exception.NotFoundException;
import com.ricemill.stockkeeper.exception.TenantMismatchException;
import com.ricemill.stockkeeper.exception.UnauthorizedException;
import com.ricemill.stockkeeper.model.*;
import com.ricemill.stockkeeper.repository.*;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Supplier;

/**
 * The only path to tenant data for read operations. A {@link TenantScope} is
 * issued after the actor's tenant has been checked, and each read is filtered by
 * the scope's tenant id. Reads are retried once on transient store failures, so
 * each one runs in its own repository transaction rather than a shared one.
 */
@Slf4j
@Service
public class TenantScopedQueryService {

    static final LocalDate MIN_DATE = LocalDate.of(1, 1, 1);
    static final LocalDate MAX_DATE = LocalDate.of(9999, 12, 31);

    private final TenantRepository tenantRepository;
    private final ProductRepository productRepository;
    private final StockInRepository stockInRepository;
    private final StockOutRepository stockOutRepository;
    private final AuditLogRepository auditLogRepository;
    private final Retry storeReadRetry;

    public TenantScopedQueryService(TenantRepository tenantRepository,
            ProductRepository productRepository,
            StockInRepository stockInRepository,
            StockOutRepository stockOutRepository,
            AuditLogRepository auditLogRepository,
            Retry storeReadRetry) {
        this.tenantRepository = tenantRepository;
        this.productRepository = productRepository;
        this.stockInRepository = stockInRepository;
        this.stockOutRepository = stockOutRepository;
        this.auditLogRepository = auditLogRepository;
        this.storeReadRetry = storeReadRetry;
    }

    /**
     * Resolves the tenant an actor may read. A tenant-bound actor may only name
     * its own tenant; a super admin must name one explicitly.
     */
    public TenantScope scope(User actor, Long tenantId) {
        if (actor == null) {
            throw new UnauthorizedException("No authenticated actor");
        }
        if (tenantId == null) {
            throw new TenantMismatchException(actor.getId(), null);
        }
        if (!actor.isSuperAdmin() && !tenantId.equals(actor.getTenantId())) {
            throw new TenantMismatchException(actor.getId(), tenantId);
        }

        Optional<Tenant> tenant = read(() -> tenantRepository.findById(tenantId));
        if (tenant.isEmpty()) {
            if (actor.isSuperAdmin()) {
                throw new NotFoundException("Tenant", tenantId);
            }
            throw new TenantMismatchException(actor.getId(), tenantId);
        }
        if (!tenant.get().isActive() && !actor.isSuperAdmin()) {
            throw new UnauthorizedException("Tenant " + tenantId + " is inactive");
        }
        return new TenantScope(tenant.get(), actor);
    }

    public List<Product> products(TenantScope scope) {
        return read(() -> productRepository.findByTenantIdOrderByNameAsc(scope.tenantId()));
    }

    /**
     * Rows in other tenants are reported as missing, the same as rows that do not exist.
     */
    public Product product(TenantScope scope, Long productId) {
        return read(() -> productRepository.findByIdAndTenantId(productId, scope.tenantId()))
                .orElseThrow(() -> new NotFoundException("Product", productId));
    }

    public Map<Long, BigDecimal> quintalsByProduct(TenantScope scope, MovementType type) {
        List<Object[]> rows = read(() -> repository(type).sumQuintalsByProduct(scope.tenantId()));
        Map<Long, BigDecimal> result = new HashMap<>();
        for (Object[] row : rows) {
            result.put((Long) row[0], decimal(row[1]));
        }
        return result;
    }

    public MovementTotals totals(TenantScope scope, MovementType type, DateRange range) {
        MovementTotals totals = read(() -> repository(type).totalsBetween(scope.tenantId(), range.start(), range.end()));
        return totals != null ? totals : MovementTotals.EMPTY;
    }

    public Map<LocalDate, BigDecimal> dailyQuintals(TenantScope scope, MovementType type, DateRange range) {
        List<Object[]> rows = read(() -> repository(type).sumQuintalsByDay(scope.tenantId(), range.start(), range.end()));
        Map<LocalDate, BigDecimal> result = new HashMap<>();
        for (Object[] row : rows) {
            result.put((LocalDate) row[0], decimal(row[1]));
        }
        return result;
    }

    /**
     * Grouped rows ordered by quantity desc, amount desc, then key asc.
     */
    public List<RankingRow> productRanking(TenantScope scope, MovementType type, DateRange range, int limit) {
        List<Object[]> rows = read(() -> repository(type)
                .rankProducts(scope.tenantId(), range.start(), range.end(), PageRequest.of(0, limit)));
        List<RankingRow> result = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            result.add(new RankingRow(String.valueOf(row[0]), (String) row[1], decimal(row[2]), decimal(row[3]),
                    ((Number) row[4]).longValue()));
        }
        return result;
    }

    public List<RankingRow> partyRanking(TenantScope scope, MovementType type, DateRange range, int limit) {
        List<Object[]> rows = read(() -> repository(type)
                .rankParties(scope.tenantId(), range.start(), range.end(), PageRequest.of(0, limit)));
        List<RankingRow> result = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            String party = (String) row[0];
            result.add(new RankingRow(party, party, decimal(row[1]), decimal(row[2]), ((Number) row[3]).longValue()));
        }
        return result;
    }

    public List<? extends StockMovement> recent(TenantScope scope, MovementType type, int limit) {
        return read(() -> repository(type).findRecent(scope.tenantId(), PageRequest.of(0, limit)));
    }

    /**
     * Movements for a report. Either bound may be null (open); a blank party matches everyone.
     */
    public List<? extends StockMovement> history(TenantScope scope, MovementType type, LocalDate start,
            LocalDate end, String party) {
        LocalDate from = start != null ? start : MIN_DATE;
        LocalDate to = end != null ? end : MAX_DATE;
        String partyFilter = party != null ? party.trim() : "";
        return read(() -> repository(type).findHistory(scope.tenantId(), from, to, partyFilter));
    }

    public List<AuditLog> auditLogs(TenantScope scope, int limit) {
        return read(() -> auditLogRepository.findByTenantIdOrderByTimestampDescIdDesc(scope.tenantId(),
                PageRequest.of(0, limit)));
    }

    private MovementRepository<? extends StockMovement> repository(MovementType type) {
        return type == MovementType.STOCK_IN ? stockInRepository : stockOutRepository;
    }

    private <T> T read(Supplier<T> query) {
        try {
            return Retry.decorateSupplier(storeReadRetry, query).get();
        } catch (DataAccessException e) {
            log.error("Store read failed after retry", e);
            throw new DegradedDataException("Tenant data is temporarily unavailable", e);
        }
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString());
    }
}

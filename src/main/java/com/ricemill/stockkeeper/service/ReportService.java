package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.dto.DateRange;
import com.ricemill.stockkeeper.dto.MovementView;
import com.ricemill.stockkeeper.dto.StockLevelRow;
import com.ricemill.stockkeeper.model.MovementType;
import com.ricemill.stockkeeper.model.StockMovement;
import com.ricemill.stockkeeper.model.User;
import com.ricemill.stockkeeper.security.Action;
import com.ricemill.stockkeeper.security.AuthorizationService;
import com.ricemill.stockkeeper.security.TenantRef;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class ReportService {

    private static final Comparator<MovementView> NEWEST_FIRST = Comparator
            .comparing(MovementView::date, Comparator.reverseOrder())
            .thenComparing(MovementView::recordedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MovementView::type)
            .thenComparing(MovementView::id, Comparator.reverseOrder());

    private final AuthorizationService authorizationService;
    private final TenantScopedQueryService queries;
    private final DashboardMetricsCalculator calculator;

    public ReportService(AuthorizationService authorizationService,
            TenantScopedQueryService queries,
            DashboardMetricsCalculator calculator) {
        this.authorizationService = authorizationService;
        this.queries = queries;
        this.calculator = calculator;
    }

    public List<StockLevelRow> stockLevels(User actor, Long tenantId) {
        TenantScope scope = open(actor, tenantId);
        List<StockLevelRow> rows = calculator.stockLevels(scope);
        if (canSeeAmounts(actor, scope)) {
            return rows;
        }
        return rows.stream().map(StockLevelRow::withoutPrice).collect(Collectors.toList());
    }

    /**
     * Stock-ins and stock-outs merged, newest first. {@code end} is exclusive and
     * either bound may be omitted. {@code type} null means both kinds.
     */
    public List<MovementView> transactionHistory(User actor, Long tenantId, LocalDate start, LocalDate end,
            String party, MovementType type) {
        if (start != null && end != null) {
            new DateRange(start, end);
        }
        TenantScope scope = open(actor, tenantId);

        List<MovementView> history = new ArrayList<>();
        if (type == null || type == MovementType.STOCK_IN) {
            addAll(history, queries.history(scope, MovementType.STOCK_IN, start, end, party));
        }
        if (type == null || type == MovementType.STOCK_OUT) {
            addAll(history, queries.history(scope, MovementType.STOCK_OUT, start, end, party));
        }
        history.sort(NEWEST_FIRST);

        if (canSeeAmounts(actor, scope)) {
            return history;
        }
        return history.stream().map(MovementView::withoutAmounts).collect(Collectors.toList());
    }

    private TenantScope open(User actor, Long tenantId) {
        authorizationService.authorize(actor, Action.VIEW_REPORTS, TenantRef.of(tenantId));
        return queries.scope(actor, tenantId);
    }

    private boolean canSeeAmounts(User actor, TenantScope scope) {
        return authorizationService.can(actor, Action.VIEW_FINANCIAL_METRICS, scope);
    }

    private static void addAll(List<MovementView> target, List<? extends StockMovement> movements) {
        for (StockMovement movement : movements) {
            target.add(MovementView.of(movement));
        }
    }
}

package com.ricemill.stockkeeper.controller;

import com.ricemill.stockkeeper.dto.MovementView;
import com.ricemill.stockkeeper.dto.StockLevelRow;
import com.ricemill.stockkeeper.dto.StockMovementRequest;
import com.ricemill.stockkeeper.model.MovementType;
import com.ricemill.stockkeeper.security.CurrentActorResolver;
import com.ricemill.stockkeeper.service.InventoryService;
import com.ricemill.stockkeeper.service.ReportService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/tenants/{tenantId}")
public class StockMovementController {

    private final InventoryService inventoryService;
    private final ReportService reportService;
    private final CurrentActorResolver actorResolver;

    public StockMovementController(InventoryService inventoryService,
            ReportService reportService,
            CurrentActorResolver actorResolver) {
        this.inventoryService = inventoryService;
        this.reportService = reportService;
        this.actorResolver = actorResolver;
    }

    @PostMapping("/stock-ins")
    @ResponseStatus(HttpStatus.CREATED)
    public MovementView recordStockIn(@PathVariable Long tenantId, @Valid @RequestBody StockMovementRequest request) {
        return inventoryService.recordStockIn(actorResolver.currentActor(), tenantId, request);
    }

    @PostMapping("/stock-outs")
    @ResponseStatus(HttpStatus.CREATED)
    public MovementView recordStockOut(@PathVariable Long tenantId, @Valid @RequestBody StockMovementRequest request) {
        return inventoryService.recordStockOut(actorResolver.currentActor(), tenantId, request);
    }

    @GetMapping("/reports/stock-levels")
    public List<StockLevelRow> stockLevels(@PathVariable Long tenantId) {
        return reportService.stockLevels(actorResolver.currentActor(), tenantId);
    }

    @GetMapping("/reports/history")
    public List<MovementView> history(@PathVariable Long tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) String party,
            @RequestParam(required = false) MovementType type) {
        return reportService.transactionHistory(actorResolver.currentActor(), tenantId, start, end, party, type);
    }
}

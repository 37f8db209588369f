package com.ricemill.stockkeeper.service;

import com.ricemill.stockkeeper.dto.MovementView;
import com.ricemill.stockkeeper.dto.ProductRequest;
import com.ricemill.stockkeeper.dto.StockMovementRequest;
import com.ricemill.stockkeeper.event.ChangeType;
import com.ricemill.stockkeeper.event.TenantDataChangedEvent;
import com.ricemill.stockkeeper.model.*;
import com.ricemill.stockkeeper.repository.ProductRepository;
import com.ricemill.stockkeeper.repository.StockInRepository;
import com.ricemill.stockkeeper.repository.StockOutRepository;
import com.ricemill.stockkeeper.security.Action;
import com.ricemill.stockkeeper.security.AuthorizationService;
import com.ricemill.stockkeeper.security.TenantRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Write paths for products and stock movements. Derived movement totals are
 * computed and stored in the same transaction as the insert.
 */
@Slf4j
@Service
public class InventoryService {

    private final ProductRepository productRepository;
    private final StockInRepository stockInRepository;
    private final StockOutRepository stockOutRepository;
    private final TenantScopedQueryService queries;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public InventoryService(ProductRepository productRepository,
            StockInRepository stockInRepository,
            StockOutRepository stockOutRepository,
            TenantScopedQueryService queries,
            AuthorizationService authorizationService,
            AuditService auditService,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.productRepository = productRepository;
        this.stockInRepository = stockInRepository;
        this.stockOutRepository = stockOutRepository;
        this.queries = queries;
        this.authorizationService = authorizationService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public MovementView recordStockIn(User actor, Long tenantId, StockMovementRequest request) {
        TenantScope scope = openForWrite(actor, tenantId);
        StockIn stockIn = new StockIn();
        populate(stockIn, scope, request);
        StockIn saved = stockInRepository.save(stockIn);
        afterMovement(actor, saved, "stock_in.create", ChangeType.STOCK_IN_RECORDED);
        return MovementView.of(saved);
    }

    @Transactional
    public MovementView recordStockOut(User actor, Long tenantId, StockMovementRequest request) {
        TenantScope scope = openForWrite(actor, tenantId);
        StockOut stockOut = new StockOut();
        populate(stockOut, scope, request);
        StockOut saved = stockOutRepository.save(stockOut);
        afterMovement(actor, saved, "stock_out.create", ChangeType.STOCK_OUT_RECORDED);
        return MovementView.of(saved);
    }

    public List<Product> listProducts(User actor, Long tenantId) {
        authorizationService.authorize(actor, Action.VIEW_REPORTS, TenantRef.of(tenantId));
        return queries.products(queries.scope(actor, tenantId));
    }

    @Transactional
    public Product createProduct(User actor, Long tenantId, ProductRequest request) {
        TenantScope scope = openForWrite(actor, tenantId);
        String sku = required(request.sku(), "SKU");
        if (productRepository.existsByTenantIdAndSku(scope.tenantId(), sku)) {
            throw new IllegalArgumentException("SKU already exists: " + sku);
        }

        Product product = new Product();
        product.setTenantId(scope.tenantId());
        product.setName(required(request.name(), "Product name"));
        product.setSku(sku);
        String category = blankToNull(request.category());
        String unit = blankToNull(request.unit());
        product.setCategory(category != null ? category : Product.DEFAULT_CATEGORY);
        product.setUnit(unit != null ? unit : Product.DEFAULT_UNIT);
        product.setPricePerQuintal(checkAmount(request.pricePerQuintal(), "Price per quintal", StockMovement.PRICE_SCALE));

        Product saved = productRepository.save(product);
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("name", saved.getName());
        changes.put("sku", saved.getSku());
        changes.put("price_per_quintal", saved.getPricePerQuintal());
        auditService.record(actor, scope.tenantId(), "product.create", "product", saved.getId(), changes);
        publish(scope.tenantId(), ChangeType.PRODUCT_CHANGED, saved.getId());
        return saved;
    }

    /**
     * Name, SKU, unit and price may change. The category is fixed at creation.
     */
    @Transactional
    public Product updateProduct(User actor, Long tenantId, Long productId, ProductRequest request) {
        TenantScope scope = openForWrite(actor, tenantId);
        Product product = queries.product(scope, productId);

        String category = blankToNull(request.category());
        if (category != null && !category.trim().equals(product.getCategory())) {
            throw new IllegalArgumentException("Product category cannot be changed");
        }
        String sku = required(request.sku(), "SKU");
        if (productRepository.existsByTenantIdAndSkuAndIdNot(scope.tenantId(), sku, productId)) {
            throw new IllegalArgumentException("SKU already exists: " + sku);
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        track(changes, "name", product.getName(), required(request.name(), "Product name"));
        track(changes, "sku", product.getSku(), sku);
        if (blankToNull(request.unit()) != null) {
            track(changes, "unit", product.getUnit(), request.unit().trim());
            product.setUnit(request.unit().trim());
        }
        BigDecimal price = checkAmount(request.pricePerQuintal(), "Price per quintal", StockMovement.PRICE_SCALE);
        if (product.getPricePerQuintal() == null || product.getPricePerQuintal().compareTo(price) != 0) {
            changes.put("price_per_quintal", Map.of("from", String.valueOf(product.getPricePerQuintal()), "to", price));
        }
        product.setName(request.name().trim());
        product.setSku(sku);
        product.setPricePerQuintal(price);

        Product saved = productRepository.save(product);
        if (!changes.isEmpty()) {
            auditService.record(actor, scope.tenantId(), "product.update", "product", saved.getId(), changes);
            publish(scope.tenantId(), ChangeType.PRODUCT_CHANGED, saved.getId());
        }
        return saved;
    }

    private TenantScope openForWrite(User actor, Long tenantId) {
        authorizationService.authorize(actor, Action.MANAGE_INVENTORY, TenantRef.of(tenantId));
        return queries.scope(actor, tenantId);
    }

    private void populate(StockMovement movement, TenantScope scope, StockMovementRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Movement details are required");
        }
        if (request.productId() == null) {
            throw new IllegalArgumentException("Product is required");
        }
        Product product = queries.product(scope, request.productId());

        if (request.date() == null) {
            throw new IllegalArgumentException("Date is required");
        }
        if (request.date().isAfter(LocalDate.now(clock))) {
            throw new IllegalArgumentException("Date cannot be in the future");
        }
        if (request.numOfBags() == null || request.numOfBags() <= 0) {
            throw new IllegalArgumentException("Number of bags must be greater than zero");
        }
        BigDecimal weight = checkAmount(request.netWeightPerBagKg(), "Net weight per bag", StockMovement.WEIGHT_SCALE);
        BigDecimal price = request.pricePerQuintal() != null
                ? checkAmount(request.pricePerQuintal(), "Price per quintal", StockMovement.PRICE_SCALE)
                : product.getPricePerQuintal();

        movement.setTenantId(scope.tenantId());
        movement.setProduct(product);
        movement.setDate(request.date());
        movement.setPartyName(required(request.partyName(), "Party name"));
        movement.setPartyContact(blankToNull(request.partyContact()));
        movement.setVehicleNumber(blankToNull(request.vehicleNumber()));
        movement.setNumOfBags(request.numOfBags());
        movement.setNetWeightPerBagKg(weight);
        movement.setPricePerQuintal(price);
        movement.applyDerivedTotals();
    }

    private void afterMovement(User actor, StockMovement saved, String action, ChangeType type) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("product_id", saved.getProduct().getId());
        changes.put("date", saved.getDate().toString());
        changes.put("party", saved.getPartyName());
        changes.put("num_of_bags", saved.getNumOfBags());
        changes.put("total_quintals", saved.getTotalQuintals());
        changes.put("total_price", saved.getTotalPrice());
        auditService.record(actor, saved.getTenantId(), action, type == ChangeType.STOCK_IN_RECORDED ? "stock_in" : "stock_out",
                saved.getId(), changes);
        publish(saved.getTenantId(), type, saved.getId());
        log.info("Recorded {} #{} for tenant {}: {} quintals", saved.getMovementType(), saved.getId(),
                saved.getTenantId(), saved.getTotalQuintals());
    }

    private void publish(Long tenantId, ChangeType type, Long resourceId) {
        eventPublisher.publishEvent(new TenantDataChangedEvent(tenantId, type, resourceId, Instant.now(clock)));
    }

    private static BigDecimal checkAmount(BigDecimal value, String field, int maxScale) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(field + " must be greater than zero");
        }
        if (value.stripTrailingZeros().scale() > maxScale) {
            throw new IllegalArgumentException(field + " may have at most " + maxScale + " decimal places");
        }
        return value;
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static void track(Map<String, Object> changes, String field, Object from, Object to) {
        if (!Objects.equals(from, to)) {
            changes.put(field, Map.of("from", String.valueOf(from), "to", to));
        }
    }
}

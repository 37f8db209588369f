package com.ricemill.stockkeeper.controller;

import com.ricemill.stockkeeper.dto.ProductRequest;
import com.ricemill.stockkeeper.model.Product;
import com.ricemill.stockkeeper.security.CurrentActorResolver;
import com.ricemill.stockkeeper.service.InventoryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tenants/{tenantId}/products")
public class ProductController {

    private final InventoryService inventoryService;
    private final CurrentActorResolver actorResolver;

    public ProductController(InventoryService inventoryService, CurrentActorResolver actorResolver) {
        this.inventoryService = inventoryService;
        this.actorResolver = actorResolver;
    }

    @GetMapping
    public List<Product> list(@PathVariable Long tenantId) {
        return inventoryService.listProducts(actorResolver.currentActor(), tenantId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Product create(@PathVariable Long tenantId, @Valid @RequestBody ProductRequest request) {
        return inventoryService.createProduct(actorResolver.currentActor(), tenantId, request);
    }

    @PutMapping("/{productId}")
    public Product update(@PathVariable Long tenantId, @PathVariable Long productId,
            @Valid @RequestBody ProductRequest request) {
        return inventoryService.updateProduct(actorResolver.currentActor(), tenantId, productId, request);
    }
}

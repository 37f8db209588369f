package com.ricemill.stockkeeper.repository;

import com.ricemill.stockkeeper.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {
    List<Product> findByTenantIdOrderByNameAsc(Long tenantId);

    Optional<Product> findByIdAndTenantId(Long id, Long tenantId);

    boolean existsByTenantIdAndSku(Long tenantId, String sku);

    boolean existsByTenantIdAndSkuAndIdNot(Long tenantId, String sku, Long id);
}

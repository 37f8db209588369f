package com.ricemill.stockkeeper.config;

import com.ricemill.stockkeeper.dto.ProductRequest;
import com.ricemill.stockkeeper.dto.StockMovementRequest;
import com.ricemill.stockkeeper.model.*;
import com.ricemill.stockkeeper.repository.TenantRepository;
import com.ricemill.stockkeeper.repository.UserRepository;
import com.ricemill.stockkeeper.service.InventoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Demo data for local runs: one super admin, one mill with a user per role, two
 * products and a few movements. Password for every seeded user is "password".
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "stockkeeper.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer {

    @Bean
    CommandLineRunner init(UserRepository userRepo,
            TenantRepository tenantRepo,
            InventoryService inventoryService,
            PasswordEncoder encoder,
            Clock clock) {
        return args -> {
            if (userRepo.count() > 0) {
                return;
            }

            User superAdmin = user("admin@ricemill.local", "System Admin", UserRole.SUPER_ADMIN, null, encoder);
            userRepo.save(superAdmin);

            Tenant mill = new Tenant();
            mill.setName("Demo Rice Mill");
            mill.setSlug("demo-rice-mill");
            mill.setContactEmail("office@demo-rice-mill.local");
            mill.getSettings().put("low_stock_threshold", "50");
            mill = tenantRepo.save(mill);

            User owner = userRepo.save(user("owner@demo-rice-mill.local", "Mill Owner", UserRole.COMPANY_ADMIN,
                    mill.getId(), encoder));
            userRepo.save(user("operator@demo-rice-mill.local", "Weighbridge Operator", UserRole.OPERATOR,
                    mill.getId(), encoder));
            userRepo.save(user("viewer@demo-rice-mill.local", "Accountant", UserRole.VIEWER, mill.getId(), encoder));

            Product paddy = inventoryService.createProduct(owner, mill.getId(),
                    new ProductRequest("Sona Masoori Paddy", "PADDY-SM", null, null, new BigDecimal("2000.00")));
            Product basmati = inventoryService.createProduct(owner, mill.getId(),
                    new ProductRequest("Basmati Paddy", "PADDY-BS", null, null, new BigDecimal("3200.00")));

            LocalDate today = LocalDate.now(clock);
            inventoryService.recordStockIn(owner, mill.getId(), new StockMovementRequest(paddy.getId(),
                    today.minusDays(3), "Ramesh Kumar", "9876543210", "AP09AB1234", 200, new BigDecimal("50"), null));
            inventoryService.recordStockIn(owner, mill.getId(), new StockMovementRequest(basmati.getId(),
                    today.minusDays(2), "Suresh Reddy", null, "AP10CD5678", 60, new BigDecimal("62.50"), null));
            inventoryService.recordStockOut(owner, mill.getId(), new StockMovementRequest(paddy.getId(),
                    today.minusDays(1), "Lakshmi Traders", "9123456780", "TS07EF9012", 120, new BigDecimal("50"),
                    new BigDecimal("2350.00")));

            log.info("Seeded demo tenant '{}' (id {})", mill.getSlug(), mill.getId());
        };
    }

    private static User user(String email, String name, UserRole role, Long tenantId, PasswordEncoder encoder) {
        User user = new User();
        user.setEmail(email);
        user.setFullName(name);
        user.setRole(role);
        user.setTenantId(tenantId);
        user.setPasswordHash(encoder.encode("password"));
        return user;
    }
}

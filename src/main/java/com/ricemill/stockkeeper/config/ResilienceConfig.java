package com.ricemill.stockkeeper.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Retry policy for tenant-scoped store reads: one retry after a short wait, only
 * for failures that can plausibly succeed on a second attempt. Authorization
 * failures are never retried.
 */
@Configuration
public class ResilienceConfig {

    public static final String STORE_READ = "tenantStoreRead";

    @Bean
    public RetryRegistry retryRegistry(DashboardProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.readRetryAttempts()))
                .waitDuration(properties.readRetryBackoff())
                .retryExceptions(TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(STORE_READ);
        return registry;
    }

    @Bean
    public Retry storeReadRetry(RetryRegistry registry) {
        return registry.retry(STORE_READ);
    }
}

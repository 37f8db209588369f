package com.ricemill.stockkeeper.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Single-node bus. Listeners run on the supplied executor so a slow subscriber
 * never holds up the writer that published.
 */
@Slf4j
@Component
public class InMemoryTenantEventBus implements TenantEventBus {

    private final Map<Long, Set<Consumer<TenantDataChangedEvent>>> listeners = new ConcurrentHashMap<>();
    private final Executor executor;

    public InMemoryTenantEventBus(@Qualifier("notificationExecutor") Executor executor) {
        this.executor = executor;
    }

    @Override
    public void publish(Long tenantId, TenantDataChangedEvent event) {
        if (tenantId == null || event == null) {
            return;
        }
        Set<Consumer<TenantDataChangedEvent>> subscribers = listeners.get(tenantId);
        if (subscribers == null || subscribers.isEmpty()) {
            return;
        }
        for (Consumer<TenantDataChangedEvent> listener : subscribers) {
            try {
                executor.execute(() -> deliver(tenantId, listener, event));
            } catch (RejectedExecutionException e) {
                log.warn("Dropped {} notification for tenant {}: executor rejected it", event.type(), tenantId);
            }
        }
    }

    @Override
    public Subscription subscribe(Long tenantId, Consumer<TenantDataChangedEvent> listener) {
        if (tenantId == null || listener == null) {
            throw new IllegalArgumentException("Tenant and listener are required");
        }
        listeners.computeIfAbsent(tenantId, id -> new CopyOnWriteArraySet<>()).add(listener);
        log.debug("Subscribed listener to tenant {}", tenantId);
        return () -> {
            Set<Consumer<TenantDataChangedEvent>> subscribers = listeners.get(tenantId);
            if (subscribers != null) {
                subscribers.remove(listener);
            }
        };
    }

    int subscriberCount(Long tenantId) {
        Set<Consumer<TenantDataChangedEvent>> subscribers = listeners.get(tenantId);
        return subscribers == null ? 0 : subscribers.size();
    }

    private void deliver(Long tenantId, Consumer<TenantDataChangedEvent> listener, TenantDataChangedEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener for tenant {} failed on {}", tenantId, event.type(), e);
        }
    }
}

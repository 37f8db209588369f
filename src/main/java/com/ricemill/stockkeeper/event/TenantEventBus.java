package com.ricemill.stockkeeper.event;

import java.util.function.Consumer;

/**
 * Per-tenant change notification channel. A subscriber only ever receives events
 * for the tenant it subscribed to.
 */
public interface TenantEventBus {

    void publish(Long tenantId, TenantDataChangedEvent event);

    Subscription subscribe(Long tenantId, Consumer<TenantDataChangedEvent> listener);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}

package com.ricemill.stockkeeper.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTenantEventBusTest {

    private final InMemoryTenantEventBus bus = new InMemoryTenantEventBus(Runnable::run);

    private static TenantDataChangedEvent event(Long tenantId, ChangeType type) {
        return new TenantDataChangedEvent(tenantId, type, 1L, Instant.parse("2026-03-15T10:00:00Z"));
    }

    @Test
    void publish_ShouldReachOnlySubscribersOfThatTenant() {
        List<TenantDataChangedEvent> tenantA = new ArrayList<>();
        List<TenantDataChangedEvent> tenantB = new ArrayList<>();
        bus.subscribe(1L, tenantA::add);
        bus.subscribe(2L, tenantB::add);

        bus.publish(1L, event(1L, ChangeType.STOCK_IN_RECORDED));

        assertEquals(1, tenantA.size());
        assertTrue(tenantB.isEmpty());
    }

    @Test
    void publish_ShouldFanOutToEverySubscriber() {
        List<TenantDataChangedEvent> first = new ArrayList<>();
        List<TenantDataChangedEvent> second = new ArrayList<>();
        bus.subscribe(1L, first::add);
        bus.subscribe(1L, second::add);

        bus.publish(1L, event(1L, ChangeType.STOCK_OUT_RECORDED));

        assertEquals(1, first.size());
        assertEquals(1, second.size());
    }

    @Test
    void close_ShouldStopDelivery() {
        List<TenantDataChangedEvent> received = new ArrayList<>();
        TenantEventBus.Subscription subscription = bus.subscribe(1L, received::add);

        subscription.close();
        bus.publish(1L, event(1L, ChangeType.STOCK_IN_RECORDED));

        assertTrue(received.isEmpty());
        assertEquals(0, bus.subscriberCount(1L));
    }

    @Test
    void publish_ShouldIsolateFailingListener() {
        List<TenantDataChangedEvent> received = new ArrayList<>();
        bus.subscribe(1L, e -> {
            throw new IllegalStateException("listener broke");
        });
        bus.subscribe(1L, received::add);

        assertDoesNotThrow(() -> bus.publish(1L, event(1L, ChangeType.PRODUCT_CHANGED)));
        assertEquals(1, received.size());
    }

    @Test
    void subscribe_ShouldRequireTenant() {
        assertThrows(IllegalArgumentException.class, () -> bus.subscribe(null, e -> { }));
    }
}

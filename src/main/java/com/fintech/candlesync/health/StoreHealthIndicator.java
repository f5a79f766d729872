package com.fintech.candlesync.health;

import com.fintech.candlesync.store.GatedTimeSeriesStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports store reachability on /actuator/health.
 * The probe queues behind the gate like any other store call.
 */
@Component("timeSeriesStore")
public class StoreHealthIndicator implements HealthIndicator {

    private final GatedTimeSeriesStore store;

    public StoreHealthIndicator(GatedTimeSeriesStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        Health.Builder builder = store.isHealthy() ? Health.up() : Health.down();
        return builder
            .withDetail("circuitBreaker", store.getCircuitBreakerState())
            .build();
    }
}

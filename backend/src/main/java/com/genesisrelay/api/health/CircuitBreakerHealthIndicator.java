/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.health;

import com.genesisrelay.application.resilience.BreakerStatus;
import com.genesisrelay.application.resilience.CircuitBreakerManager;
import com.genesisrelay.application.resilience.DegradedServiceNotifier;
import com.genesisrelay.domain.model.CircuitState;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Exposed as {@code breakers} under {@code /actuator/health}. Any OPEN breaker is reported in the
 * details; the indicator only goes DOWN when one of them is critical.
 */
@Component("breakers")
public class CircuitBreakerHealthIndicator extends AbstractHealthIndicator {
    private final CircuitBreakerManager breakers;
    private final DegradedServiceNotifier notifier;

    public CircuitBreakerHealthIndicator(CircuitBreakerManager breakers, DegradedServiceNotifier notifier) {
        super("Circuit breaker health check failed");
        this.breakers = breakers;
        this.notifier = notifier;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        boolean criticalOpen = false;
        for (Map.Entry<String, BreakerStatus> entry : breakers.getStatus().entrySet()) {
            BreakerStatus status = entry.getValue();
            if (status.state() == CircuitState.OPEN) {
                builder.withDetail(entry.getKey(), Map.of("state", "DOWN", "failureCount", status.failureCount()));
                criticalOpen |= notifier.isCritical(entry.getKey());
            } else {
                builder.withDetail(entry.getKey(), Map.of("state", status.state().name(), "failureCount", status.failureCount()));
            }
        }
        if (criticalOpen) {
            builder.down();
        } else {
            builder.up();
        }
    }
}

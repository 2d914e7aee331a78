/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import java.time.Duration;

/**
 * Thresholds of a single circuit breaker.
 *
 * @param failureThreshold failures counted while CLOSED before the breaker opens
 * @param resetTimeout     how long the breaker stays OPEN before a trial is allowed
 * @param monitoringPeriod reporting interval for health snapshots; not used by the state machine
 * @param halfOpenMaxCalls consecutive successful trials needed to close again
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration resetTimeout,
        Duration monitoringPeriod,
        int halfOpenMaxCalls
) {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofMillis(60_000);
    public static final Duration DEFAULT_MONITORING_PERIOD = Duration.ofMillis(10_000);
    public static final int DEFAULT_HALF_OPEN_MAX_CALLS = 2;

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be >= 0");
        }
        if (monitoringPeriod == null) {
            monitoringPeriod = DEFAULT_MONITORING_PERIOD;
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
                DEFAULT_FAILURE_THRESHOLD,
                DEFAULT_RESET_TIMEOUT,
                DEFAULT_MONITORING_PERIOD,
                DEFAULT_HALF_OPEN_MAX_CALLS
        );
    }
}

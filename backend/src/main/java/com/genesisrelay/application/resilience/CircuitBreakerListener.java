/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import com.genesisrelay.domain.model.CircuitState;

/**
 * Observer of breaker state changes. Invoked after the transition, outside the breaker lock.
 */
public interface CircuitBreakerListener {
    void onStateChange(String breakerName, CircuitState from, CircuitState to, int failureCount);
}

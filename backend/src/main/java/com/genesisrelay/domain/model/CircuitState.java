/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.domain.model;

/**
 * States of a circuit breaker guarding one outbound call path.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}

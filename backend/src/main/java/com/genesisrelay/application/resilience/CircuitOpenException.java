/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import java.time.Instant;

/**
 * Thrown by {@link CircuitBreaker#execute} when the call is rejected without invoking the operation.
 */
public class CircuitOpenException extends RuntimeException {
    private final String breakerName;
    private final Instant nextAttemptTime;

    public CircuitOpenException(String breakerName, Instant nextAttemptTime) {
        super("Circuit breaker " + breakerName + " is OPEN");
        this.breakerName = breakerName;
        this.nextAttemptTime = nextAttemptTime;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Instant getNextAttemptTime() {
        return nextAttemptTime;
    }
}

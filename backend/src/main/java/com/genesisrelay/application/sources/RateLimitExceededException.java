/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import java.time.Duration;

public class RateLimitExceededException extends RuntimeException {
    private final String sourceId;
    private final Duration retryAfter;

    public RateLimitExceededException(String sourceId, Duration retryAfter) {
        super("Rate limit exceeded for " + sourceId);
        this.sourceId = sourceId;
        this.retryAfter = retryAfter;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}

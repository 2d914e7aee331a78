/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Minimum-interval limiter: a call is admitted when at least {@code 1000 / rateLimit} ms have
 * passed since the last admitted call for the same source. Rejected calls do not move the window.
 */
@Component
public class SourceRateLimiter {
    private final ConcurrentMap<String, Long> lastAdmitted = new ConcurrentHashMap<>();
    private final Clock clock;

    public SourceRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public void acquire(String sourceId, double rateLimit) {
        if (rateLimit <= 0) return;

        double minIntervalMs = 1000.0 / rateLimit;
        long now = clock.millis();
        long[] waitMs = {0};
        lastAdmitted.compute(sourceId, (id, last) -> {
            if (last != null && now - last < minIntervalMs) {
                waitMs[0] = Math.max(1, (long) Math.ceil(last + minIntervalMs - now));
                return last;
            }
            return now;
        });
        if (waitMs[0] > 0) {
            throw new RateLimitExceededException(sourceId, Duration.ofMillis(waitMs[0]));
        }
    }
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry that lazily creates one breaker per dependency name. Entries are never removed.
 */
@Service
public class CircuitBreakerManager {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerManager.class);

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;
    private final List<CircuitBreakerListener> listeners;

    public CircuitBreakerManager(CircuitBreakerConfig defaultConfig, Clock clock, List<CircuitBreakerListener> listeners) {
        this.defaultConfig = defaultConfig == null ? CircuitBreakerConfig.defaults() : defaultConfig;
        this.clock = clock;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public CircuitBreaker getBreaker(String name) {
        return getBreaker(name, null);
    }

    /**
     * Returns the breaker registered under {@code name}. The config only applies when the
     * breaker does not exist yet.
     */
    public CircuitBreaker getBreaker(String name, CircuitBreakerConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("breaker name is required");
        }
        return breakers.computeIfAbsent(name, n -> {
            CircuitBreakerConfig effective = config == null ? defaultConfig : config;
            log.debug("Creating circuit breaker name={} threshold={} resetTimeout={} halfOpenMaxCalls={}",
                    n, effective.failureThreshold(), effective.resetTimeout(), effective.halfOpenMaxCalls());
            return new CircuitBreaker(n, effective, clock, listeners);
        });
    }

    public Map<String, CircuitBreaker> getAllBreakers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(breakers));
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("All circuit breakers have been reset count={}", breakers.size());
    }

    public Map<String, BreakerStatus> getStatus() {
        Map<String, BreakerStatus> status = new TreeMap<>();
        breakers.forEach((name, breaker) -> status.put(name, breaker.status()));
        return Collections.unmodifiableMap(status);
    }
}

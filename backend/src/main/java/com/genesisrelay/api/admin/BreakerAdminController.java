/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.admin;

import com.genesisrelay.application.resilience.CircuitBreaker;
import com.genesisrelay.application.resilience.CircuitBreakerManager;
import com.genesisrelay.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

@RestController
@RequestMapping("/api/admin/breakers")
public class BreakerAdminController {
    private static final Logger log = LoggerFactory.getLogger(BreakerAdminController.class);

    private final CircuitBreakerManager breakers;

    public BreakerAdminController(CircuitBreakerManager breakers) {
        this.breakers = breakers;
    }

    @GetMapping
    public Map<String, BreakerView> list() {
        Map<String, BreakerView> view = new TreeMap<>();
        breakers.getAllBreakers().forEach((name, breaker) -> view.put(name, BreakerView.of(breaker)));
        return view;
    }

    @PostMapping("/reset")
    public Map<String, BreakerView> reset() {
        log.info("Resetting all circuit breakers");
        breakers.resetAll();
        return list();
    }

    public record BreakerView(CircuitState state, int failureCount, Instant nextAttemptTime, Instant lastFailureTime) {
        static BreakerView of(CircuitBreaker breaker) {
            return new BreakerView(
                    breaker.getState(),
                    breaker.getFailureCount(),
                    breaker.getNextAttemptTime().orElse(null),
                    breaker.getLastFailureTime().orElse(null)
            );
        }
    }
}

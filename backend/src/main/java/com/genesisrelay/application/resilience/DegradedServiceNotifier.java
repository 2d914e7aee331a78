/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import com.genesisrelay.config.AppProperties;
import com.genesisrelay.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Posts a notice when a user-facing breaker opens. Side channel only; callers of
 * {@link CircuitBreaker#execute} never see it.
 */
@Component
public class DegradedServiceNotifier implements CircuitBreakerListener {
    private static final Logger log = LoggerFactory.getLogger(DegradedServiceNotifier.class);

    private final ServiceNoticeBoard noticeBoard;
    private final Set<String> criticalBreakers;

    public DegradedServiceNotifier(ServiceNoticeBoard noticeBoard, AppProperties properties) {
        this.noticeBoard = noticeBoard;
        this.criticalBreakers = properties.resilienceOrDefaults().criticalBreakersOrDefault();
    }

    @Override
    public void onStateChange(String breakerName, CircuitState from, CircuitState to, int failureCount) {
        if (to != CircuitState.OPEN || !criticalBreakers.contains(breakerName)) return;

        String message = "Service " + breakerName + " is temporarily unavailable. Trying alternative methods.";
        noticeBoard.post(breakerName, message);
        log.warn("Degraded service notice posted service={} failures={}", breakerName, failureCount);
    }

    public boolean isCritical(String breakerName) {
        return criticalBreakers.contains(breakerName);
    }
}

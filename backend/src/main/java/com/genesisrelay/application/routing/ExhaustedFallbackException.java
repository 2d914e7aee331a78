/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.domain.model.RequestType;

/**
 * Every candidate provider failed before producing a chunk, or there was no candidate at all.
 */
public class ExhaustedFallbackException extends RuntimeException {
    private final RequestType requestType;
    private final String lastProviderId;
    private final String lastReason;
    private final int attempts;

    public ExhaustedFallbackException(RequestType requestType, String lastProviderId, String lastReason, int attempts, Throwable cause) {
        super(buildMessage(requestType, lastProviderId, lastReason, attempts), cause);
        this.requestType = requestType;
        this.lastProviderId = lastProviderId;
        this.lastReason = lastReason;
        this.attempts = attempts;
    }

    private static String buildMessage(RequestType type, String lastProviderId, String lastReason, int attempts) {
        if (attempts == 0) {
            return "No AI provider is available for " + type + " requests";
        }
        return "All " + attempts + " AI providers failed for " + type + " request; last=" + lastProviderId + ": " + lastReason;
    }

    public RequestType getRequestType() {
        return requestType;
    }

    public String getLastProviderId() {
        return lastProviderId;
    }

    public String getLastReason() {
        return lastReason;
    }

    public int getAttempts() {
        return attempts;
    }
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import com.genesisrelay.domain.model.ProviderKind;
import com.genesisrelay.domain.model.RequestType;

import java.util.Set;

/**
 * Static description of one AI provider endpoint.
 *
 * @param priorityClasses request classifications that try this provider before the generic fallbacks
 * @param priority        lower values are tried earlier within the same group
 */
public record ProviderDescriptor(
        String id,
        String name,
        ProviderKind kind,
        String baseUrl,
        String apiKey,
        String model,
        Set<RequestType> priorityClasses,
        int priority,
        double costPerToken,
        int maxTokens,
        boolean premium,
        boolean enabled
) {
    public ProviderDescriptor {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("provider id is required");
        if (kind == null) throw new IllegalArgumentException("provider kind is required for " + id);
        priorityClasses = priorityClasses == null ? Set.of() : Set.copyOf(priorityClasses);
    }

    public String breakerName() {
        return id;
    }

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    public boolean prefers(RequestType type) {
        return type != null && priorityClasses.contains(type);
    }
}

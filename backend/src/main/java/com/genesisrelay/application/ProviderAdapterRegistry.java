/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application;

import com.genesisrelay.domain.model.ProviderKind;
import com.genesisrelay.infrastructure.provider.AiProviderAdapter;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the wire adapter for a provider kind. Two adapters claiming the same kind is a wiring
 * error and fails startup.
 */
@Component
public class ProviderAdapterRegistry {

    private final Map<ProviderKind, AiProviderAdapter> adaptersByKind;

    public ProviderAdapterRegistry(List<AiProviderAdapter> adapters) {
        EnumMap<ProviderKind, AiProviderAdapter> registry = new EnumMap<>(ProviderKind.class);
        for (AiProviderAdapter adapter : adapters == null ? List.<AiProviderAdapter>of() : adapters) {
            ProviderKind kind = adapter.kind();
            if (kind == null) {
                throw new IllegalStateException("Adapter " + adapter.getClass().getName() + " returned kind=null");
            }
            AiProviderAdapter existing = registry.putIfAbsent(kind, adapter);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate adapter for kind=" + kind
                                + ". existing=" + existing.getClass().getName()
                                + ", new=" + adapter.getClass().getName()
                );
            }
        }
        this.adaptersByKind = Collections.unmodifiableMap(registry);
    }

    public Optional<AiProviderAdapter> find(ProviderKind kind) {
        return Optional.ofNullable(adaptersByKind.get(kind));
    }

    public AiProviderAdapter getRequired(ProviderKind kind) {
        return find(kind).orElseThrow(() -> new IllegalArgumentException("No adapter registered for kind=" + kind));
    }

    public boolean supports(ProviderKind kind) {
        return adaptersByKind.containsKey(kind);
    }

    public Set<ProviderKind> registeredKinds() {
        return adaptersByKind.keySet();
    }
}

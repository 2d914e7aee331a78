/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.application.ProviderAdapterRegistry;
import com.genesisrelay.domain.model.Quality;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.infrastructure.provider.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the providers that may serve a request. The result is a pure function of the catalog and
 * the request; breaker state is not consulted here.
 */
@Component
public class RoutingTable {
    private static final Logger log = LoggerFactory.getLogger(RoutingTable.class);
    private static final Comparator<ProviderDescriptor> BY_PRIORITY = Comparator.comparingInt(ProviderDescriptor::priority);

    private final ProviderCatalog catalog;
    private final ProviderAdapterRegistry adapters;

    public RoutingTable(ProviderCatalog catalog, ProviderAdapterRegistry adapters) {
        this.catalog = catalog;
        this.adapters = adapters;
    }

    public List<ProviderDescriptor> candidatesFor(RequestType type, Quality quality, int estimatedTokens) {
        List<ProviderDescriptor> eligible = catalog.all().stream()
                .filter(p -> isEligible(p, estimatedTokens))
                .toList();

        List<ProviderDescriptor> ordered = new ArrayList<>(eligible.stream()
                .filter(p -> p.prefers(type))
                .sorted(BY_PRIORITY)
                .toList());
        eligible.stream()
                .filter(p -> !p.prefers(type))
                .sorted(BY_PRIORITY)
                .forEach(ordered::add);

        if (quality == Quality.PREMIUM) {
            // List.sort is stable, so the class/priority order survives within each group
            ordered.sort(Comparator.comparing((ProviderDescriptor p) -> !p.premium()));
        } else if (quality == Quality.FAST) {
            ordered.sort(Comparator.comparingDouble(ProviderDescriptor::costPerToken));
        }
        return List.copyOf(ordered);
    }

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (int) Math.ceil(text.length() / 3.5);
    }

    private boolean isEligible(ProviderDescriptor provider, int estimatedTokens) {
        if (!provider.enabled()) return false;
        if (!adapters.supports(provider.kind())) {
            log.debug("Skipping provider without adapter id={} kind={}", provider.id(), provider.kind());
            return false;
        }
        if (!provider.isConfigured()) {
            log.debug("Skipping unconfigured provider id={}", provider.id());
            return false;
        }
        return estimatedTokens <= provider.maxTokens();
    }
}

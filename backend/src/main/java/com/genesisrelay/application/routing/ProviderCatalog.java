/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.config.AppProperties;
import com.genesisrelay.infrastructure.provider.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Provider descriptors bound from {@code app.providers}. The list is fixed for the life of the process.
 */
@Component
public class ProviderCatalog {
    private static final Logger log = LoggerFactory.getLogger(ProviderCatalog.class);

    private final List<ProviderDescriptor> providers;

    @Autowired
    public ProviderCatalog(AppProperties properties) {
        this(properties.providersOrEmpty().stream().map(ProviderCatalog::toDescriptor).toList());
        for (ProviderDescriptor provider : providers) {
            log.info("AI provider registered id={} kind={} priority={} configured={}",
                    provider.id(), provider.kind(), provider.priority(), provider.isConfigured());
        }
    }

    ProviderCatalog(List<ProviderDescriptor> providers) {
        Set<String> ids = new HashSet<>();
        for (ProviderDescriptor provider : providers) {
            if (!ids.add(provider.id())) {
                throw new IllegalStateException("Duplicate provider id " + provider.id());
            }
        }
        this.providers = List.copyOf(providers);
    }

    public static ProviderCatalog of(List<ProviderDescriptor> providers) {
        return new ProviderCatalog(providers);
    }

    public List<ProviderDescriptor> all() {
        return providers;
    }

    public Optional<ProviderDescriptor> find(String id) {
        return providers.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    private static ProviderDescriptor toDescriptor(AppProperties.Provider p) {
        return new ProviderDescriptor(
                p.id(),
                p.name() == null ? p.id() : p.name(),
                p.kind(),
                p.baseUrl(),
                p.apiKey(),
                p.model(),
                p.priorityClasses(),
                p.priority() == null ? 100 : p.priority(),
                p.costPerToken() == null ? 0.0 : p.costPerToken(),
                p.maxTokens() == null ? Integer.MAX_VALUE : p.maxTokens(),
                Boolean.TRUE.equals(p.premium()),
                p.enabled() == null || p.enabled()
        );
    }
}

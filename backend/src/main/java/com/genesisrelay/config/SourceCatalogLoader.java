/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.config;

import com.genesisrelay.application.sources.DataSource;
import com.genesisrelay.application.sources.SourceRegistry;
import com.genesisrelay.application.sources.UseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Registers the configured catalog once all singletons exist, before the web server takes traffic.
 * An invalid entry fails startup.
 */
@Component
public class SourceCatalogLoader implements SmartInitializingSingleton {
    private static final Logger log = LoggerFactory.getLogger(SourceCatalogLoader.class);

    private final AppProperties properties;
    private final SourceRegistry registry;

    public SourceCatalogLoader(AppProperties properties, SourceRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        AppProperties.Sources sources = properties.sourcesOrDefaults();
        for (AppProperties.Source s : sources.catalogOrEmpty()) {
            registry.registerSource(new DataSource(
                    s.id(),
                    s.name(),
                    s.type(),
                    s.url(),
                    s.description(),
                    s.authType(),
                    s.apiKey(),
                    s.rateLimit() == null ? 0 : s.rateLimit(),
                    s.enabled() == null || s.enabled(),
                    s.categories(),
                    s.headers()
            ));
        }
        for (AppProperties.UseCase u : sources.useCasesOrEmpty()) {
            registry.registerUseCase(new UseCase(
                    u.id(),
                    u.name(),
                    u.description(),
                    u.categories(),
                    u.sources(),
                    u.queryTemplate(),
                    u.examples()
            ));
        }
        log.info("Source catalog loaded sources={} useCases={}",
                sources.catalogOrEmpty().size(), sources.useCasesOrEmpty().size());
    }
}

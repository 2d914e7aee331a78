/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class UseCaseService {
    private static final Logger log = LoggerFactory.getLogger(UseCaseService.class);
    static final String SEARCH_ENDPOINT = "/search";

    private final SourceRegistry registry;
    private final RateLimitedCacheGateway gateway;

    public UseCaseService(SourceRegistry registry, RateLimitedCacheGateway gateway) {
        this.registry = registry;
        this.gateway = gateway;
    }

    public UseCaseResult executeUseCase(String useCaseId, Map<String, String> params) {
        UseCase useCase = registry.getUseCase(useCaseId)
                .orElseThrow(() -> new ConfigurationException("Use case " + useCaseId + " not found"));
        String query = fillTemplate(useCase.queryTemplate(), params);
        log.info("Executing use case id={} categories={}", useCase.id(), useCase.categories());
        return new UseCaseResult(useCase.id(), query, multiSourceSearch(query, useCase.categories()));
    }

    /**
     * Runs {@code query} against the search endpoint of every enabled source in any of the
     * categories (all enabled sources when none are given). Sources that fail are left out of the
     * result.
     */
    public Map<String, JsonNode> multiSourceSearch(String query, List<String> categories) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        Map<String, JsonNode> results = new LinkedHashMap<>();
        for (DataSource source : registry.getAllSources()) {
            if (!source.enabled() || !source.inAnyCategory(categories)) continue;
            try {
                results.put(source.id(), gateway.call(source.id(), SEARCH_ENDPOINT, Map.of("q", query)));
            } catch (ConfigurationException | RateLimitExceededException | DependencyException e) {
                log.warn("Search skipped source={}: {}", source.id(), e.getMessage());
            }
        }
        return results;
    }

    /**
     * Replaces every {@code {name}} token with the matching parameter. Unknown tokens stay as they are.
     */
    static String fillTemplate(String template, Map<String, String> params) {
        String query = template;
        if (params != null) {
            for (Map.Entry<String, String> e : params.entrySet()) {
                query = query.replace("{" + e.getKey() + "}", e.getValue() == null ? "" : e.getValue());
            }
        }
        return query;
    }

    public record UseCaseResult(String useCaseId, String query, Map<String, JsonNode> results) {}
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory catalog of data sources and use cases. Descriptors are immutable; re-registering an id
 * or toggling {@code enabled} replaces the entry.
 */
@Component
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final ConcurrentMap<String, DataSource> sources = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, UseCase> useCases = new ConcurrentHashMap<>();

    public void registerSource(DataSource source) {
        SourceValidator.requireValid(source);
        DataSource previous = sources.put(source.id(), source);
        if (previous == null) {
            log.info("Registered data source id={} type={} categories={}", source.id(), source.type(), source.categories());
        } else {
            log.info("Replaced data source id={}", source.id());
        }
    }

    public void registerUseCase(UseCase useCase) {
        SourceValidator.requireValid(useCase);
        useCases.put(useCase.id(), useCase);
        log.info("Registered use case id={} categories={}", useCase.id(), useCase.categories());
    }

    public Optional<DataSource> getSource(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(sources.get(id));
    }

    public Optional<UseCase> getUseCase(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(useCases.get(id));
    }

    public List<DataSource> getAllSources() {
        return sources.values().stream().sorted(Comparator.comparing(DataSource::id)).toList();
    }

    public List<UseCase> getAllUseCases() {
        return useCases.values().stream().sorted(Comparator.comparing(UseCase::id)).toList();
    }

    /**
     * Enabled sources tagged with {@code category}.
     */
    public List<DataSource> getSourcesByCategory(String category) {
        return getAllSources().stream()
                .filter(DataSource::enabled)
                .filter(s -> s.inCategory(category))
                .toList();
    }

    public List<UseCase> getUseCasesByCategory(String category) {
        return getAllUseCases().stream().filter(u -> u.inCategory(category)).toList();
    }

    public DataSource setEnabled(String id, boolean enabled) {
        DataSource updated = sources.computeIfPresent(id, (key, current) -> current.withEnabled(enabled));
        if (updated == null) {
            throw new ConfigurationException("Source " + id + " not found");
        }
        log.info("Data source id={} enabled={}", id, enabled);
        return updated;
    }
}

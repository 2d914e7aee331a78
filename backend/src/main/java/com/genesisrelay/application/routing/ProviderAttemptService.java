/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.infrastructure.persistence.entity.ProviderAttemptEntity;
import com.genesisrelay.infrastructure.persistence.repository.ProviderAttemptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class ProviderAttemptService implements ProviderAttemptRecorder {
    private static final Logger log = LoggerFactory.getLogger(ProviderAttemptService.class);
    static final int MAX_SEARCH_RESULTS = 500;

    private final ProviderAttemptRepository repository;

    public ProviderAttemptService(ProviderAttemptRepository repository) {
        this.repository = repository;
    }

    @Override
    public void record(ProviderAttempt attempt) {
        ProviderAttemptEntity entity = new ProviderAttemptEntity();
        entity.setRequestId(attempt.requestId());
        entity.setProviderId(attempt.providerId());
        entity.setRequestType(attempt.requestType());
        entity.setOutcome(attempt.outcome());
        entity.setErrorType(attempt.errorType());
        entity.setLatencyMs(attempt.latencyMs());
        entity.setCreatedAt(attempt.createdAt());
        try {
            repository.save(entity);
        } catch (DataAccessException e) {
            log.warn("Failed to record provider attempt provider={} outcome={}: {}",
                    attempt.providerId(), attempt.outcome(), e.getMessage());
        }
    }

    public List<ProviderAttempt> search(Instant from, Instant to, String providerId, int limit) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        int size = Math.max(1, Math.min(limit, MAX_SEARCH_RESULTS));
        String provider = providerId == null || providerId.isBlank() ? null : providerId;
        return repository.search(from, to, provider, PageRequest.of(0, size)).stream()
                .map(ProviderAttemptService::toAttempt)
                .toList();
    }

    private static ProviderAttempt toAttempt(ProviderAttemptEntity e) {
        return new ProviderAttempt(
                e.getRequestId(),
                e.getProviderId(),
                e.getRequestType(),
                e.getOutcome(),
                e.getErrorType(),
                e.getLatencyMs(),
                e.getCreatedAt()
        );
    }
}

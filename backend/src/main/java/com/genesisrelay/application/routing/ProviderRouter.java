/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.application.ProviderAdapterRegistry;
import com.genesisrelay.application.resilience.CircuitBreaker;
import com.genesisrelay.application.resilience.CircuitBreakerManager;
import com.genesisrelay.application.resilience.CircuitOpenException;
import com.genesisrelay.config.AppProperties;
import com.genesisrelay.config.RequestIdFilter;
import com.genesisrelay.domain.model.AttemptOutcome;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.domain.model.Urgency;
import com.genesisrelay.infrastructure.provider.AiProviderAdapter;
import com.genesisrelay.infrastructure.provider.ChunkStream;
import com.genesisrelay.infrastructure.provider.ProviderDescriptor;
import com.genesisrelay.infrastructure.provider.ProviderErrorType;
import com.genesisrelay.infrastructure.provider.ProviderException;
import com.genesisrelay.infrastructure.provider.ProviderInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Sends an AI request to the best available provider and falls back down the candidate list
 * until one of them produces a first chunk.
 * <p>
 * Each candidate runs through its own circuit breaker. Everything that goes wrong before the first
 * chunk (open breaker, HTTP error, timeout, empty stream) is logged, audited and skipped; only when
 * every candidate has failed does the caller see an {@link ExhaustedFallbackException}.
 */
@Service
public class ProviderRouter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);
    static final int DEFAULT_OUTPUT_TOKENS = 2000;
    static final double DEFAULT_TEMPERATURE = 0.7;

    private final RoutingTable routingTable;
    private final ProviderAdapterRegistry adapters;
    private final CircuitBreakerManager breakers;
    private final RequestClassifier classifier;
    private final ProviderAttemptRecorder attempts;
    private final ExecutorService providerCallExecutor;
    private final AppProperties.Routing routing;
    private final Clock clock;

    public ProviderRouter(
            RoutingTable routingTable,
            ProviderAdapterRegistry adapters,
            CircuitBreakerManager breakers,
            RequestClassifier classifier,
            ProviderAttemptRecorder attempts,
            @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
            AppProperties properties,
            Clock clock
    ) {
        this.routingTable = routingTable;
        this.adapters = adapters;
        this.breakers = breakers;
        this.classifier = classifier;
        this.attempts = attempts;
        this.providerCallExecutor = providerCallExecutor;
        this.routing = properties.routingOrDefaults();
        this.clock = clock;
    }

    public RoutedResponse route(AiRequest request) {
        RequestType type = classifier.classify(request);
        String prompt = request.fullPrompt();
        List<ProviderDescriptor> candidates = routingTable.candidatesFor(type, request.quality(), RoutingTable.estimateTokens(prompt));
        Duration budget = callBudget(request);
        String requestId = RequestIdFilter.currentRequestId();

        if (candidates.isEmpty()) {
            log.warn("No AI provider can serve type={} quality={}", type, request.quality());
            throw new ExhaustedFallbackException(type, null, "no eligible provider", 0, null);
        }

        String lastProvider = null;
        String lastReason = null;
        RuntimeException lastError = null;
        int tried = 0;

        for (ProviderDescriptor candidate : candidates) {
            tried++;
            CircuitBreaker breaker = breakers.getBreaker(candidate.breakerName());
            ProviderInvocation invocation = invocationFor(request, type, candidate, prompt);
            long started = System.nanoTime();
            long deadline = started + budget.toNanos();
            try {
                ChunkStream stream = breaker.execute(() -> open(candidate, invocation, deadline));
                audit(requestId, candidate, type, AttemptOutcome.SUCCEEDED, null, started);
                log.info("Routed type={} to provider={} attempt={}/{}", type, candidate.id(), tried, candidates.size());
                return new RoutedResponse(candidate.id(), invocation.modelHint(), type, stream,
                        interrupted -> audit(requestId, candidate, type, AttemptOutcome.FAILED,
                                ProviderErrorType.STREAM_INTERRUPTED.name(), started));
            } catch (CircuitOpenException e) {
                log.debug("Skipping provider={} breaker OPEN until {}", candidate.id(), e.getNextAttemptTime());
                audit(requestId, candidate, type, AttemptOutcome.SKIPPED_OPEN, "CIRCUIT_OPEN", started);
                lastReason = "circuit open";
                lastError = e;
            } catch (ProviderException e) {
                log.warn("Provider failed provider={} type={} error={}: {}", candidate.id(), type, e.getType(), e.getMessage());
                audit(requestId, candidate, type, AttemptOutcome.FAILED, e.getType().name(), started);
                lastReason = e.getType() + ": " + e.getMessage();
                lastError = e;
            } catch (RuntimeException e) {
                log.warn("Provider failed provider={} type={}: {}", candidate.id(), type, e.toString());
                audit(requestId, candidate, type, AttemptOutcome.FAILED, ProviderErrorType.UNKNOWN.name(), started);
                lastReason = e.getClass().getSimpleName() + ": " + e.getMessage();
                lastError = e;
            }
            lastProvider = candidate.id();
        }

        log.warn("All AI providers failed type={} attempts={} last={}", type, tried, lastProvider);
        throw new ExhaustedFallbackException(type, lastProvider, lastReason, tried, lastError);
    }

    /**
     * Starts the call and waits for its first chunk. An empty stream counts as a failed call.
     */
    private ChunkStream open(ProviderDescriptor provider, ProviderInvocation invocation, long deadlineNanos) {
        AiProviderAdapter adapter = adapters.getRequired(provider.kind());
        ChunkStream guarded = new DeadlineChunkStream(adapter.invoke(provider, invocation), providerCallExecutor,
                deadlineNanos, provider.id());
        boolean hasFirst;
        try {
            hasFirst = guarded.hasNext();
        } catch (RuntimeException e) {
            guarded.close();
            throw e;
        }
        if (!hasFirst) {
            guarded.close();
            throw new ProviderException(provider.id(), ProviderErrorType.EMPTY_RESPONSE, provider.id() + " returned no content");
        }
        return guarded;
    }

    Duration callBudget(AiRequest request) {
        Duration budget = routing.providerTimeoutOrDefault();
        if (request.timeout() != null && request.timeout().compareTo(budget) < 0) {
            budget = request.timeout();
        }
        if (request.urgency() == Urgency.HIGH && routing.urgentTimeoutOrDefault().compareTo(budget) < 0) {
            budget = routing.urgentTimeoutOrDefault();
        }
        return budget;
    }

    private static ProviderInvocation invocationFor(AiRequest request, RequestType type, ProviderDescriptor provider, String prompt) {
        int requested = request.maxTokens() == null ? DEFAULT_OUTPUT_TOKENS : request.maxTokens();
        return new ProviderInvocation(
                prompt,
                SystemPrompts.forType(type),
                provider.model(),
                Math.min(requested, provider.maxTokens()),
                request.temperature() == null ? DEFAULT_TEMPERATURE : request.temperature()
        );
    }

    private void audit(String requestId, ProviderDescriptor provider, RequestType type, AttemptOutcome outcome,
                       String errorType, long startedNanos) {
        long latencyMs = Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
        try {
            attempts.record(new ProviderAttempt(requestId, provider.id(), type, outcome, errorType, latencyMs, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Attempt audit failed provider={}: {}", provider.id(), e.toString());
        }
    }
}

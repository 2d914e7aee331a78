/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.config;

import com.genesisrelay.application.resilience.CircuitBreakerConfig;
import com.genesisrelay.domain.model.AuthType;
import com.genesisrelay.domain.model.ProviderKind;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.domain.model.SourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Resilience resilience,
        Routing routing,
        List<Provider> providers,
        Sources sources
) {
    public Resilience resilienceOrDefaults() {
        return resilience == null ? new Resilience(null, null, null, null, null) : resilience;
    }

    public Routing routingOrDefaults() {
        return routing == null ? new Routing(null, null) : routing;
    }

    public List<Provider> providersOrEmpty() {
        return providers == null ? List.of() : providers;
    }

    public Sources sourcesOrDefaults() {
        return sources == null ? new Sources(null, null, null, null, null) : sources;
    }

    public record Resilience(
            Integer failureThreshold,
            Duration resetTimeout,
            Duration monitoringPeriod,
            Integer halfOpenMaxCalls,
            Set<String> criticalBreakers
    ) {
        public CircuitBreakerConfig toBreakerConfig() {
            return new CircuitBreakerConfig(
                    failureThreshold == null ? CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD : failureThreshold,
                    resetTimeout == null ? CircuitBreakerConfig.DEFAULT_RESET_TIMEOUT : resetTimeout,
                    monitoringPeriod == null ? CircuitBreakerConfig.DEFAULT_MONITORING_PERIOD : monitoringPeriod,
                    halfOpenMaxCalls == null ? CircuitBreakerConfig.DEFAULT_HALF_OPEN_MAX_CALLS : halfOpenMaxCalls
            );
        }

        public Set<String> criticalBreakersOrDefault() {
            return criticalBreakers == null ? Set.of("ai-router", "chat") : Set.copyOf(criticalBreakers);
        }
    }

    public record Routing(Duration providerTimeout, Duration urgentTimeout) {
        public Duration providerTimeoutOrDefault() {
            return providerTimeout == null ? Duration.ofSeconds(30) : providerTimeout;
        }

        public Duration urgentTimeoutOrDefault() {
            return urgentTimeout == null ? Duration.ofSeconds(10) : urgentTimeout;
        }
    }

    public record Provider(
            String id,
            String name,
            ProviderKind kind,
            String baseUrl,
            String apiKey,
            String model,
            Set<RequestType> priorityClasses,
            Integer priority,
            Double costPerToken,
            Integer maxTokens,
            Boolean premium,
            Boolean enabled
    ) {}

    public record Sources(
            Duration cacheTtl,
            Long cacheMaxEntries,
            Duration callTimeout,
            List<Source> catalog,
            List<UseCase> useCases
    ) {
        public Duration cacheTtlOrDefault() {
            return cacheTtl == null ? Duration.ofMillis(300_000) : cacheTtl;
        }

        public long cacheMaxEntriesOrDefault() {
            return cacheMaxEntries == null ? 1_000L : cacheMaxEntries;
        }

        public Duration callTimeoutOrDefault() {
            return callTimeout == null ? Duration.ofSeconds(15) : callTimeout;
        }

        public List<Source> catalogOrEmpty() {
            return catalog == null ? List.of() : catalog;
        }

        public List<UseCase> useCasesOrEmpty() {
            return useCases == null ? List.of() : useCases;
        }
    }

    public record Source(
            String id,
            String name,
            SourceType type,
            String url,
            String description,
            AuthType authType,
            String apiKey,
            Double rateLimit,
            Boolean enabled,
            List<String> categories,
            Map<String, String> headers
    ) {}

    public record UseCase(
            String id,
            String name,
            String description,
            List<String> categories,
            List<String> sources,
            String queryTemplate,
            List<String> examples
    ) {}
}

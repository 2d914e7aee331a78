/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genesisrelay.config.AppProperties;
import com.genesisrelay.domain.model.AuthType;
import com.genesisrelay.infrastructure.http.SourceHttpClient;
import com.genesisrelay.infrastructure.http.SourceRequest;
import com.genesisrelay.infrastructure.http.SourceResponse;
import com.genesisrelay.infrastructure.http.SourceTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for calls to registered data sources.
 * <p>
 * Order of checks: registry, rate limit, cache, network. A rate-limited call never reaches the
 * cache or the network, and a cache hit never reaches the network. Only successful responses are
 * cached.
 */
@Service
public class RateLimitedCacheGateway {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedCacheGateway.class);

    private final SourceRegistry registry;
    private final SourceRateLimiter rateLimiter;
    private final ResponseCache cache;
    private final SourceHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;

    public RateLimitedCacheGateway(
            SourceRegistry registry,
            SourceRateLimiter rateLimiter,
            ResponseCache cache,
            SourceHttpClient httpClient,
            ObjectMapper objectMapper,
            AppProperties properties
    ) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.callTimeout = properties.sourcesOrDefaults().callTimeoutOrDefault();
    }

    public JsonNode call(String sourceId, String endpoint, Map<String, String> params) {
        return call(sourceId, endpoint, params, CallOptions.get());
    }

    public JsonNode call(String sourceId, String endpoint, Map<String, String> params, CallOptions options) {
        CallOptions opts = options == null ? CallOptions.get() : options;
        Map<String, String> query = params == null ? Map.of() : params;
        String path = endpoint == null ? "" : endpoint;

        DataSource source = registry.getSource(sourceId)
                .filter(DataSource::enabled)
                .orElseThrow(() -> new ConfigurationException("Source " + sourceId + " not available"));

        rateLimiter.acquire(source.id(), source.rateLimit());

        JsonNode body = requestBody(opts, query);
        String key = ResponseCache.keyOf(source.id(), opts.method().name(), path, query, body);
        Optional<JsonNode> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit source={} endpoint={}", source.id(), path);
            return cached.get();
        }

        SourceRequest request = new SourceRequest(opts.method(), buildUri(source, path, opts.method(), query),
                headersFor(source, opts), body, callTimeout);
        SourceResponse response;
        try {
            response = httpClient.exchange(request);
        } catch (SourceTransportException e) {
            throw new DependencyException(source.id(), null, "Call to " + source.id() + " failed: " + e.getMessage(), e);
        }
        if (!response.isSuccess()) {
            log.warn("Source call failed source={} endpoint={} status={}", source.id(), path, response.status());
            throw new DependencyException(source.id(), response.status(),
                    "Call to " + source.id() + " failed with status " + response.status(), null);
        }

        cache.put(key, response.body());
        return response.body();
    }

    private JsonNode requestBody(CallOptions opts, Map<String, String> params) {
        if (opts.method() == HttpMethod.GET) return null;
        if (opts.body() != null) return opts.body();
        return params.isEmpty() ? null : objectMapper.valueToTree(params);
    }

    private static URI buildUri(DataSource source, String endpoint, HttpMethod method, Map<String, String> params) {
        if (source.baseUrl() == null || source.baseUrl().isBlank()) {
            throw new ConfigurationException("Source " + source.id() + " has no URL");
        }
        UriComponentsBuilder builder;
        try {
            builder = UriComponentsBuilder.fromHttpUrl(source.baseUrl() + endpoint);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Source " + source.id() + " has an invalid URL");
        }
        if (method == HttpMethod.GET) {
            params.forEach(builder::queryParam);
        }
        return builder.encode().build().toUri();
    }

    private static Map<String, String> headersFor(DataSource source, CallOptions opts) {
        Map<String, String> headers = new LinkedHashMap<>(opts.headers());
        headers.putAll(source.headers());
        if (source.authType() != AuthType.NONE) {
            if (source.apiKey() == null || source.apiKey().isBlank()) {
                throw new ConfigurationException("Source " + source.id() + " requires credentials for " + source.authType());
            }
            headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + source.apiKey());
        }
        return headers;
    }
}

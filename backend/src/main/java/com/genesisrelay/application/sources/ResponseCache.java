/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genesisrelay.config.AppProperties;
import com.genesisrelay.infrastructure.crypto.Sha256;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Bounded TTL cache of parsed source responses. Expiry follows the injected clock.
 */
@Component
public class ResponseCache {
    private final Cache<String, JsonNode> cache;

    @Autowired
    public ResponseCache(AppProperties properties, Clock clock) {
        this(properties.sourcesOrDefaults().cacheTtlOrDefault(), properties.sourcesOrDefaults().cacheMaxEntriesOrDefault(), clock);
    }

    public ResponseCache(Duration ttl, long maxEntries, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    /**
     * Params are encoded as a JSON object with sorted keys, so values containing separators
     * cannot collide with other param sets.
     */
    public static String keyOf(String sourceId, String method, String endpoint, Map<String, String> params, JsonNode body) {
        ObjectNode canonicalParams = JsonNodeFactory.instance.objectNode();
        if (params != null) {
            new TreeMap<>(params).forEach(canonicalParams::put);
        }
        return Sha256.hexOfParts(sourceId, method, endpoint, canonicalParams.toString(), body == null ? "" : body.toString());
    }

    /**
     * Returns a copy; the cached entry itself is never handed out.
     */
    public Optional<JsonNode> get(String key) {
        JsonNode cached = cache.getIfPresent(key);
        return cached == null ? Optional.empty() : Optional.of(cached.deepCopy());
    }

    public void put(String key, JsonNode value) {
        cache.put(key, value.deepCopy());
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }
}

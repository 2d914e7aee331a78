/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * @param headers extra request headers; the source's own headers and the auth header win on conflict
 * @param body    JSON body for non-GET calls; when absent the params are sent as the body
 */
public record CallOptions(HttpMethod method, Map<String, String> headers, JsonNode body) {
    public CallOptions {
        method = method == null ? HttpMethod.GET : method;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static CallOptions get() {
        return new CallOptions(HttpMethod.GET, Map.of(), null);
    }
}

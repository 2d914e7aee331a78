/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

public record SourceRequest(HttpMethod method, URI uri, Map<String, String> headers, JsonNode body, Duration timeout) {
    public SourceRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}

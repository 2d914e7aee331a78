/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class WebClientSourceHttpClient implements SourceHttpClient {
    private static final Logger log = LoggerFactory.getLogger(WebClientSourceHttpClient.class);

    private final WebClient outboundWebClient;
    private final ObjectMapper objectMapper;

    public WebClientSourceHttpClient(WebClient outboundWebClient, ObjectMapper objectMapper) {
        this.outboundWebClient = outboundWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceResponse exchange(SourceRequest request) {
        WebClient.RequestBodySpec spec = outboundWebClient.method(request.method())
                .uri(request.uri())
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> request.headers().forEach(h::set));
        WebClient.RequestHeadersSpec<?> ready = request.body() == null
                ? spec
                : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.body());

        RawResponse raw;
        try {
            raw = ready.exchangeToMono(res -> res.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new RawResponse(res.statusCode().value(), text)))
                    .timeout(request.timeout())
                    .block();
        } catch (RuntimeException e) {
            log.warn("Source call failed uri={} error={}", request.uri().getHost(), e.toString());
            throw new SourceTransportException("Request to " + request.uri().getHost() + " failed", e);
        }
        if (raw == null) {
            throw new SourceTransportException("No response from " + request.uri().getHost(), null);
        }
        if (raw.status() < 200 || raw.status() >= 300) {
            return new SourceResponse(raw.status(), null);
        }
        return new SourceResponse(raw.status(), parse(raw.text(), request));
    }

    private JsonNode parse(String text, SourceRequest request) {
        if (text.isBlank()) return NullNode.getInstance();
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new SourceTransportException("Response from " + request.uri().getHost() + " is not valid JSON", e);
        }
    }

    private record RawResponse(int status, String text) {}
}

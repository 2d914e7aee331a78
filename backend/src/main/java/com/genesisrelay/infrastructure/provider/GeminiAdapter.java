/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genesisrelay.domain.model.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uses the SSE flavour of {@code streamGenerateContent}; the key travels in a header rather than
 * the query string so it never reaches access logs.
 */
@Service
public class GeminiAdapter implements AiProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(GeminiAdapter.class);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE = new ParameterizedTypeReference<>() {};

    private final WebClient outboundWebClient;
    private final ObjectMapper objectMapper;

    public GeminiAdapter(WebClient outboundWebClient, ObjectMapper objectMapper) {
        this.outboundWebClient = outboundWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.GEMINI;
    }

    @Override
    public ChunkStream invoke(ProviderDescriptor provider, ProviderInvocation invocation) {
        ProviderErrors.requireConfigured(provider);
        String providerId = provider.id();
        String model = invocation.modelHint() != null ? invocation.modelHint() : provider.model();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", invocation.prompt()))
        )));
        if (invocation.systemPrompt() != null && !invocation.systemPrompt().isBlank()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", invocation.systemPrompt()))));
        }
        body.put("generationConfig", Map.of(
                "maxOutputTokens", invocation.maxTokens(),
                "temperature", invocation.temperature()
        ));

        Flux<String> chunks = outboundWebClient.post()
                .uri(provider.baseUrl() + "/models/{model}:streamGenerateContent?alt=sse", model)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .header("x-goog-api-key", provider.apiKey())
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class).defaultIfEmpty("").flatMap(b -> Mono.error(
                        ProviderErrors.forStatus(providerId, res.statusCode().value()))))
                .bodyToFlux(SSE)
                .mapNotNull(ServerSentEvent::data)
                .map(data -> extractText(providerId, data))
                .onErrorMap(e -> ProviderErrors.map(providerId, e));

        return new FluxChunkStream(providerId, chunks);
    }

    private String extractText(String providerId, String data) {
        try {
            JsonNode parts = objectMapper.readTree(data).path("candidates").path(0).path("content").path("parts");
            StringBuilder text = new StringBuilder();
            for (JsonNode part : parts) {
                text.append(part.path("text").asText(""));
            }
            return text.toString();
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed chunk provider={} error={}", providerId, e.getOriginalMessage());
            return "";
        }
    }
}

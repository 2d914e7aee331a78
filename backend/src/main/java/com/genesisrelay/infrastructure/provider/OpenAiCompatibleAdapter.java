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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions streaming for OpenAI and the providers that copy its wire format
 * (DeepSeek, self-hosted gateways).
 */
@Service
public class OpenAiCompatibleAdapter implements AiProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleAdapter.class);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE = new ParameterizedTypeReference<>() {};
    private static final String DONE = "[DONE]";

    private final WebClient outboundWebClient;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleAdapter(WebClient outboundWebClient, ObjectMapper objectMapper) {
        this.outboundWebClient = outboundWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OPENAI_COMPATIBLE;
    }

    @Override
    public ChunkStream invoke(ProviderDescriptor provider, ProviderInvocation invocation) {
        ProviderErrors.requireConfigured(provider);
        String providerId = provider.id();

        List<Map<String, String>> messages = new ArrayList<>();
        if (invocation.systemPrompt() != null && !invocation.systemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", invocation.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", invocation.prompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", invocation.modelHint() != null ? invocation.modelHint() : provider.model());
        body.put("messages", messages);
        body.put("max_tokens", invocation.maxTokens());
        body.put("temperature", invocation.temperature());
        body.put("stream", true);

        Flux<String> chunks = outboundWebClient.post()
                .uri(provider.baseUrl() + "/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .headers(h -> h.setBearerAuth(provider.apiKey()))
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class).defaultIfEmpty("").flatMap(b -> Mono.error(
                        ProviderErrors.forStatus(providerId, res.statusCode().value()))))
                .bodyToFlux(SSE)
                .mapNotNull(ServerSentEvent::data)
                .takeWhile(data -> !DONE.equals(data.trim()))
                .map(data -> extractDelta(providerId, data))
                .onErrorMap(e -> ProviderErrors.map(providerId, e));

        return new FluxChunkStream(providerId, chunks);
    }

    private String extractDelta(String providerId, String data) {
        try {
            JsonNode node = objectMapper.readTree(data);
            return node.path("choices").path(0).path("delta").path("content").asText("");
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed chunk provider={} error={}", providerId, e.getOriginalMessage());
            return "";
        }
    }
}

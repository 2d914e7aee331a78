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

@Service
public class AnthropicAdapter implements AiProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(AnthropicAdapter.class);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE = new ParameterizedTypeReference<>() {};
    static final String API_VERSION = "2023-06-01";

    private final WebClient outboundWebClient;
    private final ObjectMapper objectMapper;

    public AnthropicAdapter(WebClient outboundWebClient, ObjectMapper objectMapper) {
        this.outboundWebClient = outboundWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ANTHROPIC;
    }

    @Override
    public ChunkStream invoke(ProviderDescriptor provider, ProviderInvocation invocation) {
        ProviderErrors.requireConfigured(provider);
        String providerId = provider.id();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", invocation.modelHint() != null ? invocation.modelHint() : provider.model());
        body.put("max_tokens", invocation.maxTokens());
        body.put("temperature", invocation.temperature());
        if (invocation.systemPrompt() != null && !invocation.systemPrompt().isBlank()) {
            body.put("system", invocation.systemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", invocation.prompt())));
        body.put("stream", true);

        Flux<String> chunks = outboundWebClient.post()
                .uri(provider.baseUrl() + "/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .header("x-api-key", provider.apiKey())
                .header("anthropic-version", API_VERSION)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, res -> res.bodyToMono(String.class).defaultIfEmpty("").flatMap(b -> Mono.error(
                        ProviderErrors.forStatus(providerId, res.statusCode().value()))))
                .bodyToFlux(SSE)
                .mapNotNull(ServerSentEvent::data)
                .map(data -> readEvent(providerId, data))
                .takeWhile(event -> !"message_stop".equals(event.path("type").asText()))
                .map(event -> textOf(providerId, event))
                .onErrorMap(e -> ProviderErrors.map(providerId, e));

        return new FluxChunkStream(providerId, chunks);
    }

    private JsonNode readEvent(String providerId, String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed event provider={} error={}", providerId, e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private String textOf(String providerId, JsonNode event) {
        String type = event.path("type").asText();
        if ("error".equals(type)) {
            String errorType = event.path("error").path("type").asText("unknown");
            ProviderErrorType mapped = "overloaded_error".equals(errorType) || "api_error".equals(errorType)
                    ? ProviderErrorType.HTTP_5XX
                    : ProviderErrorType.UNKNOWN;
            throw new ProviderException(providerId, mapped, providerId + " stream error: " + errorType);
        }
        if ("content_block_delta".equals(type)) {
            return event.path("delta").path("text").asText("");
        }
        return "";
    }
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genesisrelay.domain.model.ProviderKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StreamingAdaptersTest {
    private static final ProviderInvocation INVOCATION = new ProviderInvocation("hello", "be brief", null, 256, 0.7);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void openAiStreamStopsAtDoneMarker() {
        WebClient client = respondingWith(HttpStatus.OK, """
                data: {"choices":[{"delta":{"role":"assistant"}}]}

                data: {"choices":[{"delta":{"content":"Hel"}}]}

                data: {"choices":[{"delta":{"content":"lo"}}]}

                data: [DONE]

                data: {"choices":[{"delta":{"content":"ignored"}}]}

                """);
        OpenAiCompatibleAdapter adapter = new OpenAiCompatibleAdapter(client, objectMapper);

        List<String> chunks = drain(adapter.invoke(provider(ProviderKind.OPENAI_COMPATIBLE), INVOCATION));

        assertEquals(List.of("Hel", "lo"), chunks);
        ClientRequest sent = lastRequest.get();
        assertEquals("https://llm.example/v1/chat/completions", sent.url().toString());
        assertEquals("Bearer k-123", sent.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void anthropicStreamKeepsTextDeltasOnly() {
        WebClient client = respondingWith(HttpStatus.OK, """
                event: message_start
                data: {"type":"message_start","message":{}}

                event: content_block_delta
                data: {"type":"content_block_delta","delta":{"type":"text_delta","text":"Hi"}}

                event: ping
                data: {"type":"ping"}

                event: content_block_delta
                data: {"type":"content_block_delta","delta":{"type":"text_delta","text":" there"}}

                event: message_stop
                data: {"type":"message_stop"}

                """);
        AnthropicAdapter adapter = new AnthropicAdapter(client, objectMapper);

        List<String> chunks = drain(adapter.invoke(provider(ProviderKind.ANTHROPIC), INVOCATION));

        assertEquals(List.of("Hi", " there"), chunks);
        ClientRequest sent = lastRequest.get();
        assertEquals("https://llm.example/v1/messages", sent.url().toString());
        assertEquals("k-123", sent.headers().getFirst("x-api-key"));
        assertEquals(AnthropicAdapter.API_VERSION, sent.headers().getFirst("anthropic-version"));
    }

    @Test
    void anthropicOverloadedEventFailsAsServerError() {
        WebClient client = respondingWith(HttpStatus.OK, """
                data: {"type":"content_block_delta","delta":{"text":"partial"}}

                data: {"type":"error","error":{"type":"overloaded_error","message":"busy"}}

                """);
        AnthropicAdapter adapter = new AnthropicAdapter(client, objectMapper);

        ChunkStream stream = adapter.invoke(provider(ProviderKind.ANTHROPIC), INVOCATION);
        assertEquals("partial", stream.next());
        ProviderException ex = assertThrows(ProviderException.class, stream::hasNext);
        assertEquals(ProviderErrorType.HTTP_5XX, ex.getType());
    }

    @Test
    void geminiJoinsPartsAndSendsKeyAsHeader() {
        WebClient client = respondingWith(HttpStatus.OK, """
                data: {"candidates":[{"content":{"parts":[{"text":"Bon"},{"text":"jour"}]}}]}

                data: {"candidates":[{"content":{"parts":[{"text":"!"}]}}]}

                """);
        GeminiAdapter adapter = new GeminiAdapter(client, objectMapper);

        List<String> chunks = drain(adapter.invoke(provider(ProviderKind.GEMINI), INVOCATION));

        assertEquals(List.of("Bonjour", "!"), chunks);
        ClientRequest sent = lastRequest.get();
        assertEquals("https://llm.example/v1/models/test-model:streamGenerateContent?alt=sse", sent.url().toString());
        assertEquals("k-123", sent.headers().getFirst("x-goog-api-key"));
        assertFalse(sent.url().toString().contains("key="));
    }

    @Test
    void errorStatusesMapToProviderErrorTypes() {
        assertEquals(ProviderErrorType.RATE_LIMITED, failureFor(HttpStatus.TOO_MANY_REQUESTS).getType());
        assertEquals(ProviderErrorType.HTTP_5XX, failureFor(HttpStatus.BAD_GATEWAY).getType());
        assertEquals(ProviderErrorType.TIMEOUT, failureFor(HttpStatus.GATEWAY_TIMEOUT).getType());

        ProviderException unauthorized = failureFor(HttpStatus.UNAUTHORIZED);
        assertEquals(ProviderErrorType.HTTP_4XX, unauthorized.getType());
        assertEquals(401, unauthorized.getStatus());
        assertEquals("llm", unauthorized.getProviderId());
    }

    @Test
    void transportTimeoutIsReportedAsTimeout() {
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new IllegalStateException("read failed", new TimeoutException("read timed out"))))
                .build();
        OpenAiCompatibleAdapter adapter = new OpenAiCompatibleAdapter(client, objectMapper);

        ChunkStream stream = adapter.invoke(provider(ProviderKind.OPENAI_COMPATIBLE), INVOCATION);
        ProviderException ex = assertThrows(ProviderException.class, stream::hasNext);
        assertEquals(ProviderErrorType.TIMEOUT, ex.getType());
    }

    @Test
    void unconfiguredProviderFailsBeforeAnyCall() {
        OpenAiCompatibleAdapter adapter = new OpenAiCompatibleAdapter(respondingWith(HttpStatus.OK, ""), objectMapper);
        ProviderDescriptor noKey = new ProviderDescriptor("llm", "LLM", ProviderKind.OPENAI_COMPATIBLE,
                "https://llm.example/v1", " ", "test-model", Set.of(), 1, 0.0, 1000, false, true);

        ProviderException ex = assertThrows(ProviderException.class, () -> adapter.invoke(noKey, INVOCATION));

        assertEquals(ProviderErrorType.NOT_CONFIGURED, ex.getType());
        assertNull(lastRequest.get());
    }

    private ProviderException failureFor(HttpStatus status) {
        OpenAiCompatibleAdapter adapter = new OpenAiCompatibleAdapter(respondingWith(status, ""), objectMapper);
        ChunkStream stream = adapter.invoke(provider(ProviderKind.OPENAI_COMPATIBLE), INVOCATION);
        ProviderException ex = assertThrows(ProviderException.class, stream::hasNext);
        assertFalse(stream.hasNext());
        return ex;
    }

    private WebClient respondingWith(HttpStatus status, String body) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "text/event-stream")
                            .body(body)
                            .build());
                })
                .build();
    }

    private static ProviderDescriptor provider(ProviderKind kind) {
        return new ProviderDescriptor("llm", "LLM", kind, "https://llm.example/v1", "k-123", "test-model",
                Set.of(), 1, 0.0, 100_000, false, true);
    }

    private static List<String> drain(ChunkStream stream) {
        List<String> out = new ArrayList<>();
        try (stream) {
            stream.forEachRemaining(out::add);
        }
        return out;
    }
}

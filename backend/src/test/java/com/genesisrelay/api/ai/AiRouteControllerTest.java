/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genesisrelay.application.resilience.CircuitBreakerManager;
import com.genesisrelay.application.routing.AiRequest;
import com.genesisrelay.application.routing.ExhaustedFallbackException;
import com.genesisrelay.application.routing.ProviderRouter;
import com.genesisrelay.application.routing.RoutedResponse;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.infrastructure.provider.ChunkStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class AiRouteControllerTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CircuitBreakerManager breakers;

    @MockBean
    private ProviderRouter router;

    @AfterEach
    void resetBreakers() {
        breakers.resetAll();
    }

    @Test
    void streamsChunksWithProviderHeaders() {
        when(router.route(any())).thenReturn(new RoutedResponse(
                "anthropic-claude-3-opus", "claude-3-opus", RequestType.CULTURAL,
                ChunkStream.of(List.of("Hello ", "from ", "the archive")), e -> { }));

        ResponseEntity<String> res = restTemplate.postForEntity(
                "/api/ai/route",
                Map.of("prompt", "Tell me about Yoruba naming traditions", "quality", "PREMIUM", "maxTokens", 500),
                String.class
        );

        assertEquals(HttpStatus.OK, res.getStatusCode());
        assertEquals("Hello from the archive", res.getBody());
        assertEquals("anthropic-claude-3-opus", res.getHeaders().getFirst("X-Provider"));
        assertEquals("claude-3-opus", res.getHeaders().getFirst("X-Model"));
        assertEquals("CULTURAL", res.getHeaders().getFirst("X-Request-Type"));

        ArgumentCaptor<AiRequest> captor = ArgumentCaptor.forClass(AiRequest.class);
        verify(router).route(captor.capture());
        assertEquals(500, captor.getValue().maxTokens());
    }

    @Test
    void exhaustedFallbackIsServiceUnavailable() throws Exception {
        when(router.route(any())).thenThrow(new ExhaustedFallbackException(RequestType.CHAT, "openai-gpt4-turbo", "TIMEOUT", 2, null));

        ResponseEntity<String> res = restTemplate.postForEntity("/api/ai/route", Map.of("prompt", "hi"), String.class);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, res.getStatusCode());
        assertEquals("EXHAUSTED_FALLBACK", objectMapper.readTree(res.getBody()).path("code").asText());
    }

    @Test
    void repeatedExhaustionOpensTheRouterBreaker() throws Exception {
        when(router.route(any())).thenThrow(new ExhaustedFallbackException(RequestType.CHAT, null, "NO_CANDIDATES", 0, null));

        for (int i = 0; i < 5; i++) {
            restTemplate.postForEntity("/api/ai/route", Map.of("prompt", "hi"), String.class);
        }
        ResponseEntity<String> res = restTemplate.postForEntity("/api/ai/route", Map.of("prompt", "hi"), String.class);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, res.getStatusCode());
        JsonNode body = objectMapper.readTree(res.getBody());
        assertEquals("CIRCUIT_OPEN", body.path("code").asText());
        assertNotNull(res.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));

        JsonNode health = objectMapper.readTree(restTemplate.getForEntity("/actuator/health", String.class).getBody());
        assertEquals("DOWN", health.path("components").path("breakers").path("status").asText());
    }

    @Test
    void blankPromptIsRejected() throws Exception {
        ResponseEntity<String> res = restTemplate.postForEntity("/api/ai/route", Map.of("prompt", ""), String.class);

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("VALIDATION_ERROR", objectMapper.readTree(res.getBody()).path("code").asText());
    }
}

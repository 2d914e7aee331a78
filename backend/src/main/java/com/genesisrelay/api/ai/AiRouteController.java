/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.ai;

import com.genesisrelay.application.resilience.CircuitBreakerManager;
import com.genesisrelay.application.routing.ProviderRouter;
import com.genesisrelay.application.routing.RoutedResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Streams the answer of the first AI provider that responds. The whole routing step runs through
 * the {@value #ROUTER_BREAKER} breaker, so repeated exhaustion short-circuits further requests.
 */
@RestController
@RequestMapping("/api/ai")
public class AiRouteController {
    private static final Logger log = LoggerFactory.getLogger(AiRouteController.class);
    static final String ROUTER_BREAKER = "ai-router";

    private final ProviderRouter router;
    private final CircuitBreakerManager breakers;

    public AiRouteController(ProviderRouter router, CircuitBreakerManager breakers) {
        this.router = router;
        this.breakers = breakers;
    }

    @PostMapping("/route")
    public ResponseEntity<StreamingResponseBody> route(@Valid @RequestBody AiRouteRequest body) {
        RoutedResponse response = breakers.getBreaker(ROUTER_BREAKER).execute(() -> router.route(body.toAiRequest()));

        StreamingResponseBody stream = out -> writeChunks(response, out);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header("X-Provider", response.providerId())
                .header("X-Model", response.model() == null ? "" : response.model())
                .header("X-Request-Type", response.requestType().name())
                .body(stream);
    }

    private static void writeChunks(RoutedResponse response, OutputStream out) throws IOException {
        try (response) {
            while (response.hasNext()) {
                out.write(response.next().getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (IOException e) {
            log.debug("Client went away provider={}", response.providerId());
            throw e;
        }
    }
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.domain.model.Quality;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.domain.model.Urgency;

import java.time.Duration;

/**
 * @param type    explicit classification; {@code null} lets the router classify by keywords
 * @param timeout caller deadline for the whole stream; {@code null} uses the configured default
 */
public record AiRequest(
        String prompt,
        String context,
        RequestType type,
        Quality quality,
        Urgency urgency,
        Integer maxTokens,
        Double temperature,
        Duration timeout
) {
    public AiRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        if (maxTokens != null && maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be >= 1");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static AiRequest of(String prompt) {
        return new AiRequest(prompt, null, null, null, null, null, null, null);
    }

    public AiRequest withType(RequestType requestType) {
        return new AiRequest(prompt, context, requestType, quality, urgency, maxTokens, temperature, timeout);
    }

    /**
     * Text the provider actually receives: the prompt, preceded by the context when there is one.
     */
    public String fullPrompt() {
        if (context == null || context.isBlank()) return prompt;
        return "Context: " + context + "\n\n" + prompt;
    }
}

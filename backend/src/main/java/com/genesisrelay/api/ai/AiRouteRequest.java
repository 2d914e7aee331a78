/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.ai;

import com.genesisrelay.application.routing.AiRequest;
import com.genesisrelay.domain.model.Quality;
import com.genesisrelay.domain.model.RequestType;
import com.genesisrelay.domain.model.Urgency;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.Duration;

public record AiRouteRequest(
        @NotBlank @Size(max = 100_000) String prompt,
        @Size(max = 100_000) String context,
        String type,
        Quality quality,
        Urgency urgency,
        @Positive Integer maxTokens,
        @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
        @Positive Long timeoutMs
) {
    AiRequest toAiRequest() {
        return new AiRequest(
                prompt,
                context,
                RequestType.fromValue(type),
                quality,
                urgency,
                maxTokens,
                temperature,
                timeoutMs == null ? null : Duration.ofMillis(timeoutMs)
        );
    }
}

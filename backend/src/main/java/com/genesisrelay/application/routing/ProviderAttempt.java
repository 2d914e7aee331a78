/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

import com.genesisrelay.domain.model.AttemptOutcome;
import com.genesisrelay.domain.model.RequestType;

import java.time.Instant;

public record ProviderAttempt(
        String requestId,
        String providerId,
        RequestType requestType,
        AttemptOutcome outcome,
        String errorType,
        long latencyMs,
        Instant createdAt
) {}

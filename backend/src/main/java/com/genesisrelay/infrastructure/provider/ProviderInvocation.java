/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

public record ProviderInvocation(
        String prompt,
        String systemPrompt,
        String modelHint,
        int maxTokens,
        double temperature
) {}

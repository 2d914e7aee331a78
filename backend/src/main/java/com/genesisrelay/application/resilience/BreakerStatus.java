/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import com.genesisrelay.domain.model.CircuitState;

public record BreakerStatus(
        CircuitState state,
        int failureCount
) {}

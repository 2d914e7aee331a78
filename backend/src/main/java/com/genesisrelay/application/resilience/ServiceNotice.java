/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import java.time.Instant;

public record ServiceNotice(
        String service,
        String message,
        Instant createdAt
) {}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.routing;

/**
 * Sink for provider attempts. Implementations must not throw; routing never fails because of auditing.
 */
public interface ProviderAttemptRecorder {
    void record(ProviderAttempt attempt);
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

import com.genesisrelay.domain.model.ProviderKind;

public interface AiProviderAdapter {
    ProviderKind kind();

    /**
     * Starts the call and returns its chunk stream without waiting for the first chunk.
     * Failures may surface here or on the first pull.
     */
    ChunkStream invoke(ProviderDescriptor provider, ProviderInvocation invocation);
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.domain.model;

/**
 * Wire protocol family of an AI provider. One adapter serves every provider of a kind.
 */
public enum ProviderKind {
    OPENAI_COMPATIBLE,
    ANTHROPIC,
    GEMINI
}

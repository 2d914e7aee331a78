/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.provider;

public enum ProviderErrorType {
    TIMEOUT,
    HTTP_5XX,
    HTTP_4XX,
    RATE_LIMITED,
    NOT_CONFIGURED,
    EMPTY_RESPONSE,
    STREAM_INTERRUPTED,
    UNKNOWN
}

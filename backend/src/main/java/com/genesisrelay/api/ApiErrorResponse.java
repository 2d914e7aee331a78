/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api;

/**
 * @param error HTTP status name
 * @param code  stable machine-readable error code
 */
public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param body parsed JSON for 2xx responses; {@code null} otherwise
 */
public record SourceResponse(int status, JsonNode body) {
    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.domain.model;

public enum AuthType {
    NONE,
    API_KEY,
    OAUTH,
    BEARER;

    public boolean requiresCredentials() {
        return this != NONE;
    }
}

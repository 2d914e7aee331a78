/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.domain.model;

import java.util.Locale;

public enum RequestType {
    CHAT,
    ANALYSIS,
    GENERATION,
    CODING,
    BUSINESS,
    CULTURAL,
    CREATIVE,
    TECHNICAL,
    RESEARCH;

    public static RequestType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        return RequestType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

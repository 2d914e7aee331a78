/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.genesisrelay.domain.model.AuthType;
import com.genesisrelay.domain.model.SourceType;

import java.util.List;
import java.util.Map;

/**
 * A registered third-party data source.
 *
 * @param rateLimit calls per second; zero or negative means unlimited
 */
public record DataSource(
        String id,
        String name,
        SourceType type,
        String baseUrl,
        String description,
        AuthType authType,
        String apiKey,
        double rateLimit,
        boolean enabled,
        List<String> categories,
        Map<String, String> headers
) {
    public DataSource {
        type = type == null ? SourceType.API : type;
        authType = authType == null ? AuthType.NONE : authType;
        categories = categories == null ? List.of() : List.copyOf(categories);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public DataSource withEnabled(boolean value) {
        return new DataSource(id, name, type, baseUrl, description, authType, apiKey, rateLimit, value, categories, headers);
    }

    public boolean inCategory(String category) {
        return categories.contains(category);
    }

    public boolean inAnyCategory(List<String> wanted) {
        if (wanted == null || wanted.isEmpty()) return true;
        for (String category : wanted) {
            if (categories.contains(category)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "DataSource[id=" + id + ", type=" + type + ", enabled=" + enabled + "]";
    }
}

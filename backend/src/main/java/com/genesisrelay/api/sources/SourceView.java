/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.sources;

import com.genesisrelay.application.sources.DataSource;
import com.genesisrelay.domain.model.AuthType;
import com.genesisrelay.domain.model.SourceType;

import java.util.List;

/**
 * Public shape of a data source. Credentials and custom headers are never exposed.
 */
public record SourceView(
        String id,
        String name,
        SourceType type,
        String url,
        String description,
        AuthType authType,
        boolean hasCredentials,
        double rateLimit,
        boolean enabled,
        List<String> categories
) {
    public static SourceView of(DataSource s) {
        return new SourceView(
                s.id(),
                s.name(),
                s.type(),
                s.baseUrl(),
                s.description(),
                s.authType(),
                s.apiKey() != null && !s.apiKey().isBlank(),
                s.rateLimit(),
                s.enabled(),
                s.categories()
        );
    }
}

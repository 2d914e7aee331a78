/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import java.util.List;

/**
 * A canned multi-source query. {@code queryTemplate} holds {@code {name}} placeholders that are
 * filled from the caller's parameters.
 */
public record UseCase(
        String id,
        String name,
        String description,
        List<String> categories,
        List<String> sources,
        String queryTemplate,
        List<String> examples
) {
    public UseCase {
        categories = categories == null ? List.of() : List.copyOf(categories);
        sources = sources == null ? List.of() : List.copyOf(sources);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public boolean inCategory(String category) {
        return categories.contains(category);
    }
}

/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.sources;

import com.genesisrelay.domain.model.SourceType;

import java.util.ArrayList;
import java.util.List;

public final class SourceValidator {
    private SourceValidator() {
    }

    public static List<String> validate(DataSource source) {
        List<String> errors = new ArrayList<>();
        if (isBlank(source.id())) errors.add("Source ID is required");
        if (isBlank(source.name())) errors.add("Source name is required");
        if (isBlank(source.description())) errors.add("Source description is required");
        if (source.categories().isEmpty()) errors.add("At least one category is required");
        if (source.type() == SourceType.API && isBlank(source.baseUrl())) errors.add("API URL is required for API sources");
        return errors;
    }

    public static List<String> validate(UseCase useCase) {
        List<String> errors = new ArrayList<>();
        if (isBlank(useCase.id())) errors.add("Use case ID is required");
        if (isBlank(useCase.name())) errors.add("Use case name is required");
        if (isBlank(useCase.description())) errors.add("Use case description is required");
        if (useCase.categories().isEmpty()) errors.add("At least one category is required");
        if (useCase.sources().isEmpty()) errors.add("At least one source is required");
        if (isBlank(useCase.queryTemplate())) errors.add("Query template is required");
        if (useCase.examples().isEmpty()) errors.add("At least one example is required");
        return errors;
    }

    static void requireValid(DataSource source) {
        List<String> errors = validate(source);
        if (!errors.isEmpty()) throw new InvalidDescriptorException(source.id(), errors);
    }

    static void requireValid(UseCase useCase) {
        List<String> errors = validate(useCase);
        if (!errors.isEmpty()) throw new InvalidDescriptorException(useCase.id(), errors);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

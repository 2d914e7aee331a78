/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.infrastructure.persistence.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.Instant;

/**
 * SQLite has no timestamp type; instants are stored as epoch milliseconds in an INTEGER column.
 */
@Converter
public class EpochMillisConverter implements AttributeConverter<Instant, Long> {
    @Override
    public Long convertToDatabaseColumn(Instant instant) {
        if (instant == null) return null;
        return instant.toEpochMilli();
    }

    @Override
    public Instant convertToEntityAttribute(Long millis) {
        if (millis == null) return null;
        return Instant.ofEpochMilli(millis);
    }
}

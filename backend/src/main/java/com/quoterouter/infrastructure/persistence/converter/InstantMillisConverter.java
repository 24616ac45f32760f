/*
 * Copyright (C) 2025 Quote Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.quoterouter.infrastructure.persistence.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.Instant;

/**
 * Timestamps are stored as epoch millis (INTEGER) so SQLite can compare them.
 */
@Converter(autoApply = true)
public class InstantMillisConverter implements AttributeConverter<Instant, Long> {
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

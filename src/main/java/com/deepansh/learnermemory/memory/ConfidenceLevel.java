package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.exception.MemoryValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordinal confidence label. Declaration order is the ordering: LOW < MEDIUM < HIGH.
 */
public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(ConfidenceLevel threshold) {
        return compareTo(threshold) >= 0;
    }

    /** All levels greater than or equal to this one, weakest first. */
    public List<ConfidenceLevel> andAbove() {
        return Arrays.stream(values())
                .filter(level -> level.isAtLeast(this))
                .toList();
    }

    /** One step down the ladder, empty when already LOW. */
    public Optional<ConfidenceLevel> weaker() {
        return this == LOW ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConfidenceLevel from(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MemoryValidationException("Unknown confidence level: " + value);
        }
    }
}

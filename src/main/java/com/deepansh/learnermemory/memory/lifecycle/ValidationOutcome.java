package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.exception.MemoryValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidationOutcome {
    VALIDATED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ValidationOutcome from(String value) {
        if (value == null || value.isBlank()) {
            throw new MemoryValidationException("outcome is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MemoryValidationException("Unknown validation outcome: " + value);
        }
    }
}

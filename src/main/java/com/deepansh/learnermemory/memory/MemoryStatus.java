package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.exception.MemoryValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a memory record.
 * Records are never deleted; RESOLVED and EXPIRED are soft terminal markers.
 */
public enum MemoryStatus {
    ACTIVE,
    SUSPECTED,
    /** Accepted by the store for compatibility; no engine operation produces it. */
    RESOLVING,
    RESOLVED,
    EXPIRED;

    public boolean isTerminal() {
        return this == RESOLVED || this == EXPIRED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MemoryStatus from(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MemoryValidationException("Unknown memory status: " + value);
        }
    }
}

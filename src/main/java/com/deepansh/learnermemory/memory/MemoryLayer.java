package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.exception.MemoryValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Confidence tier of a memory record.
 *
 * Records only ever move up this ladder, one tier at a time:
 * EPHEMERAL → HYPOTHESIS → STABLE.
 */
public enum MemoryLayer {

    /** Short-lived observation, expires after its TTL unless promoted. */
    EPHEMERAL,

    /** Suspected pattern awaiting corroboration or rejection. */
    HYPOTHESIS,

    /** Confirmed long-term pattern. Terminal tier. */
    STABLE;

    /**
     * Status a freshly created record in this layer starts with.
     * This is also the only non-terminal status a record of this layer can hold.
     */
    public MemoryStatus initialStatus() {
        return this == HYPOTHESIS ? MemoryStatus.SUSPECTED : MemoryStatus.ACTIVE;
    }

    public boolean expires() {
        return this == EPHEMERAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive parse. Returns null for null/blank input. */
    @JsonCreator
    public static MemoryLayer from(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MemoryValidationException("Unknown memory layer: " + value);
        }
    }
}

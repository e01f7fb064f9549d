package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.exception.MemoryValidationException;

/**
 * Argument checks shared by the engine's entry points.
 */
public final class MemoryInputs {

    private MemoryInputs() {}

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MemoryValidationException(field + " is required");
        }
        return value;
    }

    public static <T> T require(T value, String field) {
        if (value == null) {
            throw new MemoryValidationException(field + " is required");
        }
        return value;
    }
}

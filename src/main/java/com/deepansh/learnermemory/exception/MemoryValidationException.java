package com.deepansh.learnermemory.exception;

/** Missing or malformed input. A caller bug, never retried. */
public class MemoryValidationException extends MemoryEngineException {

    public MemoryValidationException(String message) {
        super(message);
    }
}

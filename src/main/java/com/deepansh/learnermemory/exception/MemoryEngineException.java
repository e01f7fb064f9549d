package com.deepansh.learnermemory.exception;

/**
 * Base type for every failure the memory engine surfaces to its callers.
 * Unchecked: callers decide whether a failed observation is worth handling.
 */
public class MemoryEngineException extends RuntimeException {

    public MemoryEngineException(String message) {
        super(message);
    }

    public MemoryEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.deepansh.learnermemory.exception;

/**
 * The record store could not be reached or timed out.
 * Surfaced as-is: retry policy belongs to the caller.
 */
public class StoreUnavailableException extends MemoryEngineException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

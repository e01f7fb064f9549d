package com.deepansh.learnermemory.exception;

import lombok.Getter;

/** The record kept changing under a state change; the caller may retry. */
@Getter
public class ConcurrentUpdateException extends MemoryEngineException {

    private final String memoryId;

    public ConcurrentUpdateException(String memoryId, String operation, int attempts) {
        super(String.format("Cannot %s memory %s: it changed concurrently on %d attempts",
                operation, memoryId, attempts));
        this.memoryId = memoryId;
    }
}

package com.deepansh.learnermemory.exception;

import lombok.Getter;

@Getter
public class MemoryNotFoundException extends MemoryEngineException {

    private final String memoryId;

    public MemoryNotFoundException(String memoryId) {
        super("Memory not found: " + memoryId);
        this.memoryId = memoryId;
    }
}

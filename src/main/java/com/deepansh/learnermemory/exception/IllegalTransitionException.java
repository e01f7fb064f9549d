package com.deepansh.learnermemory.exception;

import com.deepansh.learnermemory.memory.MemoryLayer;
import com.deepansh.learnermemory.memory.MemoryStatus;
import lombok.Getter;

/**
 * The requested operation has no entry in the lifecycle table for the record's
 * current (layer, status). The record is left untouched.
 */
@Getter
public class IllegalTransitionException extends MemoryEngineException {

    private final String memoryId;
    private final MemoryLayer layer;
    private final MemoryStatus status;

    public IllegalTransitionException(String memoryId, MemoryLayer layer, MemoryStatus status, String operation) {
        super(String.format("Cannot %s memory %s in state (%s, %s)",
                operation, memoryId, layer.wireName(), status.wireName()));
        this.memoryId = memoryId;
        this.layer = layer;
        this.status = status;
    }
}

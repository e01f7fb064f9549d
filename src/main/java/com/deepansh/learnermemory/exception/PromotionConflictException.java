package com.deepansh.learnermemory.exception;

import com.deepansh.learnermemory.memory.MemoryLayer;
import lombok.Getter;

/**
 * Promotion would move a record into a tier that already holds a record
 * with the same (subjectId, key).
 */
@Getter
public class PromotionConflictException extends MemoryEngineException {

    private final String memoryId;
    private final MemoryLayer targetLayer;

    public PromotionConflictException(String memoryId, MemoryLayer targetLayer, Throwable cause) {
        super(String.format("Cannot promote memory %s: layer '%s' already holds the same key",
                memoryId, targetLayer.wireName()), cause);
        this.memoryId = memoryId;
        this.targetLayer = targetLayer;
    }
}

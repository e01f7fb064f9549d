package com.deepansh.learnermemory.memory;

/**
 * The (layer, status) pair that the lifecycle rules are written against.
 */
public record MemoryState(MemoryLayer layer, MemoryStatus status) {

    public static MemoryState of(MemoryRecord record) {
        return new MemoryState(record.getLayer(), record.getStatus());
    }

    @Override
    public String toString() {
        return "(" + layer.wireName() + ", " + status.wireName() + ")";
    }
}

package com.deepansh.learnermemory.exception;

/** A write carrying the same idempotency key is still being processed. */
public class DuplicateWriteException extends MemoryEngineException {

    public DuplicateWriteException(String idempotencyKey) {
        super("A write with idempotency key " + idempotencyKey + " is already in progress");
    }
}

package com.deepansh.learnermemory.memory;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Conjunctive filter over one subject's records. Null fields do not constrain.
 * Results are always ordered by lastUpdated, most recent first.
 */
@Value
@Builder
public class MemoryQuery {

    String subjectId;
    MemoryLayer layer;
    MemoryStatus status;

    /** Case-sensitive substring of the key; regex metacharacters match literally. */
    String keyPattern;

    ConfidenceLevel minConfidence;

    /** Only records whose lastUpdated is at or before this instant. */
    Instant updatedAtOrBefore;
}

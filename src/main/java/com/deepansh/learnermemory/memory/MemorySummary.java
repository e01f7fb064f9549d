package com.deepansh.learnermemory.memory;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a content planner knows about a learner's long-term state.
 * Built from ACTIVE records only.
 */
@Value
@Builder
public class MemorySummary {

    String subjectId;
    List<MemoryRecord> stablePatterns;
    List<MemoryRecord> activeHypotheses;
    /** Newest ephemeral observations, capped. */
    List<MemoryRecord> recentObservations;
    Stats stats;

    @Value
    @Builder
    public static class Stats {
        int totalMemories;
        int stableCount;
        int hypothesisCount;
        int ephemeralCount;
    }
}

package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregates a learner's active memories into the view consumed by content planning.
 *
 * Counts cover the whole active set; only the recent-observation list is capped.
 * Resolved and expired records are invisible here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryBuilder {

    private final MemoryReader reader;
    private final MemoryProperties properties;

    public MemorySummary summarize(String subjectId) {
        List<MemoryRecord> active = reader.read(subjectId);

        Map<MemoryLayer, List<MemoryRecord>> byLayer = active.stream()
                .collect(Collectors.groupingBy(MemoryRecord::getLayer));

        List<MemoryRecord> stable = byLayer.getOrDefault(MemoryLayer.STABLE, List.of());
        List<MemoryRecord> hypotheses = byLayer.getOrDefault(MemoryLayer.HYPOTHESIS, List.of());
        List<MemoryRecord> ephemeral = byLayer.getOrDefault(MemoryLayer.EPHEMERAL, List.of());

        MemorySummary summary = MemorySummary.builder()
                .subjectId(subjectId)
                .stablePatterns(stable)
                .activeHypotheses(hypotheses)
                .recentObservations(ephemeral.stream()
                        .limit(properties.getRecentObservationLimit())
                        .toList())
                .stats(MemorySummary.Stats.builder()
                        .totalMemories(active.size())
                        .stableCount(stable.size())
                        .hypothesisCount(hypotheses.size())
                        .ephemeralCount(ephemeral.size())
                        .build())
                .build();

        log.debug("Summary for subject {}: {} stable, {} hypotheses, {} ephemeral",
                subjectId, stable.size(), hypotheses.size(), ephemeral.size());
        return summary;
    }
}

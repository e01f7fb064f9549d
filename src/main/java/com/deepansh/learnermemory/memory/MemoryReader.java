package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.exception.MemoryNotFoundException;
import com.deepansh.learnermemory.memory.store.MemoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static com.deepansh.learnermemory.memory.MemoryInputs.requireText;

/**
 * Read-only queries over a learner's memories. No side effects.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MemoryReader {

    private final MemoryStore store;

    /** Active records of every layer, most recently updated first. */
    public List<MemoryRecord> read(String subjectId) {
        return read(subjectId, null, null, null, null);
    }

    /**
     * Filtered read. All filters except subjectId are optional and combined with AND.
     * When status is omitted only ACTIVE records are returned.
     */
    public List<MemoryRecord> read(String subjectId, MemoryLayer layer, MemoryStatus status,
                                   String keyPattern, ConfidenceLevel minConfidence) {
        requireText(subjectId, "subjectId");

        MemoryQuery query = MemoryQuery.builder()
                .subjectId(subjectId)
                .layer(layer)
                .status(status != null ? status : MemoryStatus.ACTIVE)
                .keyPattern(keyPattern == null || keyPattern.isEmpty() ? null : keyPattern)
                .minConfidence(minConfidence)
                .build();

        List<MemoryRecord> records = store.find(query);
        log.debug("Read {} memories for subject {} [layer={}, status={}, keyPattern={}, minConfidence={}]",
                records.size(), subjectId, layer, query.getStatus(), keyPattern, minConfidence);
        return records;
    }

    /** Natural-key lookup, any status. */
    public Optional<MemoryRecord> find(String subjectId, String key, MemoryLayer layer) {
        requireText(subjectId, "subjectId");
        requireText(key, "key");
        return store.findByKey(subjectId, key, layer);
    }

    public MemoryRecord get(String id) {
        requireText(id, "id");
        return store.findById(id).orElseThrow(() -> new MemoryNotFoundException(id));
    }
}

package com.deepansh.learnermemory.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * A single behavioural inference about a learner, stored in MongoDB.
 *
 * Collection: learner_memories
 *
 * The natural key is (subjectId, layer, key). A unique compound index enforces it,
 * which is what lets the writer create-or-merge in one atomic upsert and what makes
 * a promotion into an already occupied tier fail instead of silently duplicating.
 *
 * Indexes:
 * - (subjectId, layer, key) unique: natural key, merge target
 * - (subjectId, status, lastUpdated desc): reader and summary queries
 * - (layer, status, expiresAt): global expiration sweep
 */
@Document(collection = "learner_memories")
@CompoundIndexes({
    @CompoundIndex(name = "uq_subject_layer_key", def = "{'subjectId': 1, 'layer': 1, 'key': 1}", unique = true),
    @CompoundIndex(name = "idx_subject_status_updated", def = "{'subjectId': 1, 'status': 1, 'lastUpdated': -1}"),
    @CompoundIndex(name = "idx_layer_status_expires", def = "{'layer': 1, 'status': 1, 'expiresAt': 1}")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRecord {

    @Id
    private String id;

    private String subjectId;

    private MemoryLayer layer;

    /** Semantic identifier of the fact, e.g. "struggles_fractions" */
    private String key;

    /** Opaque to the engine; interpreted by consumers. */
    private Map<String, Object> content;

    private MemoryStatus status;

    private ConfidenceLevel confidence;

    private int evidenceCount;

    private LocalDate firstObserved;

    private Instant lastUpdated;

    /** Date of the last promotion, null until the record is first promoted. */
    private LocalDate lastConfirmed;

    /** Only set while layer = EPHEMERAL. */
    private Instant expiresAt;
}

package com.deepansh.learnermemory.api;

import com.deepansh.learnermemory.exception.DuplicateWriteException;
import com.deepansh.learnermemory.memory.ConfidenceLevel;
import com.deepansh.learnermemory.memory.MemoryLayer;
import com.deepansh.learnermemory.memory.MemoryReader;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryStatus;
import com.deepansh.learnermemory.memory.MemorySummary;
import com.deepansh.learnermemory.memory.MemoryWriter;
import com.deepansh.learnermemory.memory.SummaryBuilder;
import com.deepansh.learnermemory.memory.lifecycle.DecayEngine;
import com.deepansh.learnermemory.memory.lifecycle.ExpirationSweep;
import com.deepansh.learnermemory.memory.lifecycle.PromotionEngine;
import com.deepansh.learnermemory.memory.lifecycle.ValidationGate;
import com.deepansh.learnermemory.memory.lifecycle.ValidationOutcome;
import com.deepansh.learnermemory.model.ValidateHypothesisRequest;
import com.deepansh.learnermemory.model.WriteMemoryRequest;
import com.deepansh.learnermemory.resilience.IdempotencyService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * HTTP surface over the memory engine.
 *
 * Producers:  POST /api/v1/memory/{subjectId}
 *   Optional header: Idempotency-Key: <uuid>
 *   A repeated key replays the first response instead of merging the observation again.
 * Consumers:  GET  /api/v1/memory/{subjectId}, /{subjectId}/summary, /{subjectId}/key/{key}
 * Lifecycle:  POST /api/v1/memory/entry/{id}/promote, /entry/{id}/validate
 * Operators:  POST /api/v1/memory/{subjectId}/decay, /maintenance/expire
 */
@RestController
@RequestMapping("/api/v1/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final MemoryWriter memoryWriter;
    private final MemoryReader memoryReader;
    private final SummaryBuilder summaryBuilder;
    private final PromotionEngine promotionEngine;
    private final ValidationGate validationGate;
    private final DecayEngine decayEngine;
    private final ExpirationSweep expirationSweep;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    // ─── Producers ───────────────────────────────────────────────────────────

    @PostMapping("/{subjectId}")
    public ResponseEntity<MemoryRecord> write(
            @PathVariable String subjectId,
            @Valid @RequestBody WriteMemoryRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            var cached = idempotencyService.getCompletedResponse(idempotencyKey);
            if (cached.isPresent()) {
                try {
                    return ResponseEntity.ok(objectMapper.readValue(cached.get(), MemoryRecord.class));
                } catch (Exception e) {
                    log.warn("Failed to deserialize cached write response for key={}, executing the write again",
                            idempotencyKey, e);
                    idempotencyService.releaseKey(idempotencyKey);
                }
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                throw new DuplicateWriteException(idempotencyKey);
            }
        }

        MemoryRecord record;
        try {
            record = memoryWriter.write(
                    subjectId,
                    MemoryLayer.from(request.getLayer()),
                    request.getKey(),
                    request.getContent(),
                    ConfidenceLevel.from(request.getConfidence()),
                    request.getTtlDays(),
                    request.isReactivate());
        } catch (RuntimeException e) {
            // Release the key so the producer can retry
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            try {
                idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(record));
            } catch (Exception e) {
                log.warn("Failed to cache write response for key={}", idempotencyKey, e);
            }
        }
        return ResponseEntity.ok(record);
    }

    // ─── Consumers ───────────────────────────────────────────────────────────

    @GetMapping("/{subjectId}")
    public ResponseEntity<List<MemoryRecord>> read(
            @PathVariable String subjectId,
            @RequestParam(required = false) String layer,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String keyPattern,
            @RequestParam(required = false) String minConfidence) {
        return ResponseEntity.ok(memoryReader.read(
                subjectId,
                MemoryLayer.from(layer),
                MemoryStatus.from(status),
                keyPattern,
                ConfidenceLevel.from(minConfidence)));
    }

    @GetMapping("/{subjectId}/key/{key}")
    public ResponseEntity<MemoryRecord> findByKey(
            @PathVariable String subjectId,
            @PathVariable String key,
            @RequestParam(required = false) String layer) {
        return memoryReader.find(subjectId, key, MemoryLayer.from(layer))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{subjectId}/summary")
    public ResponseEntity<MemorySummary> summarize(@PathVariable String subjectId) {
        return ResponseEntity.ok(summaryBuilder.summarize(subjectId));
    }

    @GetMapping("/entry/{id}")
    public ResponseEntity<MemoryRecord> get(@PathVariable String id) {
        return ResponseEntity.ok(memoryReader.get(id));
    }

    // ─── Lifecycle ───────────────────────────────────────────────────────────

    @PostMapping("/entry/{id}/promote")
    public ResponseEntity<MemoryRecord> promote(@PathVariable String id) {
        return ResponseEntity.ok(promotionEngine.promote(id));
    }

    @PostMapping("/entry/{id}/validate")
    public ResponseEntity<MemoryRecord> validate(
            @PathVariable String id,
            @Valid @RequestBody ValidateHypothesisRequest request) {
        return ResponseEntity.ok(validationGate.validateHypothesis(
                id, ValidationOutcome.from(request.getOutcome())));
    }

    // ─── Operators ───────────────────────────────────────────────────────────

    @PostMapping("/{subjectId}/decay")
    public ResponseEntity<Map<String, Object>> decay(@PathVariable String subjectId) {
        int decayed = decayEngine.decay(subjectId);
        return ResponseEntity.ok(Map.of("subjectId", subjectId, "decayed", decayed));
    }

    @PostMapping("/maintenance/expire")
    public ResponseEntity<Map<String, Long>> cleanupExpired() {
        return ResponseEntity.ok(Map.of("expired", expirationSweep.cleanupExpired()));
    }
}

package com.deepansh.learnermemory.resilience;

import com.deepansh.learnermemory.config.MemoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based de-duplication of observation writes.
 *
 * Problem: a producer that retries a write after a network timeout would merge
 * the same observation twice and inflate evidenceCount.
 *
 * Solution: the producer sends an Idempotency-Key header. The key is claimed with
 * SET NX before the write, replaced by the response JSON once the write succeeds,
 * and deleted if it fails so the producer can try again.
 *
 * Key pattern: memory:idempotency:{idempotencyKey}
 * TTL: memory.idempotency.ttl-hours (24 by default)
 *
 * Opt-in: writes without a key are always executed.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "memory:idempotency:";
    // Stored while the write is in flight
    private static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public IdempotencyService(StringRedisTemplate redisTemplate, MemoryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofHours(properties.getIdempotency().getTtlHours());
    }

    /**
     * @return the stored response of a completed write with this key, empty if the
     *         key is unknown or its write is still in flight
     */
    public Optional<String> getCompletedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));
        if (existing == null || IN_FLIGHT_SENTINEL.equals(existing)) {
            return Optional.empty();
        }
        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /**
     * Mark the key as in flight atomically (SET NX).
     * Returns false if another request already holds it.
     */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, ttl);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, ttl);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /** Release after a failed write so the producer's retry is executed. */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}

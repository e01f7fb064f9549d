package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.memory.store.MemoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Soft-expires active ephemeral records past their expiresAt, across all subjects.
 * Nothing is deleted; re-running with nothing newly due changes nothing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExpirationSweep {

    private final MemoryStore store;
    private final Clock clock;

    /** @return number of records expired by this run */
    public long cleanupExpired() {
        long expired = store.expireDue(clock.instant());
        log.info("Cleaned up {} expired memories", expired);
        return expired;
    }
}

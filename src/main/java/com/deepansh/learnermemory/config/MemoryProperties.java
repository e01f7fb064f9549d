package com.deepansh.learnermemory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for the memory engine.
 * Bound from application.yml under the "memory" prefix.
 */
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    /** TTL applied to ephemeral writes that do not specify one. */
    private int defaultTtlDays = 10;

    /** A suspected hypothesis untouched for this long decays one step. */
    private int stalenessDays = 30;

    /** Ephemeral records included in a summary, most recent first. */
    private int recentObservationLimit = 5;

    private Maintenance maintenance = new Maintenance();
    private Idempotency idempotency = new Idempotency();

    @Data
    public static class Maintenance {
        private boolean enabled = false;
        /** Spring cron expression (seconds first). */
        private String cron = "0 0 3 * * *";
    }

    @Data
    public static class Idempotency {
        private long ttlHours = 24;
    }
}

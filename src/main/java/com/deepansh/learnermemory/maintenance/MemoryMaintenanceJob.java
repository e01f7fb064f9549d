package com.deepansh.learnermemory.maintenance;

import com.deepansh.learnermemory.memory.lifecycle.DecayEngine;
import com.deepansh.learnermemory.memory.lifecycle.ExpirationSweep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Daily housekeeping: expire overdue ephemeral memories, then decay stale
 * hypotheses subject by subject.
 *
 * Only registered when memory.maintenance.enabled=true. Deployments that drive
 * the sweeps from an external scheduler call the REST endpoints instead.
 *
 * Both sweeps are safe to interrupt and re-run. A failing subject is logged and
 * skipped so one bad record never blocks the rest of the sweep.
 */
@Component
@ConditionalOnProperty(prefix = "memory.maintenance", name = "enabled", havingValue = "true")
@Slf4j
@RequiredArgsConstructor
public class MemoryMaintenanceJob {

    private final ExpirationSweep expirationSweep;
    private final DecayEngine decayEngine;

    @Scheduled(cron = "${memory.maintenance.cron:0 0 3 * * *}")
    public void scheduledRun() {
        try {
            runOnce();
        } catch (Exception e) {
            // The next scheduled run picks up whatever this one missed
            log.error("Memory maintenance run failed", e);
        }
    }

    public MaintenanceRun runOnce() {
        long startMs = System.currentTimeMillis();

        long expired = expirationSweep.cleanupExpired();

        List<String> subjects = decayEngine.subjectsWithOpenHypotheses();
        int decayed = 0;
        int failedSubjects = 0;
        for (String subjectId : subjects) {
            try {
                decayed += decayEngine.decay(subjectId);
            } catch (Exception e) {
                failedSubjects++;
                log.error("Decay failed for subject={}", subjectId, e);
            }
        }

        MaintenanceRun run = new MaintenanceRun(expired, subjects.size(), decayed, failedSubjects);
        log.info("Memory maintenance finished [expired={}, subjects={}, decayed={}, failed={}, took={}ms]",
                expired, subjects.size(), decayed, failedSubjects, System.currentTimeMillis() - startMs);
        return run;
    }

    public record MaintenanceRun(long expired, int subjectsScanned, int decayed, int failedSubjects) {}
}

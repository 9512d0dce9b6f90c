package uk.gegc.recall.features.generation.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.generation.application.GenerationJobService;

@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationJobCleanupScheduler {

    private final GenerationJobService generationJobService;

    /**
     * Default: every 15 minutes.
     */
    @Scheduled(fixedDelayString = "${generation.jobs.stuck-check-interval-ms:900000}",
            initialDelayString = "${generation.jobs.stuck-check-initial-delay-ms:60000}")
    public void failStuckJobs() {
        try {
            int failed = generationJobService.failStuckJobs();
            if (failed > 0) {
                log.info("Failed {} stuck generation jobs", failed);
            }
        } catch (Exception e) {
            log.error("Error while failing stuck generation jobs", e);
        }
    }

    /**
     * Default: every hour.
     */
    @Scheduled(fixedDelayString = "${generation.jobs.cleanup-interval-ms:3600000}",
            initialDelayString = "${generation.jobs.cleanup-initial-delay-ms:300000}")
    public void cleanupOldJobs() {
        log.debug("Running scheduled generation job cleanup");
        try {
            generationJobService.cleanupOldJobs();
        } catch (Exception e) {
            log.error("Error during scheduled generation job cleanup", e);
        }
    }
}

package uk.gegc.recall.features.stats.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.stats.application.UserStatsService;

/**
 * Rebuilds cached user stats from the concept table to repair drift left by missed deltas.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserStatsReconciliationScheduler {

    private final UserStatsService userStatsService;

    /**
     * Default: once a day at 03:30 server time.
     */
    @Scheduled(cron = "${stats.reconciliation.cron:0 30 3 * * *}")
    public void reconcileAllUsers() {
        log.debug("Running scheduled user stats reconciliation");
        try {
            int reconciled = userStatsService.reconcileAll();
            log.info("User stats reconciliation finished for {} users", reconciled);
        } catch (Exception e) {
            log.error("Error during scheduled user stats reconciliation", e);
        }
    }
}

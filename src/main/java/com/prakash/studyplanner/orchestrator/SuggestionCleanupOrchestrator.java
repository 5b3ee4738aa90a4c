package com.prakash.studyplanner.orchestrator;

import com.prakash.studyplanner.service.SuggestionResolutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class SuggestionCleanupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SuggestionCleanupOrchestrator.class);

    private final SuggestionResolutionService resolutionService;

    @Value("${studyplanner.cleanup.retention:P30D}") // ISO-8601 Duration
    private String retentionPeriodString;

    @Autowired
    public SuggestionCleanupOrchestrator(SuggestionResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    /**
     * Periodically deletes accepted and dismissed suggestions older than the configured retention.
     * Planned tasks created from them are kept.
     */
    @Scheduled(cron = "${studyplanner.cleanup.cron:0 30 3 * * *}") // Default: daily at 03:30
    public void runCleanupTasks() {
        log.info("==== Orchestrator: Starting resolved suggestion cleanup run ====");
        try {
            Duration retentionPeriod = Duration.parse(retentionPeriodString);
            log.info("Orchestrator: Cleaning up suggestions resolved more than {} ago", retentionPeriodString);

            long deletedCount = resolutionService.cleanupResolvedSuggestions(retentionPeriod);

            log.info("Orchestrator: Cleanup finished. Deleted {} suggestions.", deletedCount);
        } catch (Exception e) {
            // Keep the scheduler alive; the next run retries
            log.error("Orchestrator: Error occurred during cleanup run: {}", e.getMessage(), e);
        } finally {
            log.info("==== Orchestrator: Finished resolved suggestion cleanup run ====");
        }
    }
}

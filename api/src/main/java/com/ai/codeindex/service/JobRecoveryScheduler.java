package com.ai.codeindex.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Restarts work the orchestrator could not finish: jobs interrupted by a previous process,
 * and jobs paused while the credential supervisor was degraded.
 */
@Component
public class JobRecoveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobRecoveryScheduler.class);

    private final IndexJobOrchestrator orchestrator;

    public JobRecoveryScheduler(IndexJobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        int recovered = orchestrator.recoverInterruptedJobs();
        log.info("[Recovery] Startup recovery finished, {} job(s) restarted", recovered);
    }

    @Scheduled(fixedDelayString = "${indexing.degraded-resume-interval-ms:60000}",
            initialDelayString = "${indexing.degraded-resume-interval-ms:60000}")
    public void resumeDegradedJobs() {
        orchestrator.resumeDegradedJobs();
    }
}

package com.gemflush.orchestrator.service;

import com.gemflush.orchestrator.automation.AutomationScheduler;
import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.pipeline.ConcurrencyConflictException;
import com.gemflush.orchestrator.pipeline.RunTrigger;
import com.gemflush.orchestrator.repository.BusinessRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;

/**
 * Periodic driver for unattended runs.
 *
 * Every tick it loads the automation-enabled businesses, asks
 * AutomationScheduler what is due, and submits runs to the orchestrator's
 * worker pool. A business whose crawl is due gets a full run (which publishes
 * too, if allowed); otherwise one that only needs publishing gets a
 * publish-only run. Before that, rows abandoned mid-run by a dead process
 * are moved to ERROR.
 *
 * fixedDelay: the next tick starts only after this one has finished submitting.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "gemflush.automation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AutomationRunner {

    private static final Logger log = LoggerFactory.getLogger(AutomationRunner.class);

    private final BusinessRepository  businessRepo;
    private final AutomationScheduler scheduler;
    private final CfpOrchestrator     orchestrator;

    public AutomationRunner(BusinessRepository businessRepo,
                            AutomationScheduler scheduler,
                            CfpOrchestrator orchestrator) {
        this.businessRepo = businessRepo;
        this.scheduler    = scheduler;
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${gemflush.automation.tick-interval-ms:300000}",
               initialDelayString = "${gemflush.automation.initial-delay-ms:30000}")
    public void tick() {
        int recovered = orchestrator.recoverStaleRuns();
        if (recovered > 0) {
            log.warn("Moved {} abandoned run(s) to ERROR", recovered);
        }
        submitDueRuns();
    }

    /** @return number of runs submitted */
    public int submitDueRuns() {
        List<Business> candidates = businessRepo.findByAutomationEnabledTrue();
        int submitted = 0;
        for (Business business : candidates) {
            try {
                if (scheduler.shouldAutoCrawl(business, business.getTeam())) {
                    orchestrator.submit(business.getId(), RunTrigger.SCHEDULED)
                            .whenComplete((result, error) -> logCompletion(business, error));
                    submitted++;
                } else if (scheduler.shouldAutoPublish(business, business.getTeam())) {
                    orchestrator.submitPublish(business.getId(), RunTrigger.SCHEDULED)
                            .whenComplete((result, error) -> logCompletion(business, error));
                    submitted++;
                }
            } catch (ConcurrencyConflictException e) {
                log.debug("Skipping business {}: run already active", business.getId());
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected run for business {}; will retry next tick", business.getId());
            }
        }
        if (submitted > 0) {
            log.info("Automation tick submitted {} run(s) out of {} candidate(s)", submitted, candidates.size());
        }
        return submitted;
    }

    private static void logCompletion(Business business, Throwable error) {
        if (error != null) {
            log.error("Scheduled run for business {} failed: {}", business.getId(), error.getMessage(), error);
        }
    }
}

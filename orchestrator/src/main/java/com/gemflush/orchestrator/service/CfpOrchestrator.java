package com.gemflush.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.automation.AutomationConfig;
import com.gemflush.orchestrator.automation.AutomationScheduler;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.config.PipelineConfig;
import com.gemflush.orchestrator.crawl.CrawlData;
import com.gemflush.orchestrator.crawl.CrawlStage;
import com.gemflush.orchestrator.fingerprint.FingerprintStage;
import com.gemflush.orchestrator.model.Business;
import com.gemflush.orchestrator.model.BusinessStatus;
import com.gemflush.orchestrator.model.Fingerprint;
import com.gemflush.orchestrator.pipeline.BusinessNotFoundException;
import com.gemflush.orchestrator.pipeline.ConcurrencyConflictException;
import com.gemflush.orchestrator.pipeline.IllegalStatusTransitionException;
import com.gemflush.orchestrator.pipeline.InvalidInputException;
import com.gemflush.orchestrator.pipeline.PipelineStage;
import com.gemflush.orchestrator.pipeline.RunTrigger;
import com.gemflush.orchestrator.pipeline.SingleFlightRegistry;
import com.gemflush.orchestrator.pipeline.StageException;
import com.gemflush.orchestrator.publish.GateResult;
import com.gemflush.orchestrator.publish.PublishGate;
import com.gemflush.orchestrator.publish.PublishOutcome;
import com.gemflush.orchestrator.repository.BusinessRepository;
import com.gemflush.orchestrator.repository.FingerprintRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs Crawl → Fingerprint → Publish for one business.
 *
 * Status flow of a full run:
 *   (PENDING | CRAWLED | ERROR) → CRAWLING          before any I/O
 *   CRAWLING → CRAWLED                              crawl AND fingerprint succeeded
 *   CRAWLING → ERROR                                either stage failed
 *   CRAWLED → GENERATING → PUBLISHED | CRAWLED      publish attempt, if the tier allows
 *
 * A run on a PUBLISHED business is a refresh: stages run and data is updated
 * but the status stays PUBLISHED, so QID and status never disagree.
 *
 * At most one run per business: the in-process lock rejects a second caller
 * immediately, and the conditional status writes reject a racing instance.
 * A row left CRAWLING or GENERATING by a process that died is moved to ERROR
 * once it has been idle for the stale-run timeout (see recoverStaleRuns).
 */
@Service
public class CfpOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CfpOrchestrator.class);

    private enum Mode { FULL, PUBLISH_ONLY }

    private final BusinessRepository    businessRepo;
    private final FingerprintRepository fingerprintRepo;
    private final StatusStateMachine    statusMachine;
    private final CrawlStage            crawlStage;
    private final FingerprintStage      fingerprintStage;
    private final PublishGate           publishGate;
    private final AutomationScheduler   scheduler;
    private final SingleFlightRegistry  singleFlight;
    private final ExecutorService       runPool;
    private final MeterRegistry         meterRegistry;
    private final ObjectMapper          json;
    private final Duration              staleRunTimeout;
    private final Clock                 clock;

    public CfpOrchestrator(BusinessRepository businessRepo,
                           FingerprintRepository fingerprintRepo,
                           StatusStateMachine statusMachine,
                           CrawlStage crawlStage,
                           FingerprintStage fingerprintStage,
                           PublishGate publishGate,
                           AutomationScheduler scheduler,
                           SingleFlightRegistry singleFlight,
                           @Qualifier(PipelineConfig.RUN_EXECUTOR) ExecutorService runPool,
                           MeterRegistry meterRegistry,
                           ObjectMapper json,
                           CfpProperties props,
                           Clock clock) {
        this.businessRepo     = businessRepo;
        this.fingerprintRepo  = fingerprintRepo;
        this.statusMachine    = statusMachine;
        this.crawlStage       = crawlStage;
        this.fingerprintStage = fingerprintStage;
        this.publishGate      = publishGate;
        this.scheduler        = scheduler;
        this.singleFlight     = singleFlight;
        this.runPool          = runPool;
        this.meterRegistry    = meterRegistry;
        this.json             = json;
        this.staleRunTimeout  = props.getPipeline().getStaleRunTimeout();
        this.clock            = clock;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Queue a full run on the worker pool. The lock is taken on the calling
     * thread, so a concurrent submit for the same business fails right here.
     *
     * @throws ConcurrencyConflictException if a run is already active
     */
    public CompletableFuture<CfpRunResult> submit(UUID businessId, RunTrigger trigger) {
        return submitAsync(businessId, trigger, Mode.FULL);
    }

    /** Queue a publish-only run; used by the automation tick. */
    public CompletableFuture<CfpRunResult> submitPublish(UUID businessId, RunTrigger trigger) {
        return submitAsync(businessId, trigger, Mode.PUBLISH_ONLY);
    }

    /** Full run on the calling thread. */
    public CfpRunResult run(UUID businessId, RunTrigger trigger) {
        acquire(businessId);
        try {
            return execute(businessId, trigger, Mode.FULL);
        } finally {
            singleFlight.release(businessId);
        }
    }

    /**
     * Publish gate only, against the stored crawl data and latest fingerprint.
     * The business must be CRAWLED (or PUBLISHED, for an update).
     */
    public CfpRunResult publish(UUID businessId, RunTrigger trigger) {
        acquire(businessId);
        try {
            return execute(businessId, trigger, Mode.PUBLISH_ONLY);
        } finally {
            singleFlight.release(businessId);
        }
    }

    /**
     * ERROR → PENDING, refused while a run is active. A business stuck in
     * CRAWLING or GENERATING past the stale-run timeout is failed first, so a
     * run lost to a crash can be reset without waiting for the sweep.
     */
    public void reset(UUID businessId) {
        acquire(businessId);
        try {
            Business business = businessRepo.findById(businessId)
                    .orElseThrow(() -> new BusinessNotFoundException(businessId));
            if (business.getStatus().isInFlight()) {
                if (!isStale(business)) {
                    throw new ConcurrencyConflictException(businessId,
                            "Business " + businessId + " is " + business.getStatus() + " and was updated recently");
                }
                abandon(business);
            }
            statusMachine.reset(businessId);
        } finally {
            singleFlight.release(businessId);
        }
    }

    /**
     * Fails every CRAWLING/GENERATING business that has not been touched for
     * the stale-run timeout and that no run in this process holds. The
     * conditional write means a row another instance just moved is left alone.
     *
     * @return number of businesses moved to ERROR
     */
    public int recoverStaleRuns() {
        Instant cutoff = clock.instant().minus(staleRunTimeout);
        List<Business> stuck = businessRepo.findByStatusInAndUpdatedAtBefore(
                EnumSet.of(BusinessStatus.CRAWLING, BusinessStatus.GENERATING), cutoff);
        int recovered = 0;
        for (Business business : stuck) {
            if (!singleFlight.tryAcquire(business.getId())) {
                continue;
            }
            try {
                abandon(business);
                recovered++;
            } catch (ConcurrencyConflictException | BusinessNotFoundException e) {
                log.debug("Business {} moved while recovering: {}", business.getId(), e.getMessage());
            } finally {
                singleFlight.release(business.getId());
            }
        }
        if (recovered > 0) {
            meterRegistry.counter("gemflush.cfp.recovered").increment(recovered);
        }
        return recovered;
    }

    public Optional<BusinessStatus> currentStatus(UUID businessId) {
        return statusMachine.currentStatus(businessId);
    }

    public boolean isRunning(UUID businessId) {
        return singleFlight.isActive(businessId);
    }

    private CompletableFuture<CfpRunResult> submitAsync(UUID businessId, RunTrigger trigger, Mode mode) {
        acquire(businessId);
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return execute(businessId, trigger, mode);
                } finally {
                    singleFlight.release(businessId);
                }
            }, runPool);
        } catch (RejectedExecutionException e) {
            singleFlight.release(businessId);
            throw e;
        }
    }

    private boolean isStale(Business business) {
        return business.getUpdatedAt().isBefore(clock.instant().minus(staleRunTimeout));
    }

    private void abandon(Business business) {
        log.warn("Business {} stuck in {} since {}; marking it failed",
                business.getId(), business.getStatus(), business.getUpdatedAt());
        statusMachine.fail(business.getId(), business.getStatus(),
                "Run abandoned in " + business.getStatus() + " (no progress since " + business.getUpdatedAt() + ")");
    }

    private void acquire(UUID businessId) {
        if (!singleFlight.tryAcquire(businessId)) {
            meterRegistry.counter("gemflush.cfp.rejected").increment();
            log.info("Rejected run for business {}: another run is active", businessId);
            throw new ConcurrencyConflictException(businessId, "A CFP run is already active for business " + businessId);
        }
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    private CfpRunResult execute(UUID businessId, RunTrigger trigger, Mode mode) {
        RunState state = new RunState(businessId, trigger, UUID.randomUUID().toString().substring(0, 8), clock.instant());
        MDC.put("businessId", businessId.toString());
        MDC.put("runId", state.runId);
        MDC.put("trigger", trigger.name());
        try {
            log.info("Starting {} run for business {} ({})", mode, businessId, trigger);
            Business business = businessRepo.findWithTeamById(businessId)
                    .orElseThrow(() -> new BusinessNotFoundException(businessId));
            AutomationConfig config = scheduler.getAutomationConfig(business.getTeam());

            CfpRunResult result = mode == Mode.FULL
                    ? fullRun(business, config, state)
                    : publishOnly(business, config, state);
            recordRun(result);
            log.info("Finished run for business {}: status={} publish={} in {} ms",
                    businessId, result.finalStatus(), result.publishOutcome(), result.duration().toMillis());
            return result;

        } catch (BusinessNotFoundException e) {
            log.warn("Abandoning run: business {} no longer exists", businessId);
            state.error = e.getMessage();
            CfpRunResult result = state.result(null);
            meterRegistry.counter("gemflush.cfp.runs", "trigger", trigger.name(), "outcome", "abandoned").increment();
            return result;
        } finally {
            MDC.clear();
        }
    }

    private CfpRunResult fullRun(Business business, AutomationConfig config, RunState state) {
        UUID id = business.getId();
        BusinessStatus start = business.getStatus();
        boolean refresh = start == BusinessStatus.PUBLISHED;

        if (!refresh) {
            if (start.isInFlight()) {
                throw new ConcurrencyConflictException(id, "Business " + id + " is already " + start);
            }
            statusMachine.transition(id, start, BusinessStatus.CRAWLING);
        }
        BusinessStatus current = refresh ? BusinessStatus.PUBLISHED : BusinessStatus.CRAWLING;

        CrawlData crawl;
        try {
            crawl = timed(PipelineStage.CRAWL, () -> crawlStage.execute(business));
            state.crawlSuccess = true;
        } catch (RuntimeException e) {
            return stageFailed(id, PipelineStage.CRAWL, asStageFailure(e), refresh, state);
        }
        requireExists(id);

        Fingerprint fingerprint;
        try {
            fingerprint = timed(PipelineStage.FINGERPRINT, () -> fingerprintStage.execute(business, crawl));
            state.fingerprintSuccess = true;
        } catch (RuntimeException e) {
            return stageFailed(id, PipelineStage.FINGERPRINT, asStageFailure(e), refresh, state);
        }
        requireExists(id);

        if (!refresh) {
            statusMachine.transition(id, BusinessStatus.CRAWLING, BusinessStatus.CRAWLED);
            current = BusinessStatus.CRAWLED;
        }

        Business fresh = businessRepo.findWithTeamById(id).orElseThrow(() -> new BusinessNotFoundException(id));
        if (!scheduler.shouldAutoPublish(fresh, fresh.getTeam())) {
            state.qid = fresh.getWikidataQid();
            return state.result(current);
        }
        return publishStage(fresh, crawl, fingerprint, config, state);
    }

    private CfpRunResult publishOnly(Business business, AutomationConfig config, RunState state) {
        UUID id = business.getId();
        BusinessStatus status = business.getStatus();
        if (status.isInFlight()) {
            throw new ConcurrencyConflictException(id, "Business " + id + " is already " + status);
        }
        if (status != BusinessStatus.CRAWLED && status != BusinessStatus.PUBLISHED) {
            throw new IllegalStatusTransitionException(status, BusinessStatus.GENERATING);
        }
        CrawlData crawl = readCrawlData(business);
        Fingerprint fingerprint = fingerprintRepo.findFirstByBusinessIdOrderByCreatedAtDesc(id)
                .orElseThrow(() -> new InvalidInputException("Business " + id + " has no fingerprint to publish from"));
        state.crawlSuccess = true;
        state.fingerprintSuccess = true;
        return publishStage(business, crawl, fingerprint, config, state);
    }

    /**
     * Never sets ERROR: the outcome is PUBLISHED, or back to CRAWLED with the
     * entity in manual storage. Only a failed final status write can leave the
     * row in GENERATING, and recoverStaleRuns picks that up.
     */
    private CfpRunResult publishStage(Business business, CrawlData crawl, Fingerprint fingerprint,
                                      AutomationConfig config, RunState state) {
        UUID id = business.getId();
        boolean refresh = business.getStatus() == BusinessStatus.PUBLISHED;
        boolean userInitiated = state.trigger == RunTrigger.USER;

        businessRepo.recordPublishAttempt(id, clock.instant());

        if (refresh) {
            state.qid = business.getWikidataQid();
            GateResult gate;
            try {
                gate = timed(PipelineStage.PUBLISH,
                        () -> publishGate.run(business, crawl, fingerprint, config, userInitiated));
            } catch (RuntimeException e) {
                log.warn("Republish failed for business {}: {}", id, e.getMessage());
                state.publishOutcome = PublishOutcome.FAILED;
                state.error = e.getMessage();
                return state.result(BusinessStatus.PUBLISHED);
            }
            applyGate(gate, state);
            if (gate.published()) {
                try {
                    statusMachine.updatePublication(id, gate.qid(), clock.instant());
                } catch (RuntimeException e) {
                    return publicationNotRecorded(id, gate.qid(), e, state);
                }
                state.qid = gate.qid();
            }
            return state.result(BusinessStatus.PUBLISHED);
        }

        statusMachine.transition(id, BusinessStatus.CRAWLED, BusinessStatus.GENERATING);
        GateResult gate;
        try {
            gate = timed(PipelineStage.PUBLISH,
                    () -> publishGate.run(business, crawl, fingerprint, config, userInitiated));
        } catch (RuntimeException e) {
            log.warn("Publish stage failed for business {}: {}", id, e.getMessage());
            state.publishOutcome = PublishOutcome.FAILED;
            state.error = e.getMessage();
            state.qid = null;
            revertToCrawled(id);
            return state.result(BusinessStatus.CRAWLED);
        }
        applyGate(gate, state);
        if (!gate.published()) {
            revertToCrawled(id);
            return state.result(BusinessStatus.CRAWLED);
        }
        try {
            statusMachine.markPublished(id, gate.qid(), clock.instant());
        } catch (RuntimeException e) {
            return publicationNotRecorded(id, gate.qid(), e, state);
        }
        state.qid = gate.qid();
        return state.result(BusinessStatus.PUBLISHED);
    }

    /**
     * The publisher assigned a QID but the business row could not take it.
     * The QID stays on the result and in the entity version row; the status
     * is whatever the row holds now.
     */
    private CfpRunResult publicationNotRecorded(UUID id, String qid, RuntimeException e, RunState state) {
        log.error("Business {} was published as {} but the publication could not be recorded: {}",
                id, qid, e.getMessage(), e);
        state.qid = qid;
        state.error = "Published as " + qid + " but the status update failed: " + e.getMessage();
        return state.result(statusMachine.currentStatus(id).orElse(null));
    }

    private static void applyGate(GateResult gate, RunState state) {
        state.publishOutcome = gate.outcome();
        if (gate.error() != null) {
            state.error = gate.error();
        } else if (gate.storageError() != null) {
            state.error = "Manual storage failed: " + gate.storageError();
        }
    }

    private void revertToCrawled(UUID id) {
        try {
            statusMachine.transition(id, BusinessStatus.GENERATING, BusinessStatus.CRAWLED);
        } catch (ConcurrencyConflictException | BusinessNotFoundException e) {
            log.error("Could not revert business {} from GENERATING: {}", id, e.getMessage());
        }
    }

    /** Crawl or fingerprint failed: ERROR (unless refreshing), crawl data kept. */
    private CfpRunResult stageFailed(UUID id, PipelineStage stage, StageException e, boolean refresh,
                                     RunState state) {
        state.failedStage = stage;
        state.error = e.getMessage();
        state.retryable = e.isRetryable();
        if (refresh) {
            log.warn("Refresh of published business {} failed at {}: {}", id, stage.tag(), e.getMessage());
            return state.result(BusinessStatus.PUBLISHED);
        }
        statusMachine.fail(id, BusinessStatus.CRAWLING, stage.tag() + " failed: " + e.getMessage());
        return state.result(BusinessStatus.ERROR);
    }

    /** Unexpected errors count as fatal stage failures; a vanished business aborts the run. */
    private static StageException asStageFailure(RuntimeException e) {
        if (e instanceof BusinessNotFoundException) {
            throw e;
        }
        if (e instanceof StageException se) {
            return se;
        }
        log.error("Unexpected stage error: {}", e.getMessage(), e);
        return new StageException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), false, e);
    }

    private void requireExists(UUID id) {
        if (!businessRepo.existsById(id)) {
            throw new BusinessNotFoundException(id);
        }
    }

    private CrawlData readCrawlData(Business business) {
        if (business.getCrawlData() == null) {
            throw new InvalidInputException("Business " + business.getId() + " has no crawl data");
        }
        try {
            return json.readValue(business.getCrawlData(), CrawlData.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Stored crawl data for business " + business.getId() + " is unreadable", e);
        }
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    private <T> T timed(PipelineStage stage, Supplier<T> body) {
        MDC.put("stage", stage.tag());
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return body.get();
        } catch (RuntimeException e) {
            status = "failure";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("gemflush.cfp.stage.duration", "stage", stage.tag(), "status", status));
            MDC.remove("stage");
        }
    }

    private void recordRun(CfpRunResult result) {
        meterRegistry.counter("gemflush.cfp.runs",
                "trigger", result.trigger().name(),
                "outcome", result.outcomeTag()).increment();
    }

    /** Mutable accumulator for one run. */
    private final class RunState {
        final UUID businessId;
        final RunTrigger trigger;
        final String runId;
        final Instant startedAt;
        boolean crawlSuccess;
        boolean fingerprintSuccess;
        PublishOutcome publishOutcome = PublishOutcome.NOT_ATTEMPTED;
        PipelineStage failedStage;
        String qid;
        String error;
        boolean retryable;

        RunState(UUID businessId, RunTrigger trigger, String runId, Instant startedAt) {
            this.businessId = businessId;
            this.trigger    = trigger;
            this.runId      = runId;
            this.startedAt  = startedAt;
        }

        CfpRunResult result(BusinessStatus finalStatus) {
            return new CfpRunResult(businessId, runId, trigger, crawlSuccess, fingerprintSuccess,
                    publishOutcome, failedStage, finalStatus, qid, error, retryable,
                    Duration.between(startedAt, clock.instant()));
        }
    }
}

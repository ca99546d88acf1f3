package com.gemflush.orchestrator.service;

import com.gemflush.orchestrator.model.BusinessStatus;
import com.gemflush.orchestrator.pipeline.BusinessNotFoundException;
import com.gemflush.orchestrator.pipeline.ConcurrencyConflictException;
import com.gemflush.orchestrator.pipeline.IllegalStatusTransitionException;
import com.gemflush.orchestrator.repository.BusinessRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * The only writer of Business.status.
 *
 * Each transition is checked against {@link BusinessStatus#canTransitionTo}
 * and then written as a conditional update on the expected current status.
 * Nothing here reads a cached status: if the row moved underneath us the
 * update hits zero rows and the caller gets a ConcurrencyConflictException.
 */
@Service
public class StatusStateMachine {

    private static final Logger log = LoggerFactory.getLogger(StatusStateMachine.class);

    private final BusinessRepository businessRepo;
    private final Clock              clock;

    public StatusStateMachine(BusinessRepository businessRepo, Clock clock) {
        this.businessRepo = businessRepo;
        this.clock        = clock;
    }

    public void transition(UUID businessId, BusinessStatus from, BusinessStatus to) {
        requireAllowed(from, to);
        int rows = businessRepo.compareAndSetStatus(businessId, from, to, clock.instant());
        checkApplied(rows, businessId, from, to);
        log.info("Business {} status {} -> {}", businessId, from, to);
    }

    /** Move to ERROR, recording a human-readable cause. */
    public void fail(UUID businessId, BusinessStatus from, String errorMessage) {
        requireAllowed(from, BusinessStatus.ERROR);
        int rows = businessRepo.compareAndSetStatusWithError(
                businessId, from, BusinessStatus.ERROR, errorMessage, clock.instant());
        checkApplied(rows, businessId, from, BusinessStatus.ERROR);
        log.warn("Business {} status {} -> ERROR: {}", businessId, from, errorMessage);
    }

    /** GENERATING → PUBLISHED with the assigned QID, in one write. */
    public void markPublished(UUID businessId, String qid, Instant publishedAt) {
        if (qid == null || qid.isBlank()) {
            throw new IllegalArgumentException("A published business needs a QID");
        }
        requireAllowed(BusinessStatus.GENERATING, BusinessStatus.PUBLISHED);
        int rows = businessRepo.markPublished(
                businessId, BusinessStatus.GENERATING, qid, publishedAt, clock.instant());
        checkApplied(rows, businessId, BusinessStatus.GENERATING, BusinessStatus.PUBLISHED);
        log.info("Business {} status GENERATING -> PUBLISHED as {}", businessId, qid);
    }

    /** New QID/timestamp for an already PUBLISHED business; status is unchanged. */
    public void updatePublication(UUID businessId, String qid, Instant publishedAt) {
        if (qid == null || qid.isBlank()) {
            throw new IllegalArgumentException("A published business needs a QID");
        }
        int rows = businessRepo.updatePublication(businessId, qid, publishedAt, clock.instant());
        checkApplied(rows, businessId, BusinessStatus.PUBLISHED, BusinessStatus.PUBLISHED);
        log.info("Business {} publication updated to {}", businessId, qid);
    }

    /** Manual recovery: ERROR → PENDING. */
    public void reset(UUID businessId) {
        transition(businessId, BusinessStatus.ERROR, BusinessStatus.PENDING);
    }

    /** Synchronous read; polling is the caller's business. */
    public Optional<BusinessStatus> currentStatus(UUID businessId) {
        return businessRepo.findStatusById(businessId);
    }

    // ------------------------------------------------------------------

    private static void requireAllowed(BusinessStatus from, BusinessStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStatusTransitionException(from, to);
        }
    }

    private void checkApplied(int rows, UUID businessId, BusinessStatus from, BusinessStatus to) {
        if (rows == 1) {
            return;
        }
        Optional<BusinessStatus> actual = businessRepo.findStatusById(businessId);
        if (actual.isEmpty()) {
            throw new BusinessNotFoundException(businessId);
        }
        throw new ConcurrencyConflictException(businessId,
                "Expected status " + from + " for " + from + " -> " + to + " but found " + actual.get());
    }
}

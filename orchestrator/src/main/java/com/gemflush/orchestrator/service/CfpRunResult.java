package com.gemflush.orchestrator.service;

import com.gemflush.orchestrator.model.BusinessStatus;
import com.gemflush.orchestrator.pipeline.PipelineStage;
import com.gemflush.orchestrator.pipeline.RunTrigger;
import com.gemflush.orchestrator.publish.PublishOutcome;

import java.time.Duration;
import java.util.UUID;

/**
 * Summary of one orchestrator run.
 *
 * failedStage is null when crawl and fingerprint both succeeded; publish
 * problems show up in publishOutcome only, never as a failed stage.
 */
public record CfpRunResult(
        UUID businessId,
        String runId,
        RunTrigger trigger,
        boolean crawlSuccess,
        boolean fingerprintSuccess,
        PublishOutcome publishOutcome,
        PipelineStage failedStage,
        BusinessStatus finalStatus,
        String qid,
        String error,
        boolean retryable,
        Duration duration
) {
    public boolean succeeded() {
        return failedStage == null && error == null;
    }

    /** Tag value for the runs counter. */
    String outcomeTag() {
        if (failedStage != null) {
            return "failed";
        }
        return switch (publishOutcome) {
            case PUBLISHED     -> "published";
            case FAILED        -> "publish_failed";
            case INELIGIBLE    -> "ineligible";
            case NOT_ATTEMPTED -> "crawled";
        };
    }
}

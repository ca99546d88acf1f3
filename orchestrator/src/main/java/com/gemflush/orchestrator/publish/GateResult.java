package com.gemflush.orchestrator.publish;

import com.gemflush.orchestrator.storage.StoredManualEntity;

/**
 * What one pass through the publish gate produced.
 *
 * stored is null only when manual storage itself failed; storageError then
 * says why.
 */
public record GateResult(
        PublishOutcome outcome,
        boolean canPublish,
        String qid,
        NotabilityVerdict verdict,
        StoredManualEntity stored,
        String error,
        String storageError
) {
    public boolean published() {
        return outcome == PublishOutcome.PUBLISHED;
    }
}

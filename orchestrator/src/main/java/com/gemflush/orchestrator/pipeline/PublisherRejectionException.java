package com.gemflush.orchestrator.pipeline;

/**
 * The knowledge-graph publisher refused the entity, usually a claim the
 * destination schema does not accept. Needs a human, so never retried.
 */
public class PublisherRejectionException extends StageException {

    public PublisherRejectionException(String message) {
        super(message, false);
    }

    public PublisherRejectionException(String message, Throwable cause) {
        super(message, false, cause);
    }
}

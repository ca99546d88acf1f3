package com.gemflush.orchestrator.publish;

/**
 * External knowledge-graph write capability.
 *
 * @see PublishResult
 */
public interface Publisher {

    PublishResult publishEntity(CandidateEntity entity, boolean production);

    /** Replace the claims of an existing entity. */
    PublishResult updateEntity(String qid, CandidateEntity entity, boolean production);
}

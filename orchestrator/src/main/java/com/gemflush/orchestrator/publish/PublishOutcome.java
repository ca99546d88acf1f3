package com.gemflush.orchestrator.publish;

/** How the publish step of a run ended. */
public enum PublishOutcome {
    NOT_ATTEMPTED,
    PUBLISHED,
    INELIGIBLE,
    FAILED
}

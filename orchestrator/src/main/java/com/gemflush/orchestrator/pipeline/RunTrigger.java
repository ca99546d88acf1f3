package com.gemflush.orchestrator.pipeline;

/** Who started a run. A user trigger counts as explicit permission to publish. */
public enum RunTrigger {
    USER,
    SCHEDULED
}

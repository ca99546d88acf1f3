package com.gemflush.orchestrator.fingerprint;

/** External language-model capability. One call per model per fingerprint run. */
public interface ScoringProvider {

    ScoringResponse query(String model, String prompt);
}

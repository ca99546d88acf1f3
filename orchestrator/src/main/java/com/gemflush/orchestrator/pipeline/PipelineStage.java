package com.gemflush.orchestrator.pipeline;

import java.util.Locale;

public enum PipelineStage {
    CRAWL,
    FINGERPRINT,
    PUBLISH;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

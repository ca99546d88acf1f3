package com.gemflush.orchestrator.fingerprint;

public record ScoringResponse(String content, int tokensUsed, String model) {
}

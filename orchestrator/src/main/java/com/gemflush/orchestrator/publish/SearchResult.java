package com.gemflush.orchestrator.publish;

public record SearchResult(String url, String title, String snippet) {
}

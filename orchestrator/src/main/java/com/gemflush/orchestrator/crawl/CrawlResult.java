package com.gemflush.orchestrator.crawl;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw crawler answer. {@code data} is the provider's structured extraction,
 * normalized later by {@link CrawlDataNormalizer}.
 */
public record CrawlResult(boolean success, JsonNode data, String error, boolean retryable) {

    public static CrawlResult ok(JsonNode data) {
        return new CrawlResult(true, data, null, false);
    }

    public static CrawlResult failed(String error, boolean retryable) {
        return new CrawlResult(false, null, error, retryable);
    }
}

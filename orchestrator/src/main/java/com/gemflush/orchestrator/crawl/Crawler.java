package com.gemflush.orchestrator.crawl;

/**
 * External crawling capability. Implementations may throw
 * {@link com.gemflush.orchestrator.pipeline.RetryableIoException} for transport
 * failures; a completed call that could not crawl the site reports it through
 * {@link CrawlResult#success()}.
 */
public interface Crawler {

    CrawlResult crawl(String url);
}

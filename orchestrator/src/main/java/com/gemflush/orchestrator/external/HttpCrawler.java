package com.gemflush.orchestrator.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.crawl.CrawlResult;
import com.gemflush.orchestrator.crawl.Crawler;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Crawler backed by the crawl sidecar: POST /crawl {"url": ...}. */
@Component
public class HttpCrawler implements Crawler {

    private final HttpCapabilityClient client;
    private final CfpProperties        props;

    public HttpCrawler(HttpCapabilityClient client, CfpProperties props) {
        this.client = client;
        this.props  = props;
    }

    @Override
    public CrawlResult crawl(String url) {
        JsonNode resp = client.post(props.getCapabilities().getCrawlerUrl(), "/crawl", Map.of("url", url),
                props.getCalls().getCrawl().getTimeout(), "crawl");
        if (resp.path("success").asBoolean(false)) {
            return CrawlResult.ok(resp.path("data"));
        }
        return CrawlResult.failed(resp.path("error").asText("crawl failed"), resp.path("retryable").asBoolean(true));
    }
}

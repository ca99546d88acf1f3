package com.gemflush.orchestrator.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.publish.SearchProvider;
import com.gemflush.orchestrator.publish.SearchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Web search sidecar: POST /search {"query"} → {"results": [{url, title, snippet}]}. */
@Component
public class HttpSearchProvider implements SearchProvider {

    private final HttpCapabilityClient client;
    private final CfpProperties        props;

    public HttpSearchProvider(HttpCapabilityClient client, CfpProperties props) {
        this.client = client;
        this.props  = props;
    }

    @Override
    public List<SearchResult> search(String query) {
        JsonNode resp = client.post(props.getCapabilities().getSearchUrl(), "/search", Map.of("query", query),
                props.getCalls().getSearch().getTimeout(), "search");
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode r : resp.path("results")) {
            results.add(new SearchResult(
                    r.path("url").asText(null),
                    r.path("title").asText(null),
                    r.path("snippet").asText(null)));
        }
        return results;
    }
}

package com.gemflush.orchestrator.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.fingerprint.ScoringProvider;
import com.gemflush.orchestrator.fingerprint.ScoringResponse;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Language-model gateway: POST /query {"model", "prompt"}. */
@Component
public class HttpScoringProvider implements ScoringProvider {

    private final HttpCapabilityClient client;
    private final CfpProperties        props;

    public HttpScoringProvider(HttpCapabilityClient client, CfpProperties props) {
        this.client = client;
        this.props  = props;
    }

    @Override
    public ScoringResponse query(String model, String prompt) {
        JsonNode resp = client.post(props.getCapabilities().getScoringUrl(), "/query",
                Map.of("model", model, "prompt", prompt),
                props.getCalls().getScoring().getTimeout(), "query " + model);
        return new ScoringResponse(
                resp.path("content").asText(""),
                resp.path("tokensUsed").asInt(0),
                resp.path("model").asText(model));
    }
}

package com.gemflush.orchestrator.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.pipeline.InvalidInputException;
import com.gemflush.orchestrator.pipeline.PublisherRejectionException;
import com.gemflush.orchestrator.publish.CandidateEntity;
import com.gemflush.orchestrator.publish.PublishResult;
import com.gemflush.orchestrator.publish.Publisher;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Knowledge-graph publisher sidecar.
 *   POST /entities        {"entity", "production"} → {"success", "qid", "error"}
 *   POST /entities/{qid}  same body, updates the existing item
 */
@Component
public class HttpPublisher implements Publisher {

    private final HttpCapabilityClient client;
    private final CfpProperties        props;

    public HttpPublisher(HttpCapabilityClient client, CfpProperties props) {
        this.client = client;
        this.props  = props;
    }

    @Override
    public PublishResult publishEntity(CandidateEntity entity, boolean production) {
        return send("/entities", entity, production, "publishEntity");
    }

    @Override
    public PublishResult updateEntity(String qid, CandidateEntity entity, boolean production) {
        return send("/entities/" + qid, entity, production, "updateEntity " + qid);
    }

    private PublishResult send(String path, CandidateEntity entity, boolean production, String opName) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entity", entity);
        body.put("production", production);
        JsonNode resp;
        try {
            resp = client.post(props.getCapabilities().getPublisherUrl(), path, body,
                    props.getCalls().getPublish().getTimeout(), opName);
        } catch (InvalidInputException e) {
            throw new PublisherRejectionException(e.getMessage(), e);
        }
        if (resp.path("success").asBoolean(false)) {
            return PublishResult.published(resp.path("qid").asText(null));
        }
        return PublishResult.rejected(resp.path("error").asText("publisher rejected entity"));
    }
}

package com.gemflush.orchestrator.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.config.CfpProperties;
import com.gemflush.orchestrator.pipeline.InvalidInputException;
import com.gemflush.orchestrator.pipeline.RetryableIoException;
import com.gemflush.orchestrator.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JSON-over-HTTP transport shared by the capability adapters.
 *
 * Failures are mapped onto the pipeline's taxonomy here so the adapters stay
 * thin: transport errors, timeouts, 408, 429 and 5xx are retryable; any other
 * non-2xx is treated as bad input.
 */
@Component
public class HttpCapabilityClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCapabilityClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;

    @Autowired
    public HttpCapabilityClient(CfpProperties props, ObjectMapper json) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(props.getCapabilities().getConnectTimeout())
                .build(), json);
    }

    HttpCapabilityClient(HttpClient http, ObjectMapper json) {
        this.http = http;
        this.json = json;
    }

    /** POST body as JSON to baseUrl + path and return the parsed response. */
    public JsonNode post(String baseUrl, String path, Object body, Duration timeout, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RetryableIoException(opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException(opName + " interrupted", false, e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.debug("{} returned HTTP {}: {}", opName, resp.statusCode(), resp.body());
            throw classify(resp.statusCode(), opName, resp.body());
        }
        try {
            return json.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new RetryableIoException(opName + " returned malformed JSON", e);
        }
    }

    static StageException classify(int status, String opName, String body) {
        String message = opName + " failed: HTTP " + status + (body == null || body.isBlank() ? "" : ": " + abbreviate(body));
        if (status == 408 || status == 429 || status >= 500) {
            return new RetryableIoException(message);
        }
        return new InvalidInputException(message);
    }

    private static String abbreviate(String s) {
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new StageException("JSON serialization failed", false, e);
        }
    }
}

package com.gemflush.orchestrator.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gemflush.orchestrator.pipeline.InvalidInputException;
import com.gemflush.orchestrator.pipeline.RetryableIoException;
import com.gemflush.orchestrator.pipeline.StageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpCapabilityClientTest {

    @Mock HttpClient http;
    @Mock HttpResponse<String> response;

    HttpCapabilityClient client;

    @BeforeEach
    void setUp() {
        client = new HttpCapabilityClient(http, new ObjectMapper());
    }

    @Test
    @SuppressWarnings("unchecked")
    void post_ok_parsesJsonBody() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"content\":\"hi\",\"tokensUsed\":3}");
        when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);

        JsonNode node = client.post("http://scoring:8102", "/query", Map.of("model", "m"), Duration.ofSeconds(5), "query");

        assertThat(node.path("content").asText()).isEqualTo("hi");
        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any(HttpResponse.BodyHandler.class));
        assertThat(req.getValue().uri().toString()).isEqualTo("http://scoring:8102/query");
        assertThat(req.getValue().method()).isEqualTo("POST");
    }

    @Test
    @SuppressWarnings("unchecked")
    void post_transportError_isRetryable() throws Exception {
        when(http.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("connection refused"));

        assertThatThrownBy(() -> client.post("http://crawler:8101", "/crawl", Map.of(), Duration.ofSeconds(5), "crawl"))
                .isInstanceOf(RetryableIoException.class)
                .hasMessageContaining("connection refused");
    }

    @ParameterizedTest
    @ValueSource(ints = {408, 429, 500, 502, 503})
    void classify_transientStatuses_areRetryable(int status) {
        StageException e = HttpCapabilityClient.classify(status, "crawl", "");

        assertThat(e).isInstanceOf(RetryableIoException.class);
        assertThat(e.isRetryable()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 404, 422})
    void classify_clientErrors_areFatal(int status) {
        StageException e = HttpCapabilityClient.classify(status, "crawl", "{\"error\":\"bad url\"}");

        assertThat(e).isInstanceOf(InvalidInputException.class);
        assertThat(e.isRetryable()).isFalse();
        assertThat(e).hasMessageContaining("bad url");
    }
}

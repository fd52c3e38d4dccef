package com.proxylens.report.narrative;

import com.fasterxml.jackson.databind.JsonNode;
import com.proxylens.report.ReportMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReasoningClientRestImpl Tests")
class ReasoningClientRestImplTest {

    private SimpleMeterRegistry meterRegistry;
    private ReportMetrics metrics;
    private ReasoningRequest request;
    private AtomicReference<ClientRequest> captured;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ReportMetrics(meterRegistry);
        request = new ReasoningRequest("upload-1", Map.of(), List.of(), List.of(), List.of());
        captured = new AtomicReference<>();
    }

    private ReasoningClientRestImpl client(HttpStatus status, String body) {
        ExchangeFunction exchange = clientRequest -> {
            captured.set(clientRequest);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
        };
        return new ReasoningClientRestImpl(WebClient.builder().exchangeFunction(exchange), metrics,
            "http://reasoning.local", "secret-key", 5000);
    }

    @Test
    @DisplayName("Should post the request and return the draft")
    void shouldReturnDraft() {
        ReasoningClientRestImpl client = client(HttpStatus.OK, "{\"summary\":\"ok\"}");

        StepVerifier.create(client.draftReport(request))
            .assertNext(draft -> assertThat(draft.path("summary").asText()).isEqualTo("ok"))
            .verifyComplete();

        assertThat(captured.get().url().toString()).isEqualTo("http://reasoning.local/v1/soc-report");
        assertThat(captured.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-key");
        assertThat(meterRegistry.get("proxylens.report.reasoning.calls").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should translate error statuses")
    void shouldTranslateErrorStatus() {
        ReasoningClientRestImpl client = client(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"overloaded\"}");

        StepVerifier.create(client.draftReport(request))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ReasoningClientException.class);
                assertThat(((ReasoningClientException) error).getStatusCode()).isEqualTo(503);
            })
            .verify();

        assertThat(meterRegistry.get("proxylens.report.reasoning.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fail fast when no base url is configured")
    void shouldFailFastWhenDisabled() {
        ReasoningClientRestImpl client = new ReasoningClientRestImpl(WebClient.builder(), metrics, "", "", 5000);

        Mono<JsonNode> draft = client.draftReport(request);

        StepVerifier.create(draft)
            .expectErrorMatches(error -> error instanceof ReasoningClientException
                && error.getMessage().contains("not configured"))
            .verify();
        assertThat(meterRegistry.get("proxylens.report.reasoning.calls").counter().count()).isZero();
    }
}

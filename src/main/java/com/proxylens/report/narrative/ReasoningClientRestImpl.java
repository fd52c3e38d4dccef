package com.proxylens.report.narrative;

import com.fasterxml.jackson.databind.JsonNode;
import com.proxylens.report.ReportMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * REST implementation of ReasoningClient.
 *
 * Features:
 * - POST {base-url}/v1/soc-report with a bearer API key
 * - Per-call timeout
 * - Circuit breaker so a failing service is skipped quickly
 * - Fails fast when no base URL is configured
 */
@Component
public class ReasoningClientRestImpl implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(ReasoningClientRestImpl.class);

    static final String REPORT_PATH = "/v1/soc-report";

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final ReportMetrics metrics;
    private final boolean enabled;
    private final String apiKey;
    private final Duration timeout;

    public ReasoningClientRestImpl(
            WebClient.Builder webClientBuilder,
            ReportMetrics metrics,
            @Value("${proxylens.reasoning.base-url:}") String baseUrl,
            @Value("${proxylens.reasoning.api-key:}") String apiKey,
            @Value("${proxylens.reasoning.timeout-ms:20000}") long timeoutMs) {
        this.metrics = metrics;
        this.enabled = baseUrl != null && !baseUrl.isBlank();
        this.apiKey = apiKey;
        this.timeout = Duration.ofMillis(timeoutMs);
        this.webClient = enabled ? webClientBuilder.baseUrl(baseUrl).build() : null;

        // Opens at 50% failures over the last 10 calls, probes again after 60s
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(60))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();

        this.circuitBreaker = CircuitBreaker.of("reasoningClient", cbConfig);

        if (!enabled) {
            log.info("Reasoning service not configured, reports will use template narratives");
        }
    }

    @Override
    public Mono<JsonNode> draftReport(ReasoningRequest request) {
        if (!enabled) {
            return Mono.error(new ReasoningClientException("Reasoning service is not configured"));
        }
        metrics.recordReasoningCall();

        return webClient.post()
            .uri(REPORT_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .headers(this::authorize)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .switchIfEmpty(Mono.error(new ReasoningClientException("Reasoning service returned an empty body")))
            .onErrorMap(e -> !(e instanceof ReasoningClientException), this::translate)
            .doOnSuccess(draft -> log.debug("Reasoning draft received for upload {}", request.getUploadId()))
            .doOnError(e -> {
                metrics.recordReasoningError();
                log.warn("Reasoning call failed for upload {}: {}", request.getUploadId(), e.getMessage());
            });
    }

    private void authorize(HttpHeaders headers) {
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
    }

    private ReasoningClientException translate(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            WebClientResponseException ex = (WebClientResponseException) throwable;
            return new ReasoningClientException(
                "Reasoning service answered " + ex.getStatusCode().value(), ex.getStatusCode().value(), ex);
        }
        if (throwable instanceof TimeoutException) {
            return new ReasoningClientException("Reasoning service timed out after " + timeout.toMillis() + "ms", throwable);
        }
        if (throwable instanceof CallNotPermittedException) {
            return new ReasoningClientException("Reasoning service circuit is open", throwable);
        }
        return new ReasoningClientException("Reasoning service call failed: " + throwable.getMessage(), throwable);
    }
}

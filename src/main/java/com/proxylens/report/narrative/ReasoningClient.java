package com.proxylens.report.narrative;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Client for the external reasoning service that drafts report narratives.
 *
 * The draft is untrusted: callers validate it before use and fall back to the
 * template narrative on any error.
 */
public interface ReasoningClient {

    /**
     * Request a narrative draft for a structured report.
     *
     * @param request upload context, findings, synthesized incidents and sampled events
     * @return the draft as returned by the service, a JSON object or a JSON string holding one;
     *         errors with {@link ReasoningClientException} when the service cannot be used
     */
    Mono<JsonNode> draftReport(ReasoningRequest request);
}

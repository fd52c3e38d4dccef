package com.proxylens.report.narrative;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Incident;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body sent to the reasoning service.
 */
public class ReasoningRequest {

    @JsonProperty("upload_id")
    private String uploadId;

    @JsonProperty("upload")
    private Map<String, Object> upload = new LinkedHashMap<>();

    @JsonProperty("findings")
    private List<Finding> findings = new ArrayList<>();

    @JsonProperty("incidents")
    private List<Incident> incidents = new ArrayList<>();

    @JsonProperty("events")
    private List<Map<String, Object>> events = new ArrayList<>();

    public ReasoningRequest() {
    }

    public ReasoningRequest(String uploadId, Map<String, Object> upload, List<Finding> findings,
                            List<Incident> incidents, List<Map<String, Object>> events) {
        this.uploadId = uploadId;
        this.upload = new LinkedHashMap<>(upload);
        this.findings = new ArrayList<>(findings);
        this.incidents = new ArrayList<>(incidents);
        this.events = new ArrayList<>(events);
    }

    public String getUploadId() {
        return uploadId;
    }

    public Map<String, Object> getUpload() {
        return upload;
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public List<Incident> getIncidents() {
        return incidents;
    }

    /**
     * Sampled raw events, as summary maps
     */
    public List<Map<String, Object>> getEvents() {
        return events;
    }
}

package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyst-facing report for one upload.
 *
 * A report is always structurally complete: the summary is never empty and every
 * list is present, even when the narrative came from the template generator.
 */
public class SocReport {

    @JsonProperty("upload_id")
    private String uploadId;

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("timeline")
    private List<TimelineItem> timeline = new ArrayList<>();

    @JsonProperty("incidents")
    private List<Incident> incidents = new ArrayList<>();

    @JsonProperty("iocs")
    private IocSet iocs = new IocSet();

    @JsonProperty("gaps")
    private List<String> gaps = new ArrayList<>();

    @JsonProperty("narrative_source")
    private NarrativeSource narrativeSource;

    @JsonProperty("generated_at")
    private Instant generatedAt;

    public String getUploadId() {
        return uploadId;
    }

    public void setUploadId(String uploadId) {
        this.uploadId = uploadId;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public List<TimelineItem> getTimeline() {
        return timeline;
    }

    public void setTimeline(List<TimelineItem> timeline) {
        this.timeline = timeline;
    }

    public List<Incident> getIncidents() {
        return incidents;
    }

    public void setIncidents(List<Incident> incidents) {
        this.incidents = incidents;
    }

    public IocSet getIocs() {
        return iocs;
    }

    public void setIocs(IocSet iocs) {
        this.iocs = iocs;
    }

    public List<String> getGaps() {
        return gaps;
    }

    public void setGaps(List<String> gaps) {
        this.gaps = gaps;
    }

    public NarrativeSource getNarrativeSource() {
        return narrativeSource;
    }

    public void setNarrativeSource(NarrativeSource narrativeSource) {
        this.narrativeSource = narrativeSource;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(Instant generatedAt) {
        this.generatedAt = generatedAt;
    }
}

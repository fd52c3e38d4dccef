package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a report timeline, spanning the activity behind a finding.
 */
public class TimelineItem {

    @JsonProperty("ts_start")
    private Instant tsStart;

    @JsonProperty("ts_end")
    private Instant tsEnd;

    @JsonProperty("label")
    private String label;

    @JsonProperty("evidence_finding_ids")
    private List<String> evidenceFindingIds = new ArrayList<>();

    @JsonProperty("evidence_event_ids")
    private List<String> evidenceEventIds = new ArrayList<>();

    public TimelineItem() {
    }

    public TimelineItem(Instant tsStart, Instant tsEnd, String label,
                        List<String> evidenceFindingIds, List<String> evidenceEventIds) {
        this.tsStart = tsStart;
        this.tsEnd = tsEnd;
        this.label = label;
        this.evidenceFindingIds = new ArrayList<>(evidenceFindingIds);
        this.evidenceEventIds = new ArrayList<>(evidenceEventIds);
    }

    public Instant getTsStart() {
        return tsStart;
    }

    public void setTsStart(Instant tsStart) {
        this.tsStart = tsStart;
    }

    public Instant getTsEnd() {
        return tsEnd;
    }

    public void setTsEnd(Instant tsEnd) {
        this.tsEnd = tsEnd;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public List<String> getEvidenceFindingIds() {
        return evidenceFindingIds;
    }

    public void setEvidenceFindingIds(List<String> evidenceFindingIds) {
        this.evidenceFindingIds = evidenceFindingIds;
    }

    public List<String> getEvidenceEventIds() {
        return evidenceEventIds;
    }

    public void setEvidenceEventIds(List<String> evidenceEventIds) {
        this.evidenceEventIds = evidenceEventIds;
    }
}

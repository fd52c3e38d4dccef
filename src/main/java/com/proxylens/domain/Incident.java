package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A synthesized group of related findings, presented as one investigative unit.
 * Built fresh for every report and never persisted by this service.
 */
public class Incident {

    @JsonProperty("title")
    private String title;

    @JsonProperty("severity")
    private Severity severity;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("confirmed")
    private boolean confirmed;

    @JsonProperty("security_outcomes")
    private List<String> securityOutcomes = new ArrayList<>();

    @JsonProperty("affected_entities")
    private AffectedEntities affectedEntities = new AffectedEntities();

    @JsonProperty("evidence_finding_ids")
    private List<String> evidenceFindingIds = new ArrayList<>();

    @JsonProperty("evidence_event_ids")
    private List<String> evidenceEventIds = new ArrayList<>();

    @JsonProperty("pattern_names")
    private List<String> patternNames = new ArrayList<>();

    @JsonProperty("first_seen")
    private Instant firstSeen;

    @JsonProperty("last_seen")
    private Instant lastSeen;

    @JsonProperty("why")
    private List<String> why = new ArrayList<>();

    @JsonProperty("recommended_actions")
    private List<String> recommendedActions = new ArrayList<>();

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    public void setConfirmed(boolean confirmed) {
        this.confirmed = confirmed;
    }

    public List<String> getSecurityOutcomes() {
        return securityOutcomes;
    }

    public void setSecurityOutcomes(List<String> securityOutcomes) {
        this.securityOutcomes = securityOutcomes;
    }

    public AffectedEntities getAffectedEntities() {
        return affectedEntities;
    }

    public void setAffectedEntities(AffectedEntities affectedEntities) {
        this.affectedEntities = affectedEntities;
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

    public List<String> getPatternNames() {
        return patternNames;
    }

    public void setPatternNames(List<String> patternNames) {
        this.patternNames = patternNames;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public void setFirstSeen(Instant firstSeen) {
        this.firstSeen = firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public List<String> getWhy() {
        return why;
    }

    public void setWhy(List<String> why) {
        this.why = why;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    public void setRecommendedActions(List<String> recommendedActions) {
        this.recommendedActions = recommendedActions;
    }

    @Override
    public String toString() {
        return "Incident{" +
            "title='" + title + '\'' +
            ", severity=" + severity +
            ", confidence=" + confidence +
            ", confirmed=" + confirmed +
            ", findings=" + evidenceFindingIds.size() +
            '}';
    }
}

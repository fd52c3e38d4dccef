package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Output of one detection rule: a scored, evidenced suspicious pattern instance.
 *
 * Findings are immutable and append-only. The evidence map holds plain JSON
 * values (strings, numbers, booleans and lists of those) keyed as in
 * {@link EvidenceKeys}.
 */
public final class Finding {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("upload_id")
    private final String uploadId;

    @JsonProperty("pattern_name")
    private final String patternName;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("summary")
    private final String summary;

    @JsonProperty("evidence")
    private final Map<String, Object> evidence;

    @JsonProperty("created_at")
    private final Instant createdAt;

    private Finding(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.uploadId = Objects.requireNonNull(builder.uploadId, "uploadId");
        this.patternName = Objects.requireNonNull(builder.patternName, "patternName");
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.title = Objects.requireNonNull(builder.title, "title");
        this.summary = builder.summary != null ? builder.summary : builder.title;
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(builder.evidence));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getUploadId() {
        return uploadId;
    }

    public String getPatternName() {
        return patternName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getTitle() {
        return title;
    }

    public String getSummary() {
        return summary;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * String evidence value, empty when absent or blank.
     */
    public Optional<String> evidenceString(String key) {
        Object value = evidence.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    /**
     * List evidence value as strings. A scalar value is returned as a singleton.
     */
    public List<String> evidenceList(String key) {
        Object value = evidence.get(key);
        if (value == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        if (value instanceof Iterable) {
            for (Object item : (Iterable<?>) value) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
        } else {
            out.add(value.toString());
        }
        return out;
    }

    @JsonIgnore
    public List<String> getEventIds() {
        return evidenceList(EvidenceKeys.EVENT_IDS);
    }

    @Override
    public String toString() {
        return "Finding{" +
            "id='" + id + '\'' +
            ", patternName='" + patternName + '\'' +
            ", severity=" + severity +
            ", confidence=" + confidence +
            ", title='" + title + '\'' +
            '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String uploadId;
        private String patternName;
        private Severity severity;
        private double confidence;
        private String title;
        private String summary;
        private final Map<String, Object> evidence = new LinkedHashMap<>();
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder uploadId(String uploadId) {
            this.uploadId = uploadId;
            return this;
        }

        public Builder patternName(String patternName) {
            this.patternName = patternName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        /**
         * Adds an evidence entry; null values are skipped.
         */
        public Builder evidence(String key, Object value) {
            if (value != null) {
                this.evidence.put(key, value);
            }
            return this;
        }

        public Builder evidence(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::evidence);
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }
}

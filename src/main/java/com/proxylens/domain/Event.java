package com.proxylens.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One normalized proxy log record derived from a single input line.
 *
 * Every typed attribute is optional and exposed as an {@link Optional}. The raw
 * line is always kept verbatim, even when no typed field could be extracted.
 * Events are immutable once built.
 */
public final class Event {

    private final String id;
    private final String uploadId;
    private final Instant timestamp;
    private final String vendorEventId;
    private final String vendor;
    private final String dialect;
    private final String action;
    private final String reason;
    private final String severity;
    private final String httpStatus;
    private final String userEmail;
    private final String department;
    private final String location;
    private final String clientIp;
    private final String serverIp;
    private final String destHost;
    private final String url;
    private final String requestMethod;
    private final String urlCategory;
    private final String threatCategory;
    private final String threatName;
    private final Integer riskScore;
    private final Long requestSize;
    private final Long responseSize;
    private final Long transactionSize;
    private final String raw;

    private Event(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.uploadId = Objects.requireNonNull(builder.uploadId, "uploadId");
        this.raw = Objects.requireNonNull(builder.raw, "raw");
        this.timestamp = builder.timestamp;
        this.vendorEventId = builder.vendorEventId;
        this.vendor = builder.vendor;
        this.dialect = builder.dialect;
        this.action = builder.action;
        this.reason = builder.reason;
        this.severity = builder.severity;
        this.httpStatus = builder.httpStatus;
        this.userEmail = builder.userEmail;
        this.department = builder.department;
        this.location = builder.location;
        this.clientIp = builder.clientIp;
        this.serverIp = builder.serverIp;
        this.destHost = builder.destHost;
        this.url = builder.url;
        this.requestMethod = builder.requestMethod;
        this.urlCategory = builder.urlCategory;
        this.threatCategory = builder.threatCategory;
        this.threatName = builder.threatName;
        this.riskScore = builder.riskScore;
        this.requestSize = builder.requestSize;
        this.responseSize = builder.responseSize;
        this.transactionSize = builder.transactionSize;
    }

    public String getId() {
        return id;
    }

    public String getUploadId() {
        return uploadId;
    }

    public String getRaw() {
        return raw;
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<String> getVendorEventId() {
        return Optional.ofNullable(vendorEventId);
    }

    public Optional<String> getVendor() {
        return Optional.ofNullable(vendor);
    }

    public Optional<String> getDialect() {
        return Optional.ofNullable(dialect);
    }

    public Optional<String> getAction() {
        return Optional.ofNullable(action);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public Optional<String> getHttpStatus() {
        return Optional.ofNullable(httpStatus);
    }

    public Optional<String> getUserEmail() {
        return Optional.ofNullable(userEmail);
    }

    public Optional<String> getDepartment() {
        return Optional.ofNullable(department);
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<String> getClientIp() {
        return Optional.ofNullable(clientIp);
    }

    public Optional<String> getServerIp() {
        return Optional.ofNullable(serverIp);
    }

    public Optional<String> getDestHost() {
        return Optional.ofNullable(destHost);
    }

    public Optional<String> getUrl() {
        return Optional.ofNullable(url);
    }

    public Optional<String> getRequestMethod() {
        return Optional.ofNullable(requestMethod);
    }

    public Optional<String> getUrlCategory() {
        return Optional.ofNullable(urlCategory);
    }

    public Optional<String> getThreatCategory() {
        return Optional.ofNullable(threatCategory);
    }

    public Optional<String> getThreatName() {
        return Optional.ofNullable(threatName);
    }

    public Optional<Integer> getRiskScore() {
        return Optional.ofNullable(riskScore);
    }

    public Optional<Long> getRequestSize() {
        return Optional.ofNullable(requestSize);
    }

    public Optional<Long> getResponseSize() {
        return Optional.ofNullable(responseSize);
    }

    public Optional<Long> getTransactionSize() {
        return Optional.ofNullable(transactionSize);
    }

    public boolean isBlocked() {
        return "Blocked".equals(action);
    }

    /**
     * Compact view of the populated fields, keyed by their snake_case names.
     * Used when events are sampled into reports and reasoning requests.
     */
    public Map<String, Object> toSummaryMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        if (timestamp != null) {
            map.put("ts", timestamp.toString());
        }
        if (vendorEventId != null) {
            map.put("event_id", vendorEventId);
        }
        if (vendor != null) {
            map.put("vendor", vendor);
        }
        if (dialect != null) {
            map.put("dialect", dialect);
        }
        if (action != null) {
            map.put("action", action);
        }
        if (reason != null) {
            map.put("reason", reason);
        }
        if (severity != null) {
            map.put("severity", severity);
        }
        if (httpStatus != null) {
            map.put("http_status", httpStatus);
        }
        if (userEmail != null) {
            map.put("user_email", userEmail);
        }
        if (department != null) {
            map.put("department", department);
        }
        if (location != null) {
            map.put("location", location);
        }
        if (clientIp != null) {
            map.put("client_ip", clientIp);
        }
        if (serverIp != null) {
            map.put("server_ip", serverIp);
        }
        if (destHost != null) {
            map.put("dest_host", destHost);
        }
        if (url != null) {
            map.put("url", url);
        }
        if (requestMethod != null) {
            map.put("request_method", requestMethod);
        }
        if (urlCategory != null) {
            map.put("url_category", urlCategory);
        }
        if (threatCategory != null) {
            map.put("threat_category", threatCategory);
        }
        if (threatName != null) {
            map.put("threat_name", threatName);
        }
        if (riskScore != null) {
            map.put("risk_score", riskScore);
        }
        if (requestSize != null) {
            map.put("request_size", requestSize);
        }
        if (responseSize != null) {
            map.put("response_size", responseSize);
        }
        if (transactionSize != null) {
            map.put("transaction_size", transactionSize);
        }
        return map;
    }

    public Builder toBuilder() {
        Builder builder = new Builder().id(id).uploadId(uploadId).raw(raw);
        builder.timestamp = timestamp;
        builder.vendorEventId = vendorEventId;
        builder.vendor = vendor;
        builder.dialect = dialect;
        builder.action = action;
        builder.reason = reason;
        builder.severity = severity;
        builder.httpStatus = httpStatus;
        builder.userEmail = userEmail;
        builder.department = department;
        builder.location = location;
        builder.clientIp = clientIp;
        builder.serverIp = serverIp;
        builder.destHost = destHost;
        builder.url = url;
        builder.requestMethod = requestMethod;
        builder.urlCategory = urlCategory;
        builder.threatCategory = threatCategory;
        builder.threatName = threatName;
        builder.riskScore = riskScore;
        builder.requestSize = requestSize;
        builder.responseSize = responseSize;
        builder.transactionSize = transactionSize;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return id.equals(event.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Event{" +
            "id='" + id + '\'' +
            ", uploadId='" + uploadId + '\'' +
            ", timestamp=" + timestamp +
            ", userEmail='" + userEmail + '\'' +
            ", clientIp='" + clientIp + '\'' +
            ", destHost='" + destHost + '\'' +
            ", action='" + action + '\'' +
            ", threatCategory='" + threatCategory + '\'' +
            '}';
    }

    public static class Builder {
        private String id;
        private String uploadId;
        private String raw;
        private Instant timestamp;
        private String vendorEventId;
        private String vendor;
        private String dialect;
        private String action;
        private String reason;
        private String severity;
        private String httpStatus;
        private String userEmail;
        private String department;
        private String location;
        private String clientIp;
        private String serverIp;
        private String destHost;
        private String url;
        private String requestMethod;
        private String urlCategory;
        private String threatCategory;
        private String threatName;
        private Integer riskScore;
        private Long requestSize;
        private Long responseSize;
        private Long transactionSize;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder uploadId(String uploadId) {
            this.uploadId = uploadId;
            return this;
        }

        public Builder raw(String raw) {
            this.raw = raw;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder vendorEventId(String vendorEventId) {
            this.vendorEventId = vendorEventId;
            return this;
        }

        public Builder vendor(String vendor) {
            this.vendor = vendor;
            return this;
        }

        public Builder dialect(String dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder httpStatus(String httpStatus) {
            this.httpStatus = httpStatus;
            return this;
        }

        public Builder userEmail(String userEmail) {
            this.userEmail = userEmail;
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder clientIp(String clientIp) {
            this.clientIp = clientIp;
            return this;
        }

        public Builder serverIp(String serverIp) {
            this.serverIp = serverIp;
            return this;
        }

        public Builder destHost(String destHost) {
            this.destHost = destHost;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder requestMethod(String requestMethod) {
            this.requestMethod = requestMethod;
            return this;
        }

        public Builder urlCategory(String urlCategory) {
            this.urlCategory = urlCategory;
            return this;
        }

        public Builder threatCategory(String threatCategory) {
            this.threatCategory = threatCategory;
            return this;
        }

        public Builder threatName(String threatName) {
            this.threatName = threatName;
            return this;
        }

        public Builder riskScore(Integer riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder requestSize(Long requestSize) {
            this.requestSize = requestSize;
            return this;
        }

        public Builder responseSize(Long responseSize) {
            this.responseSize = responseSize;
            return this;
        }

        public Builder transactionSize(Long transactionSize) {
            this.transactionSize = transactionSize;
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }
}

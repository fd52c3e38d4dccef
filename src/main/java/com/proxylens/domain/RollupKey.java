package com.proxylens.domain;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Composite key of a per-minute rollup bucket.
 *
 * No component is ever null: missing dimensions use {@link #UNSET} and events
 * without a timestamp fall into {@link #UNSET_BUCKET}.
 */
public final class RollupKey implements Comparable<RollupKey> {

    public static final String UNSET = "<unset>";

    public static final Instant UNSET_BUCKET = Instant.EPOCH;

    private final String uploadId;
    private final Instant bucket;
    private final String userEmail;
    private final String clientIp;
    private final String destHost;
    private final String action;
    private final String threatCategory;

    public RollupKey(String uploadId, Instant bucket, String userEmail, String clientIp,
                     String destHost, String action, String threatCategory) {
        this.uploadId = Objects.requireNonNull(uploadId, "uploadId");
        this.bucket = bucket == null ? UNSET_BUCKET : bucket;
        this.userEmail = orUnset(userEmail);
        this.clientIp = orUnset(clientIp);
        this.destHost = orUnset(destHost);
        this.action = orUnset(action);
        this.threatCategory = orUnset(threatCategory);
    }

    /**
     * Key for the bucket an event falls into.
     */
    public static RollupKey of(Event event) {
        Instant minute = event.getTimestamp()
            .map(ts -> ts.truncatedTo(ChronoUnit.MINUTES))
            .orElse(UNSET_BUCKET);
        return new RollupKey(
            event.getUploadId(),
            minute,
            event.getUserEmail().orElse(null),
            event.getClientIp().orElse(null),
            event.getDestHost().orElse(null),
            event.getAction().orElse(null),
            event.getThreatCategory().orElse(null));
    }

    public static boolean isUnset(String value) {
        return value == null || UNSET.equals(value);
    }

    private static String orUnset(String value) {
        return value == null || value.isEmpty() ? UNSET : value;
    }

    public String getUploadId() {
        return uploadId;
    }

    public Instant getBucket() {
        return bucket;
    }

    public boolean hasBucket() {
        return !UNSET_BUCKET.equals(bucket);
    }

    public String getUserEmail() {
        return userEmail;
    }

    public String getClientIp() {
        return clientIp;
    }

    public String getDestHost() {
        return destHost;
    }

    public String getAction() {
        return action;
    }

    public String getThreatCategory() {
        return threatCategory;
    }

    @Override
    public int compareTo(RollupKey other) {
        int c = bucket.compareTo(other.bucket);
        if (c != 0) return c;
        c = userEmail.compareTo(other.userEmail);
        if (c != 0) return c;
        c = clientIp.compareTo(other.clientIp);
        if (c != 0) return c;
        c = destHost.compareTo(other.destHost);
        if (c != 0) return c;
        c = action.compareTo(other.action);
        if (c != 0) return c;
        return threatCategory.compareTo(other.threatCategory);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RollupKey that = (RollupKey) o;
        return uploadId.equals(that.uploadId)
            && bucket.equals(that.bucket)
            && userEmail.equals(that.userEmail)
            && clientIp.equals(that.clientIp)
            && destHost.equals(that.destHost)
            && action.equals(that.action)
            && threatCategory.equals(that.threatCategory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uploadId, bucket, userEmail, clientIp, destHost, action, threatCategory);
    }

    @Override
    public String toString() {
        return "RollupKey{" + uploadId + ", " + bucket + ", " + userEmail + ", " + clientIp
            + ", " + destHost + ", " + action + ", " + threatCategory + '}';
    }
}

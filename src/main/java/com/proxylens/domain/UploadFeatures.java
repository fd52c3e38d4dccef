package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Statistical profile of one upload: volume, time range, block ratio and the
 * most frequent entities. Derived from stored events.
 */
public class UploadFeatures {

    @JsonProperty("upload_id")
    private String uploadId;

    @JsonProperty("total_events")
    private long totalEvents;

    @JsonProperty("time_start")
    private Instant timeStart;

    @JsonProperty("time_end")
    private Instant timeEnd;

    @JsonProperty("blocked")
    private long blocked;

    @JsonProperty("allowed")
    private long allowed;

    @JsonProperty("untimed_events")
    private long untimedEvents;

    @JsonProperty("events_with_server_ip")
    private long eventsWithServerIp;

    @JsonProperty("dns_events")
    private long dnsEvents;

    @JsonProperty("top_users")
    private Map<String, Long> topUsers = new LinkedHashMap<>();

    @JsonProperty("top_client_ips")
    private Map<String, Long> topClientIps = new LinkedHashMap<>();

    @JsonProperty("top_dest_hosts")
    private Map<String, Long> topDestHosts = new LinkedHashMap<>();

    @JsonProperty("top_threat_categories")
    private Map<String, Long> topThreatCategories = new LinkedHashMap<>();

    public String getUploadId() {
        return uploadId;
    }

    public void setUploadId(String uploadId) {
        this.uploadId = uploadId;
    }

    public long getTotalEvents() {
        return totalEvents;
    }

    public void setTotalEvents(long totalEvents) {
        this.totalEvents = totalEvents;
    }

    public Instant getTimeStart() {
        return timeStart;
    }

    public void setTimeStart(Instant timeStart) {
        this.timeStart = timeStart;
    }

    public Instant getTimeEnd() {
        return timeEnd;
    }

    public void setTimeEnd(Instant timeEnd) {
        this.timeEnd = timeEnd;
    }

    public long getBlocked() {
        return blocked;
    }

    public void setBlocked(long blocked) {
        this.blocked = blocked;
    }

    public long getAllowed() {
        return allowed;
    }

    public void setAllowed(long allowed) {
        this.allowed = allowed;
    }

    public long getUntimedEvents() {
        return untimedEvents;
    }

    public void setUntimedEvents(long untimedEvents) {
        this.untimedEvents = untimedEvents;
    }

    public long getEventsWithServerIp() {
        return eventsWithServerIp;
    }

    public void setEventsWithServerIp(long eventsWithServerIp) {
        this.eventsWithServerIp = eventsWithServerIp;
    }

    /**
     * Events whose URL or threat category is DNS related
     */
    public long getDnsEvents() {
        return dnsEvents;
    }

    public void setDnsEvents(long dnsEvents) {
        this.dnsEvents = dnsEvents;
    }

    public Map<String, Long> getTopUsers() {
        return topUsers;
    }

    public void setTopUsers(Map<String, Long> topUsers) {
        this.topUsers = topUsers;
    }

    public Map<String, Long> getTopClientIps() {
        return topClientIps;
    }

    public void setTopClientIps(Map<String, Long> topClientIps) {
        this.topClientIps = topClientIps;
    }

    public Map<String, Long> getTopDestHosts() {
        return topDestHosts;
    }

    public void setTopDestHosts(Map<String, Long> topDestHosts) {
        this.topDestHosts = topDestHosts;
    }

    public Map<String, Long> getTopThreatCategories() {
        return topThreatCategories;
    }

    public void setTopThreatCategories(Map<String, Long> topThreatCategories) {
        this.topThreatCategories = topThreatCategories;
    }
}

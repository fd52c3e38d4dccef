package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Entities touched by an incident. Each set is kept sorted and free of duplicates.
 */
public class AffectedEntities {

    @JsonProperty("user_emails")
    private Set<String> userEmails = new TreeSet<>();

    @JsonProperty("client_ips")
    private Set<String> clientIps = new TreeSet<>();

    @JsonProperty("dest_hosts")
    private Set<String> destHosts = new TreeSet<>();

    @JsonProperty("threat_categories")
    private Set<String> threatCategories = new TreeSet<>();

    public Set<String> getUserEmails() {
        return userEmails;
    }

    public void setUserEmails(Set<String> userEmails) {
        this.userEmails = new TreeSet<>(userEmails);
    }

    public Set<String> getClientIps() {
        return clientIps;
    }

    public void setClientIps(Set<String> clientIps) {
        this.clientIps = new TreeSet<>(clientIps);
    }

    public Set<String> getDestHosts() {
        return destHosts;
    }

    public void setDestHosts(Set<String> destHosts) {
        this.destHosts = new TreeSet<>(destHosts);
    }

    public Set<String> getThreatCategories() {
        return threatCategories;
    }

    public void setThreatCategories(Set<String> threatCategories) {
        this.threatCategories = new TreeSet<>(threatCategories);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return userEmails.isEmpty() && clientIps.isEmpty() && destHosts.isEmpty() && threatCategories.isEmpty();
    }

    /**
     * Short human-readable description, e.g. "user a@b.com, ip 10.0.0.5".
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (!userEmails.isEmpty()) {
            parts.add("user " + String.join("/", userEmails));
        }
        if (!clientIps.isEmpty()) {
            parts.add("ip " + String.join("/", clientIps));
        }
        if (!destHosts.isEmpty()) {
            parts.add("host " + String.join("/", destHosts));
        }
        if (!threatCategories.isEmpty()) {
            parts.add("category " + String.join("/", threatCategories));
        }
        return parts.isEmpty() ? "unattributed activity" : String.join(", ", parts);
    }
}

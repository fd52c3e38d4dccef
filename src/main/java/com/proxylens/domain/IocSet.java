package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;
import java.util.TreeSet;

/**
 * Indicators of compromise collected for a report, deduplicated by exact string.
 */
public class IocSet {

    @JsonProperty("domains")
    private Set<String> domains = new TreeSet<>();

    @JsonProperty("urls")
    private Set<String> urls = new TreeSet<>();

    @JsonProperty("ips")
    private Set<String> ips = new TreeSet<>();

    @JsonProperty("users")
    private Set<String> users = new TreeSet<>();

    public Set<String> getDomains() {
        return domains;
    }

    public void setDomains(Set<String> domains) {
        this.domains = new TreeSet<>(domains);
    }

    public Set<String> getUrls() {
        return urls;
    }

    public void setUrls(Set<String> urls) {
        this.urls = new TreeSet<>(urls);
    }

    public Set<String> getIps() {
        return ips;
    }

    public void setIps(Set<String> ips) {
        this.ips = new TreeSet<>(ips);
    }

    public Set<String> getUsers() {
        return users;
    }

    public void setUsers(Set<String> users) {
        this.users = new TreeSet<>(users);
    }

    public int size() {
        return domains.size() + urls.size() + ips.size() + users.size();
    }
}

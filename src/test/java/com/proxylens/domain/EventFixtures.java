package com.proxylens.domain;

import java.time.Instant;

/**
 * Builders for events used across tests.
 */
public final class EventFixtures {

    public static final String UPLOAD = "upload-1";
    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private EventFixtures() {
    }

    public static Event.Builder event() {
        return Event.builder()
            .uploadId(UPLOAD)
            .raw("raw")
            .timestamp(T0)
            .action("Allowed");
    }

    public static Event.Builder blocked(String user, String clientIp, String host, String threatCategory) {
        return event()
            .action("Blocked")
            .userEmail(user)
            .clientIp(clientIp)
            .destHost(host)
            .url("https://" + host + "/path")
            .threatCategory(threatCategory);
    }
}

package com.proxylens.report;

import com.proxylens.domain.IngestJob;
import com.proxylens.domain.UploadFeatures;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists visibility gaps that limit what the report can conclude.
 */
@Component
public class GapAnalyzer {

    static final String NO_DNS =
        "No DNS telemetry: resolution of flagged domains cannot be confirmed from these logs.";
    static final String NO_SERVER_IPS =
        "No server-side IPs recorded: destination infrastructure cannot be pivoted on.";
    static final String NO_USERS =
        "No user attribution: activity can only be tied to client IPs.";
    static final String PROXY_ONLY =
        "Proxy visibility only: no endpoint telemetry to confirm execution on affected hosts.";
    public static final String DEGRADED_NARRATIVE =
        "Narrative generated from templates because the reasoning service was unavailable or its draft was rejected.";

    public List<String> analyze(UploadFeatures features, Optional<IngestJob> ingestJob) {
        List<String> gaps = new ArrayList<>();

        if (features.getDnsEvents() == 0) {
            gaps.add(NO_DNS);
        }
        if (features.getEventsWithServerIp() == 0) {
            gaps.add(NO_SERVER_IPS);
        }
        if (features.getUntimedEvents() > 0) {
            gaps.add(String.format("%d events had no parseable timestamp and are excluded from time-based analysis.",
                features.getUntimedEvents()));
        }
        if (ingestJob.isPresent() && ingestJob.get().getBadLines() > 0) {
            gaps.add(String.format("%d of %d lines could not be parsed during ingest.",
                ingestJob.get().getBadLines(), ingestJob.get().getProcessedLines()));
        }
        if (features.getTopUsers().isEmpty()) {
            gaps.add(NO_USERS);
        }
        gaps.add(PROXY_ONLY);
        return gaps;
    }
}

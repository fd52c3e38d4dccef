package com.proxylens.report;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Incident;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.UploadFeatures;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic narrative used when the reasoning service cannot provide one.
 *
 * Derives every sentence from the structured report, so the output is stable for
 * identical findings.
 */
@Component
public class FallbackNarrativeGenerator {

    static final int MAX_WHY = 7;
    static final int MAX_ACTIONS = 12;

    private static final List<String> BASELINE_ACTIONS = ImmutableList.of(
        "Confirm the activity against the raw proxy records listed as evidence.",
        "Check with the affected users whether the activity was expected.",
        "Add confirmed malicious destinations to the proxy block list.");

    private static final Map<SecurityOutcome, List<String>> OUTCOME_ACTIONS = ImmutableMap.<SecurityOutcome, List<String>>builder()
        .put(SecurityOutcome.SUSPECTED_ENDPOINT_COMPROMISE_MULTI_STAGE, ImmutableList.of(
            "Isolate the affected endpoint pending investigation.",
            "Run a full EDR scan on the affected host."))
        .put(SecurityOutcome.C2_BEACONING_SUSPECTED, ImmutableList.of(
            "Block the command-and-control destinations at DNS and firewall level.",
            "Hunt for the same destinations across all endpoints."))
        .put(SecurityOutcome.PHISH_TO_PAYLOAD_CHAIN_SUSPECTED, ImmutableList.of(
            "Search mail logs for the phishing message delivered to the user.",
            "Reset the user's credentials and review recent sign-ins."))
        .put(SecurityOutcome.DATA_EXFILTRATION_ATTEMPT_SUSPECTED, ImmutableList.of(
            "Review outbound transfer volumes for the affected user.",
            "Engage data protection to assess what may have left the network."))
        .put(SecurityOutcome.CREDENTIAL_HARVESTING_SUSPECTED, ImmutableList.of(
            "Reset credentials of users who reached the phishing pages.",
            "Enforce MFA re-registration for affected accounts."))
        .put(SecurityOutcome.RANSOMWARE_STAGING_SUSPECTED, ImmutableList.of(
            "Isolate the host and verify backups are intact and offline."))
        .put(SecurityOutcome.CRYPTOMINING_ACTIVITY_SUSPECTED, ImmutableList.of(
            "Inspect the host for mining processes and unexpected CPU load."))
        .put(SecurityOutcome.RECONNAISSANCE_SUSPECTED, ImmutableList.of(
            "Identify the process generating the traffic on the client host.",
            "Rate-limit or block the client IP if the activity is not sanctioned."))
        .put(SecurityOutcome.POLICY_VIOLATION_SUSPECTED, ImmutableList.of(
            "Review the acceptable-use policy with the user's manager."))
        .build();

    /**
     * Fills title, why and recommended actions of every incident
     */
    public void applyTo(List<Incident> incidents, Map<String, Finding> findingsById) {
        for (Incident incident : incidents) {
            incident.setTitle(title(incident));
            incident.setWhy(why(incident, findingsById));
            incident.setRecommendedActions(recommendedActions(incident));
        }
    }

    public String summarize(UploadFeatures features, List<Incident> incidents, int findingCount) {
        StringBuilder summary = new StringBuilder();
        summary.append(String.format("Analysed %d proxy events (%d blocked, %d allowed)",
            features.getTotalEvents(), features.getBlocked(), features.getAllowed()));
        if (features.getTimeStart() != null && features.getTimeEnd() != null) {
            summary.append(" between ").append(features.getTimeStart()).append(" and ").append(features.getTimeEnd());
        }
        summary.append(". ");
        summary.append(String.format("%d findings were grouped into %d incidents",
            findingCount, incidents.size()));

        long confirmed = incidents.stream().filter(Incident::isConfirmed).count();
        if (confirmed > 0) {
            summary.append(String.format(", %d of them corroborated by multiple detections", confirmed));
        }
        summary.append(". ");

        if (!incidents.isEmpty()) {
            Incident top = incidents.get(0);
            summary.append(String.format("The most severe is %s (%s, confidence %.2f) affecting %s.",
                top.getTitle(), top.getSeverity().getValue(), top.getConfidence(),
                top.getAffectedEntities().describe()));
        }
        return summary.toString().trim();
    }

    private static String title(Incident incident) {
        String outcome = incident.getSecurityOutcomes().isEmpty()
            ? SecurityOutcome.INSUFFICIENT_EVIDENCE.getValue()
            : incident.getSecurityOutcomes().get(0);
        String subject = incident.getAffectedEntities().describe();
        if (SecurityOutcome.INSUFFICIENT_EVIDENCE.getValue().equals(outcome)) {
            return humanize(String.join(", ", incident.getPatternNames())) + " involving " + subject;
        }
        return humanize(outcome) + " involving " + subject;
    }

    private static List<String> why(Incident incident, Map<String, Finding> findingsById) {
        List<String> why = new ArrayList<>();
        for (String findingId : incident.getEvidenceFindingIds()) {
            Finding finding = findingsById.get(findingId);
            if (finding != null && why.size() < MAX_WHY) {
                why.add(finding.getSummary() != null ? finding.getSummary() : finding.getTitle());
            }
        }
        if (incident.isConfirmed() && why.size() < MAX_WHY) {
            why.add("Corroborated by " + incident.getPatternNames().size() + " independent detection patterns.");
        }
        return why;
    }

    private static List<String> recommendedActions(Incident incident) {
        Set<String> actions = new LinkedHashSet<>();
        for (String outcome : incident.getSecurityOutcomes()) {
            SecurityOutcome known = SecurityOutcome.fromValueOrNull(outcome);
            if (known != null) {
                actions.addAll(OUTCOME_ACTIONS.getOrDefault(known, List.of()));
            }
        }
        actions.addAll(BASELINE_ACTIONS);
        List<String> ordered = new ArrayList<>(actions);
        return new ArrayList<>(ordered.subList(0, Math.min(ordered.size(), MAX_ACTIONS)));
    }

    static String humanize(String constant) {
        String words = constant.replace('_', ' ').toLowerCase(Locale.ROOT);
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}

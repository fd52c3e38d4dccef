package com.proxylens.report;

import com.proxylens.domain.AffectedEntities;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Incident;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Groups findings that share an affected entity into incidents.
 *
 * Two findings belong to the same incident when they share a user, client IP,
 * destination host or threat category, directly or through other findings.
 * A finding sharing nothing becomes an incident of its own.
 */
@Component
public class IncidentSynthesizer {

    static final double CONFIRMATION_CONFIDENCE = 0.75;
    static final double MAX_CONFIDENCE_DROP = 0.10;
    static final int MAX_EVENT_IDS = 50;

    private static final Comparator<Incident> BY_SEVERITY_THEN_CONFIDENCE =
        Comparator.comparingInt((Incident i) -> i.getSeverity().getRank()).reversed()
            .thenComparing(Comparator.comparingDouble(Incident::getConfidence).reversed());

    /**
     * @param findings findings in presentation order
     * @param eventsById events referenced by the findings
     * @return incidents, most severe first
     */
    public List<Incident> synthesize(List<Finding> findings, Map<String, Event> eventsById) {
        int[] parent = new int[findings.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        Map<String, Integer> firstOwner = new HashMap<>();
        for (int i = 0; i < findings.size(); i++) {
            for (String entity : entityKeys(findings.get(i))) {
                Integer owner = firstOwner.putIfAbsent(entity, i);
                if (owner != null) {
                    union(parent, owner, i);
                }
            }
        }

        Map<Integer, List<Finding>> groups = new LinkedHashMap<>();
        for (int i = 0; i < findings.size(); i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(findings.get(i));
        }

        List<Incident> incidents = new ArrayList<>();
        for (List<Finding> group : groups.values()) {
            incidents.add(toIncident(group, eventsById));
        }
        incidents.sort(BY_SEVERITY_THEN_CONFIDENCE);
        return incidents;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            // keep the earlier finding as root so groups stay in presentation order
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }

    static Set<String> entityKeys(Finding finding) {
        Set<String> keys = new LinkedHashSet<>();
        finding.evidenceString(EvidenceKeys.USER_EMAIL).ifPresent(v -> keys.add("user:" + v));
        finding.evidenceString(EvidenceKeys.CLIENT_IP).ifPresent(v -> keys.add("ip:" + v));
        finding.evidenceString(EvidenceKeys.DEST_HOST).ifPresent(v -> keys.add("host:" + v));
        finding.evidenceString(EvidenceKeys.THREAT_CATEGORY).ifPresent(v -> keys.add("category:" + v));
        for (String category : finding.evidenceList(EvidenceKeys.THREAT_CATEGORIES)) {
            keys.add("category:" + category);
        }
        return keys;
    }

    private Incident toIncident(List<Finding> group, Map<String, Event> eventsById) {
        Incident incident = new Incident();

        Severity severity = null;
        Set<String> patterns = new LinkedHashSet<>();
        Set<String> eventIds = new LinkedHashSet<>();
        List<String> findingIds = new ArrayList<>();
        AffectedEntities entities = new AffectedEntities();
        Instant firstSeen = null;
        Instant lastSeen = null;

        for (Finding finding : group) {
            severity = Severity.max(severity, finding.getSeverity());
            patterns.add(finding.getPatternName());
            findingIds.add(finding.getId());
            for (String eventId : finding.getEventIds()) {
                if (eventIds.size() < MAX_EVENT_IDS) {
                    eventIds.add(eventId);
                }
            }
            finding.evidenceString(EvidenceKeys.USER_EMAIL).ifPresent(entities.getUserEmails()::add);
            finding.evidenceString(EvidenceKeys.CLIENT_IP).ifPresent(entities.getClientIps()::add);
            finding.evidenceString(EvidenceKeys.DEST_HOST).ifPresent(entities.getDestHosts()::add);
            finding.evidenceString(EvidenceKeys.THREAT_CATEGORY).ifPresent(entities.getThreatCategories()::add);
            entities.getThreatCategories().addAll(finding.evidenceList(EvidenceKeys.THREAT_CATEGORIES));

            Optional<FindingSpan> span = FindingSpan.of(finding, eventsById);
            if (span.isPresent()) {
                Instant start = span.get().getStart();
                Instant end = span.get().getEnd();
                firstSeen = firstSeen == null || start.isBefore(firstSeen) ? start : firstSeen;
                lastSeen = lastSeen == null || end.isAfter(lastSeen) ? end : lastSeen;
            }
        }

        double confidence = aggregateConfidence(group);
        Finding primary = group.get(0);

        incident.setTitle(group.size() == 1
            ? primary.getTitle()
            : primary.getTitle() + " and " + (group.size() - 1) + " related findings");
        incident.setSeverity(severity);
        incident.setConfidence(confidence);
        incident.setConfirmed(patterns.size() >= 2 && confidence >= CONFIRMATION_CONFIDENCE);
        incident.setSecurityOutcomes(securityOutcomes(group));
        incident.setAffectedEntities(entities);
        incident.setEvidenceFindingIds(findingIds);
        incident.setEvidenceEventIds(new ArrayList<>(eventIds));
        incident.setPatternNames(new ArrayList<>(patterns));
        incident.setFirstSeen(firstSeen);
        incident.setLastSeen(lastSeen);
        return incident;
    }

    /**
     * Severity-weighted average, raised to at least max - 0.10, capped at 1.0
     */
    static double aggregateConfidence(List<Finding> group) {
        double weighted = 0.0;
        double weights = 0.0;
        double max = 0.0;
        for (Finding finding : group) {
            int weight = finding.getSeverity().getRank();
            weighted += weight * finding.getConfidence();
            weights += weight;
            max = Math.max(max, finding.getConfidence());
        }
        double average = weights == 0 ? 0.0 : weighted / weights;
        double confidence = Math.min(1.0, Math.max(average, max - MAX_CONFIDENCE_DROP));
        return Math.round(confidence * 1000.0) / 1000.0;
    }

    static List<String> securityOutcomes(List<Finding> group) {
        Set<String> outcomes = new LinkedHashSet<>();
        for (Finding finding : group) {
            finding.evidenceString(EvidenceKeys.SECURITY_OUTCOME)
                .map(SecurityOutcome::fromValueOrNull)
                .ifPresent(outcome -> outcomes.add(outcome.getValue()));
        }
        if (outcomes.size() > 1) {
            outcomes.remove(SecurityOutcome.INSUFFICIENT_EVIDENCE.getValue());
        }
        if (outcomes.isEmpty()) {
            outcomes.add(SecurityOutcome.INSUFFICIENT_EVIDENCE.getValue());
        }
        return new ArrayList<>(outcomes);
    }
}

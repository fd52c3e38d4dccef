package com.proxylens.report.narrative;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxylens.domain.Incident;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a reasoning draft field by field against the report schema.
 *
 * All violations are collected before rejecting. Structural fields of the draft
 * (severity, confidence, timeline, IOCs) are checked but never applied; only narrative
 * text, security outcomes and gaps are taken from an accepted draft.
 */
@Component
public class ReportValidator {

    private static final List<String> IOC_KEYS = List.of("domains", "urls", "ips", "users");
    private static final List<String> ENTITY_KEYS = List.of("user_emails", "client_ips", "dest_hosts", "threat_categories");

    private final ObjectMapper objectMapper;

    public ReportValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param draft response of the reasoning service, an object or a string holding JSON
     * @param incidents synthesized incidents the draft must describe, in order
     * @param knownFindingIds ids of the upload's findings
     * @throws ReportValidationException listing every violation
     */
    public ReportNarrative validate(JsonNode draft, List<Incident> incidents, Set<String> knownFindingIds) {
        JsonNode root = unwrap(draft);
        List<String> violations = new ArrayList<>();

        if (!root.isObject()) {
            throw new ReportValidationException(List.of("draft is not a JSON object"));
        }

        String summary = requiredText(root, "summary", "summary", violations);

        List<ReportNarrative.IncidentNarrative> narratives = new ArrayList<>();
        JsonNode incidentsNode = root.get("incidents");
        if (incidentsNode == null || !incidentsNode.isArray()) {
            violations.add("incidents: missing or not an array");
        } else if (incidentsNode.size() != incidents.size()) {
            violations.add(String.format("incidents: expected %d entries, got %d", incidents.size(), incidentsNode.size()));
        } else {
            for (int i = 0; i < incidentsNode.size(); i++) {
                narratives.add(validateIncident(incidentsNode.get(i), "incidents[" + i + "]", knownFindingIds, violations));
            }
        }

        JsonNode timeline = root.get("timeline");
        if (timeline != null && !timeline.isNull()) {
            if (!timeline.isArray()) {
                violations.add("timeline: not an array");
            } else {
                for (int i = 0; i < timeline.size(); i++) {
                    validateTimelineItem(timeline.get(i), "timeline[" + i + "]", knownFindingIds, violations);
                }
            }
        }

        JsonNode iocs = root.get("iocs");
        if (iocs != null && !iocs.isNull()) {
            if (!iocs.isObject()) {
                violations.add("iocs: not an object");
            } else {
                for (String key : IOC_KEYS) {
                    optionalStrings(iocs, key, "iocs." + key, violations);
                }
            }
        }

        List<String> gaps = optionalStrings(root, "gaps", "gaps", violations);

        if (!violations.isEmpty()) {
            throw new ReportValidationException(violations);
        }
        return new ReportNarrative(summary, narratives, gaps);
    }

    private JsonNode unwrap(JsonNode draft) {
        if (draft == null || draft.isNull() || draft.isMissingNode()) {
            throw new ReportValidationException(List.of("draft is empty"));
        }
        if (!draft.isTextual()) {
            return draft;
        }
        try {
            return objectMapper.readTree(draft.asText());
        } catch (JsonProcessingException e) {
            throw new ReportValidationException("draft text is not valid JSON", e);
        }
    }

    private ReportNarrative.IncidentNarrative validateIncident(JsonNode node, String path, Set<String> knownFindingIds,
                                                               List<String> violations) {
        if (!node.isObject()) {
            violations.add(path + ": not an object");
            return null;
        }

        String title = requiredText(node, "title", path + ".title", violations);

        JsonNode severity = node.get("severity");
        if (severity != null && !severity.isNull()) {
            try {
                Severity.fromValue(severity.asText());
            } catch (IllegalArgumentException e) {
                violations.add(path + ".severity: unknown value '" + severity.asText() + "'");
            }
        }

        JsonNode confidence = node.get("confidence");
        if (confidence != null && !confidence.isNull()
                && (!confidence.isNumber() || confidence.asDouble() < 0.0 || confidence.asDouble() > 1.0)) {
            violations.add(path + ".confidence: must be a number in [0, 1]");
        }

        JsonNode confirmed = node.get("confirmed");
        if (confirmed != null && !confirmed.isNull() && !confirmed.isBoolean()) {
            violations.add(path + ".confirmed: not a boolean");
        }

        List<String> outcomes = optionalStrings(node, "security_outcomes", path + ".security_outcomes", violations);
        for (String outcome : outcomes) {
            if (SecurityOutcome.fromValueOrNull(outcome) == null) {
                violations.add(path + ".security_outcomes: unknown outcome '" + outcome + "'");
            }
        }

        JsonNode entities = node.get("affected_entities");
        if (entities != null && !entities.isNull()) {
            if (!entities.isObject()) {
                violations.add(path + ".affected_entities: not an object");
            } else {
                Iterator<Map.Entry<String, JsonNode>> fields = entities.fields();
                while (fields.hasNext()) {
                    String key = fields.next().getKey();
                    if (!ENTITY_KEYS.contains(key)) {
                        violations.add(path + ".affected_entities: unknown key '" + key + "'");
                    }
                }
                for (String key : ENTITY_KEYS) {
                    optionalStrings(entities, key, path + ".affected_entities." + key, violations);
                }
            }
        }

        List<String> findingIds = optionalStrings(node, "evidence_finding_ids", path + ".evidence_finding_ids", violations);
        if (findingIds.isEmpty()) {
            violations.add(path + ".evidence_finding_ids: must cite at least one finding");
        }
        checkKnownFindings(findingIds, path + ".evidence_finding_ids", knownFindingIds, violations);
        optionalStrings(node, "evidence_event_ids", path + ".evidence_event_ids", violations);

        List<String> why = optionalStrings(node, "why", path + ".why", violations);
        List<String> actions = optionalStrings(node, "recommended_actions", path + ".recommended_actions", violations);

        return new ReportNarrative.IncidentNarrative(title, why, actions, outcomes);
    }

    private void validateTimelineItem(JsonNode node, String path, Set<String> knownFindingIds, List<String> violations) {
        if (!node.isObject()) {
            violations.add(path + ": not an object");
            return;
        }
        requiredInstant(node, "ts_start", path, violations);
        requiredInstant(node, "ts_end", path, violations);
        requiredText(node, "label", path + ".label", violations);
        List<String> findingIds = optionalStrings(node, "evidence_finding_ids", path + ".evidence_finding_ids", violations);
        checkKnownFindings(findingIds, path + ".evidence_finding_ids", knownFindingIds, violations);
        optionalStrings(node, "evidence_event_ids", path + ".evidence_event_ids", violations);
    }

    private static void checkKnownFindings(List<String> findingIds, String path, Set<String> knownFindingIds,
                                           List<String> violations) {
        for (String findingId : findingIds) {
            if (!knownFindingIds.contains(findingId)) {
                violations.add(path + ": unknown finding '" + findingId + "'");
            }
        }
    }

    private static String requiredText(JsonNode node, String field, String path, List<String> violations) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            violations.add(path + ": missing or not a non-empty string");
            return null;
        }
        return value.asText().trim();
    }

    private static void requiredInstant(JsonNode node, String field, String path, List<String> violations) {
        String text = requiredText(node, field, path + "." + field, violations);
        if (text == null) {
            return;
        }
        try {
            Instant.parse(text);
        } catch (DateTimeParseException e) {
            violations.add(path + "." + field + ": not an ISO-8601 instant");
        }
    }

    /**
     * Absent or null yields an empty list; anything but an array of strings is a violation
     */
    private static List<String> optionalStrings(JsonNode node, String field, String path, List<String> violations) {
        JsonNode value = node.get(field);
        List<String> out = new ArrayList<>();
        if (value == null || value.isNull()) {
            return out;
        }
        if (!value.isArray()) {
            violations.add(path + ": not an array");
            return out;
        }
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                violations.add(path + ": contains a non-string entry");
                continue;
            }
            out.add(item.asText());
        }
        return out;
    }
}

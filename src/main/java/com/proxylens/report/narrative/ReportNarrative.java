package com.proxylens.report.narrative;

import java.util.List;

/**
 * Narrative fields of a validated reasoning draft.
 * Incident narratives are positional: the n-th entry describes the n-th synthesized incident.
 */
public final class ReportNarrative {

    private final String summary;
    private final List<IncidentNarrative> incidents;
    private final List<String> gaps;

    public ReportNarrative(String summary, List<IncidentNarrative> incidents, List<String> gaps) {
        this.summary = summary;
        this.incidents = List.copyOf(incidents);
        this.gaps = List.copyOf(gaps);
    }

    public String getSummary() {
        return summary;
    }

    public List<IncidentNarrative> getIncidents() {
        return incidents;
    }

    public List<String> getGaps() {
        return gaps;
    }

    public static final class IncidentNarrative {

        private final String title;
        private final List<String> why;
        private final List<String> recommendedActions;
        private final List<String> securityOutcomes;

        public IncidentNarrative(String title, List<String> why, List<String> recommendedActions,
                                 List<String> securityOutcomes) {
            this.title = title;
            this.why = List.copyOf(why);
            this.recommendedActions = List.copyOf(recommendedActions);
            this.securityOutcomes = List.copyOf(securityOutcomes);
        }

        public String getTitle() {
            return title;
        }

        public List<String> getWhy() {
            return why;
        }

        public List<String> getRecommendedActions() {
            return recommendedActions;
        }

        /**
         * Empty when the draft did not propose outcomes
         */
        public List<String> getSecurityOutcomes() {
            return securityOutcomes;
        }
    }
}

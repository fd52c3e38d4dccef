package com.proxylens.detection;

import com.proxylens.domain.Finding;

import java.util.Comparator;

/**
 * Presentation order of findings: severity rank descending, then confidence descending.
 * Used with a stable sort, so equal findings keep their creation order.
 */
public final class FindingOrder {

    public static final Comparator<Finding> PRESENTATION =
        Comparator.comparingInt((Finding f) -> f.getSeverity().getRank()).reversed()
            .thenComparing(Comparator.comparingDouble(Finding::getConfidence).reversed());

    private FindingOrder() {
    }
}

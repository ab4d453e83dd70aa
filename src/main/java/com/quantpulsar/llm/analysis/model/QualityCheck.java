package com.quantpulsar.llm.analysis.model;

import java.time.Instant;

/**
 * A single quality finding.
 *
 * @param type      check kind
 * @param name      display name, or the tag name for embedded checks
 * @param score     score in [0,1], {@code null} when not scored
 * @param severity  pass, warning or fail
 * @param details   free-text explanation, may be {@code null}
 * @param timestamp evaluation time, {@code null} for checks read back from span tags
 * @author Quantpulsar 2025-2026
 */
public record QualityCheck(
        QualityCheckType type,
        String name,
        Double score,
        QualitySeverity severity,
        String details,
        Instant timestamp) {

    public boolean isIssue() {
        return severity != null && severity.isIssue();
    }
}

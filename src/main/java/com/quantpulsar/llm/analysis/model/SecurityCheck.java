package com.quantpulsar.llm.analysis.model;

import java.time.Instant;

/**
 * A single security finding. A check that ran but found nothing has
 * {@code detected == false} and severity {@link SecuritySeverity#LOW}.
 *
 * @param type      check kind
 * @param name      display name, or the tag name for embedded checks
 * @param detected  whether the risk was detected
 * @param severity  highest severity among matched indicators
 * @param details   matched indicator names, may be {@code null}
 * @param location  input, output or both, may be {@code null}
 * @param timestamp evaluation time, {@code null} for checks read back from span tags
 * @author Quantpulsar 2025-2026
 */
public record SecurityCheck(
        SecurityCheckType type,
        String name,
        boolean detected,
        SecuritySeverity severity,
        String details,
        CheckLocation location,
        Instant timestamp) {
}

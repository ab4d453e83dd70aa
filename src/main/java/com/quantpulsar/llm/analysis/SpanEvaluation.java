package com.quantpulsar.llm.analysis;

import com.quantpulsar.llm.analysis.model.LlmSpanInfo;
import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.SecurityCheck;
import com.quantpulsar.llm.analysis.quality.QualityCheckSummary;
import com.quantpulsar.llm.analysis.security.SecurityCheckSummary;

import java.util.List;

/**
 * Quality and security findings computed for one span's message content.
 * Embedded findings recorded by the instrumentation stay on {@link #spanInfo()}.
 *
 * @param spanKey         evaluated span
 * @param spanInfo        extracted span facts
 * @param qualityChecks   computed quality checks, empty when the span has no output text
 * @param securityChecks  computed security checks, empty when the span has no message content
 * @param qualitySummary  roll-up of {@code qualityChecks}
 * @param securitySummary roll-up of {@code securityChecks}
 */
public record SpanEvaluation(
        String spanKey,
        LlmSpanInfo spanInfo,
        List<QualityCheck> qualityChecks,
        List<SecurityCheck> securityChecks,
        QualityCheckSummary qualitySummary,
        SecurityCheckSummary securitySummary) {

    public SpanEvaluation {
        qualityChecks = List.copyOf(qualityChecks);
        securityChecks = List.copyOf(securityChecks);
    }

    public boolean hasSecurityIssue() {
        return SecurityCheckSummary.hasSecurityIssue(securityChecks);
    }
}

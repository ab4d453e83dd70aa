package com.quantpulsar.llm.analysis.trace;

import com.quantpulsar.llm.analysis.extraction.GenAiAttributes;
import com.quantpulsar.llm.analysis.extraction.LlmSpanInfoExtractor;
import com.quantpulsar.llm.analysis.model.LlmSpanInfo;
import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.SecurityCheck;
import com.quantpulsar.llm.analysis.model.Span;
import com.quantpulsar.llm.analysis.model.TraceLlmSummary;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Folds the LLM facts of every span of a trace into one {@link TraceLlmSummary}.
 * The fold is commutative: span order does not affect the result.
 *
 * @author Quantpulsar 2025-2026
 */
public class TraceLlmAggregator {

    private final LlmSpanInfoExtractor extractor;

    public TraceLlmAggregator() {
        this(new LlmSpanInfoExtractor());
    }

    public TraceLlmAggregator(LlmSpanInfoExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public TraceLlmSummary calculateTraceLlmSummary(@NotNull Collection<Span> spans) {
        List<LlmSpanInfo> infos = new ArrayList<>(spans.size());
        for (Span span : spans) {
            infos.add(extractor.extractLlmSpanInfo(span));
        }
        return summarize(infos);
    }

    /** Same fold over already extracted span infos. */
    public TraceLlmSummary summarize(Collection<LlmSpanInfo> infos) {
        int llmSpans = 0;
        long input = 0;
        long output = 0;
        SortedSet<String> models = new TreeSet<>();
        SortedSet<String> providers = new TreeSet<>();
        int toolCalls = 0;
        int handoffs = 0;
        int qualityIssues = 0;
        int securityIssues = 0;

        for (LlmSpanInfo info : infos) {
            if (!info.isLlmSpan()) {
                continue;
            }
            llmSpans++;
            input += info.getInputTokens() != null ? info.getInputTokens() : 0;
            output += info.getOutputTokens() != null ? info.getOutputTokens() : 0;
            addIfPresent(models, info.getRequestModel());
            addIfPresent(models, info.getResponseModel());
            addIfPresent(providers, info.getProvider());
            if (info.getToolName() != null || GenAiAttributes.OPERATION_TOOL.equals(info.getOperationType())) {
                toolCalls++;
            }
            if (info.getAgentName() != null
                    || GenAiAttributes.OPERATION_AGENT_HANDOFF.equals(info.getOperationType())) {
                handoffs++;
            }
            qualityIssues += (int) info.getQualityChecks().stream().filter(QualityCheck::isIssue).count();
            securityIssues += (int) info.getSecurityChecks().stream().filter(SecurityCheck::detected).count();
        }

        return new TraceLlmSummary(llmSpans > 0, llmSpans, input, output, input + output,
                new ArrayList<>(models), new ArrayList<>(providers),
                toolCalls, handoffs, qualityIssues, securityIssues, null, null);
    }

    private static void addIfPresent(SortedSet<String> values, String value) {
        if (value != null && !value.isEmpty()) {
            values.add(value);
        }
    }
}

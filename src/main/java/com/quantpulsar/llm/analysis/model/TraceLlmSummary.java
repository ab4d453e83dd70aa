package com.quantpulsar.llm.analysis.model;

import java.util.List;

/**
 * LLM facts aggregated over all spans of one trace.
 *
 * @param hasLlmSpans        whether any span carried an LLM indicator
 * @param llmSpanCount       number of LLM spans
 * @param totalInputTokens   summed input tokens
 * @param totalOutputTokens  summed output tokens
 * @param totalTokens        input plus output tokens
 * @param uniqueModels       distinct request/response models, sorted
 * @param uniqueProviders    distinct providers, sorted
 * @param toolCallCount      spans that represent a tool call
 * @param agentHandoffCount  spans that represent an agent handoff
 * @param qualityIssues      embedded quality findings with severity warning or fail
 * @param securityIssues     embedded security findings that were detected
 * @param totalEstimatedCost estimated cost, {@code null} until priced
 * @param costCurrency       currency of the estimated cost, {@code null} until priced
 * @author Quantpulsar 2025-2026
 */
public record TraceLlmSummary(
        boolean hasLlmSpans,
        int llmSpanCount,
        long totalInputTokens,
        long totalOutputTokens,
        long totalTokens,
        List<String> uniqueModels,
        List<String> uniqueProviders,
        int toolCallCount,
        int agentHandoffCount,
        int qualityIssues,
        int securityIssues,
        Double totalEstimatedCost,
        String costCurrency) {

    public TraceLlmSummary {
        uniqueModels = uniqueModels != null ? List.copyOf(uniqueModels) : List.of();
        uniqueProviders = uniqueProviders != null ? List.copyOf(uniqueProviders) : List.of();
    }

    /** Returns a copy carrying the given cost estimate. */
    public TraceLlmSummary withCost(double cost, String currency) {
        return new TraceLlmSummary(hasLlmSpans, llmSpanCount, totalInputTokens, totalOutputTokens, totalTokens,
                uniqueModels, uniqueProviders, toolCallCount, agentHandoffCount, qualityIssues, securityIssues,
                cost, currency);
    }
}

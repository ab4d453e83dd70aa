package com.quantpulsar.llm.analysis;

import com.quantpulsar.llm.analysis.cost.TraceCost;
import com.quantpulsar.llm.analysis.model.AgentWorkflow;
import com.quantpulsar.llm.analysis.model.TraceLlmSummary;

/**
 * Everything derived from one trace.
 *
 * @param summary  LLM summary, carrying the total cost
 * @param workflow agent workflow graph
 * @param cost     cost with per-model breakdown
 */
public record TraceAnalysis(TraceLlmSummary summary, AgentWorkflow workflow, TraceCost cost) {
}

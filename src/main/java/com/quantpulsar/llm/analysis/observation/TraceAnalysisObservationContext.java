package com.quantpulsar.llm.analysis.observation;

import io.micrometer.observation.Observation;

/**
 * Observation context for one trace analysis.
 * Carries the input size up front and the LLM facts once the analysis completes.
 *
 * @author Quantpulsar 2025-2026
 */
public class TraceAnalysisObservationContext extends Observation.Context {

    public static final String OBSERVATION_NAME = "llm.trace.analysis";

    public static final String HAS_LLM_SPANS = "llm.analysis.has_llm_spans";
    public static final String SPAN_COUNT = "llm.analysis.span_count";
    public static final String LLM_SPAN_COUNT = "llm.analysis.llm_span_count";

    private final int spanCount;
    private int llmSpanCount;
    private boolean completed;

    public TraceAnalysisObservationContext(int spanCount) {
        this.spanCount = spanCount;
        setName(OBSERVATION_NAME);
    }

    public int getSpanCount() {
        return spanCount;
    }

    public int getLlmSpanCount() {
        return llmSpanCount;
    }

    public boolean hasLlmSpans() {
        return llmSpanCount > 0;
    }

    /** Whether the analysis finished without error. */
    public boolean isCompleted() {
        return completed;
    }

    /** Records the result of a completed analysis. */
    public void complete(int llmSpanCount) {
        this.llmSpanCount = llmSpanCount;
        this.completed = true;
    }
}

package com.quantpulsar.llm.analysis;

import com.quantpulsar.llm.analysis.cost.CostCalculator;
import com.quantpulsar.llm.analysis.cost.TraceCost;
import com.quantpulsar.llm.analysis.extraction.LlmSpanInfoExtractor;
import com.quantpulsar.llm.analysis.model.AgentWorkflow;
import com.quantpulsar.llm.analysis.model.LlmMessage;
import com.quantpulsar.llm.analysis.model.LlmSpanInfo;
import com.quantpulsar.llm.analysis.model.QualityCheck;
import com.quantpulsar.llm.analysis.model.SecurityCheck;
import com.quantpulsar.llm.analysis.model.Span;
import com.quantpulsar.llm.analysis.model.TraceLlmSummary;
import com.quantpulsar.llm.analysis.observation.TraceAnalysisObservationContext;
import com.quantpulsar.llm.analysis.quality.QualityCheckContext;
import com.quantpulsar.llm.analysis.quality.QualityCheckEngine;
import com.quantpulsar.llm.analysis.quality.QualityCheckSummary;
import com.quantpulsar.llm.analysis.security.SecurityCheckContext;
import com.quantpulsar.llm.analysis.security.SecurityCheckEngine;
import com.quantpulsar.llm.analysis.security.SecurityCheckSummary;
import com.quantpulsar.llm.analysis.trace.AgentWorkflowBuilder;
import com.quantpulsar.llm.analysis.trace.TraceLlmAggregator;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point tying the analysis components together for a whole trace or a single span.
 * <p>
 * {@link #analyzeTrace(List)} runs inside a {@code llm.trace.analysis} observation;
 * with the default {@link ObservationRegistry#NOOP} registry that costs nothing.
 *
 * @author Quantpulsar 2025-2026
 */
public class LlmTraceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LlmTraceAnalyzer.class);

    private final LlmSpanInfoExtractor extractor;
    private final TraceLlmAggregator aggregator;
    private final AgentWorkflowBuilder workflowBuilder;
    private final QualityCheckEngine qualityEngine;
    private final SecurityCheckEngine securityEngine;
    private final CostCalculator costCalculator;
    private final ObservationRegistry observationRegistry;

    /** Analyzer with default components and no observation. */
    public LlmTraceAnalyzer() {
        this(new LlmSpanInfoExtractor(), new QualityCheckEngine(), new SecurityCheckEngine(),
                new CostCalculator(), new AgentWorkflowBuilder(), ObservationRegistry.NOOP);
    }

    public LlmTraceAnalyzer(LlmSpanInfoExtractor extractor,
                            QualityCheckEngine qualityEngine,
                            SecurityCheckEngine securityEngine,
                            CostCalculator costCalculator,
                            AgentWorkflowBuilder workflowBuilder,
                            ObservationRegistry observationRegistry) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.aggregator = new TraceLlmAggregator(extractor);
        this.qualityEngine = Objects.requireNonNull(qualityEngine, "qualityEngine");
        this.securityEngine = Objects.requireNonNull(securityEngine, "securityEngine");
        this.costCalculator = Objects.requireNonNull(costCalculator, "costCalculator");
        this.workflowBuilder = Objects.requireNonNull(workflowBuilder, "workflowBuilder");
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    /**
     * Summarizes, prices and graphs one trace.
     *
     * @param spans all spans of the trace, in any order
     * @return the trace analysis; the summary carries the total cost
     */
    public TraceAnalysis analyzeTrace(@NotNull List<Span> spans) {
        TraceAnalysisObservationContext context = new TraceAnalysisObservationContext(spans.size());
        Observation observation = Observation.createNotStarted(
                TraceAnalysisObservationContext.OBSERVATION_NAME, () -> context, observationRegistry);
        observation.highCardinalityKeyValue(TraceAnalysisObservationContext.SPAN_COUNT, String.valueOf(spans.size()));
        observation.start();
        try (Observation.Scope scope = observation.openScope()) {
            List<LlmSpanInfo> infos = new ArrayList<>(spans.size());
            for (Span span : spans) {
                infos.add(extractor.extractLlmSpanInfo(span));
            }
            TraceCost cost = costCalculator.calculateTraceCost(infos);
            TraceLlmSummary summary = aggregator.summarize(infos).withCost(cost.totalCost(), cost.currency());
            AgentWorkflow workflow = workflowBuilder.buildAgentWorkflow(spans);

            context.complete(summary.llmSpanCount());
            observation.lowCardinalityKeyValue(TraceAnalysisObservationContext.HAS_LLM_SPANS,
                    String.valueOf(summary.hasLlmSpans()));
            observation.highCardinalityKeyValue(TraceAnalysisObservationContext.LLM_SPAN_COUNT,
                    String.valueOf(summary.llmSpanCount()));
            log.debug("Analyzed trace: {} spans, {} LLM spans, {} tokens, {} workflow nodes",
                    spans.size(), summary.llmSpanCount(), summary.totalTokens(), workflow.nodes().size());
            return new TraceAnalysis(summary, workflow, cost);
        } catch (RuntimeException e) {
            observation.error(e);
            throw e;
        } finally {
            observation.stop();
        }
    }

    /**
     * Runs the quality and security engines over a span's message content: the last
     * user message is the input, assistant messages the output, system and tool
     * messages the provided context.
     */
    public SpanEvaluation evaluateSpan(@NotNull Span span) {
        LlmSpanInfo info = extractor.extractLlmSpanInfo(span);
        if (!info.isLlmSpan()) {
            return evaluation(span, info, List.of(), List.of());
        }

        List<LlmMessage> input = info.getInputMessages() != null ? info.getInputMessages() : List.of();
        List<LlmMessage> output = info.getOutputMessages() != null ? info.getOutputMessages() : List.of();

        String userInput = null;
        List<String> providedContext = new ArrayList<>();
        for (LlmMessage message : input) {
            if (message.content() == null) {
                continue;
            }
            if (message.hasRole(LlmMessage.ROLE_USER)) {
                userInput = message.content();
            } else if (message.hasRole(LlmMessage.ROLE_SYSTEM) || message.hasRole(LlmMessage.ROLE_TOOL)) {
                providedContext.add(message.content());
            }
        }
        List<String> answers = new ArrayList<>();
        for (LlmMessage message : output) {
            if (message.hasRole(LlmMessage.ROLE_ASSISTANT) && message.content() != null) {
                answers.add(message.content());
            }
        }
        String llmOutput = String.join("\n", answers);

        List<QualityCheck> quality = List.of();
        if (!llmOutput.isBlank()) {
            quality = qualityEngine.runQualityChecks(QualityCheckContext.builder()
                    .userInput(userInput)
                    .llmOutput(llmOutput)
                    .providedContext(providedContext)
                    .systemInstructions(info.getSystemInstructions())
                    .messages(input)
                    .build());
        }

        List<SecurityCheck> security = List.of();
        if (userInput != null || !answers.isEmpty()) {
            List<LlmMessage> conversation = new ArrayList<>(input);
            conversation.addAll(output);
            security = securityEngine.runSecurityChecks(SecurityCheckContext.builder()
                    .messages(conversation)
                    .systemPrompt(info.getSystemInstructions())
                    .build());
        }
        return evaluation(span, info, quality, security);
    }

    private static SpanEvaluation evaluation(Span span, LlmSpanInfo info,
                                             List<QualityCheck> quality, List<SecurityCheck> security) {
        return new SpanEvaluation(span.spanKey(), info, quality, security,
                QualityCheckSummary.of(quality), SecurityCheckSummary.of(security));
    }
}

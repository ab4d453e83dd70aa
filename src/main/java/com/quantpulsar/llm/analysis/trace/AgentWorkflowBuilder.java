package com.quantpulsar.llm.analysis.trace;

import com.quantpulsar.llm.analysis.extraction.GenAiAttributes;
import com.quantpulsar.llm.analysis.extraction.LlmSpanInfoExtractor;
import com.quantpulsar.llm.analysis.model.AgentNodeType;
import com.quantpulsar.llm.analysis.model.AgentWorkflow;
import com.quantpulsar.llm.analysis.model.AgentWorkflowEdge;
import com.quantpulsar.llm.analysis.model.AgentWorkflowNode;
import com.quantpulsar.llm.analysis.model.LlmSpanInfo;
import com.quantpulsar.llm.analysis.model.Span;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reconstructs the agent workflow graph of a trace.
 * <p>
 * Nodes are the LLM spans and the spans carrying a tool name. Edges are added in two
 * passes: a structural edge for every node whose parent is also a node, then a
 * sequence edge between start-time neighbours that are not already connected when the
 * {@link SequenceEdgeStrategy} accepts the pair. Edge ids derive from their endpoints,
 * so repeated builds over the same spans give the same graph.
 *
 * @author Quantpulsar 2025-2026
 */
public class AgentWorkflowBuilder {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkflowBuilder.class);

    private final LlmSpanInfoExtractor extractor;
    private final SequenceEdgeStrategy sequenceStrategy;

    public AgentWorkflowBuilder() {
        this(new LlmSpanInfoExtractor(), new TemporalAdjacencyStrategy());
    }

    public AgentWorkflowBuilder(LlmSpanInfoExtractor extractor, SequenceEdgeStrategy sequenceStrategy) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sequenceStrategy = Objects.requireNonNull(sequenceStrategy, "sequenceStrategy");
    }

    public AgentWorkflow buildAgentWorkflow(@NotNull List<Span> spans) {
        Map<String, Span> selected = new LinkedHashMap<>();
        List<AgentWorkflowNode> nodes = new ArrayList<>();
        for (Span span : spans) {
            if (span.spanKey() == null || selected.containsKey(span.spanKey())) {
                continue;
            }
            LlmSpanInfo info = extractor.extractLlmSpanInfo(span);
            String toolTag = span.tags().get(GenAiAttributes.TOOL_NAME);
            if (!info.isLlmSpan() && toolTag == null) {
                continue;
            }
            selected.put(span.spanKey(), span);
            nodes.add(toNode(span, info));
        }

        List<AgentWorkflowEdge> edges = new ArrayList<>();
        for (Span span : selected.values()) {
            if (span.hasParent() && selected.containsKey(span.parentSpanKey())) {
                edges.add(AgentWorkflowEdge.structural(span.parentSpanKey(), span.spanKey()));
            }
        }

        List<Span> ordered = new ArrayList<>(selected.values());
        ordered.sort(Comparator.comparingLong(Span::startTime));
        for (int i = 0; i + 1 < ordered.size(); i++) {
            Span current = ordered.get(i);
            Span next = ordered.get(i + 1);
            boolean connected = edges.stream().anyMatch(e -> e.connects(current.spanKey(), next.spanKey()));
            if (!connected && sequenceStrategy.isSequential(current, next)) {
                edges.add(AgentWorkflowEdge.sequence(current.spanKey(), next.spanKey()));
            }
        }

        log.debug("Built agent workflow with {} nodes and {} edges from {} spans",
                nodes.size(), edges.size(), spans.size());
        return new AgentWorkflow(nodes, edges);
    }

    private static AgentWorkflowNode toNode(Span span, LlmSpanInfo info) {
        // Non-LLM spans are classified by operation name; their identity is read from the tags for display
        String toolName = info.isLlmSpan() ? info.getToolName() : span.tags().get(GenAiAttributes.TOOL_NAME);
        String agentName = info.isLlmSpan() ? info.getAgentName() : span.tags().get(GenAiAttributes.AGENT_NAME);
        String label = toolName != null ? toolName : agentName != null ? agentName : span.operationName();
        return new AgentWorkflowNode(
                span.spanKey(),
                classify(span.operationName(), info.isLlmSpan(), info.getToolName(), info.getAgentName()),
                label,
                span.spanKey(),
                span.duration(),
                span.isError(),
                info.getRequestModel(),
                toolName,
                agentName,
                info.getTotalTokens());
    }

    static AgentNodeType classify(String operationName, boolean llmSpan, String toolName, String agentName) {
        String op = operationName.toLowerCase(Locale.ROOT);
        if (toolName != null || op.contains("tool")) {
            return AgentNodeType.TOOL_INVOCATION;
        }
        if (agentName != null || op.contains("agent")) {
            return AgentNodeType.AGENT_HANDOFF;
        }
        if (llmSpan) {
            return AgentNodeType.LLM_CALL;
        }
        if (op.contains("memory") && op.contains("read")) {
            return AgentNodeType.MEMORY_READ;
        }
        if (op.contains("memory") && op.contains("write")) {
            return AgentNodeType.MEMORY_WRITE;
        }
        if (op.contains("decision") || op.contains("route")) {
            return AgentNodeType.DECISION;
        }
        if (op.contains("input") || op.contains("user")) {
            return AgentNodeType.INPUT;
        }
        if (op.contains("output") || op.contains("response")) {
            return AgentNodeType.OUTPUT;
        }
        return AgentNodeType.LLM_CALL;
    }
}

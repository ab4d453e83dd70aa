package com.quantpulsar.llm.analysis.model;

import java.util.List;

/**
 * Reconstructed agent execution graph of one trace.
 *
 * @param nodes workflow nodes in span order
 * @param edges structural edges first, then inferred sequence edges
 */
public record AgentWorkflow(List<AgentWorkflowNode> nodes, List<AgentWorkflowEdge> edges) {

    public AgentWorkflow {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public static AgentWorkflow empty() {
        return new AgentWorkflow(List.of(), List.of());
    }
}

package com.quantpulsar.llm.analysis.model;

/**
 * A workflow node, one per selected span.
 *
 * @param id         node id, equal to the span key
 * @param type       node role
 * @param label      tool name, agent name or operation name
 * @param spanKey    source span key
 * @param durationMs span duration
 * @param isError    whether the span recorded an error
 * @param model      request model, may be {@code null}
 * @param toolName   tool name, may be {@code null}
 * @param agentName  agent name, may be {@code null}
 * @param tokens     total tokens, may be {@code null}
 */
public record AgentWorkflowNode(
        String id,
        AgentNodeType type,
        String label,
        String spanKey,
        long durationMs,
        boolean isError,
        String model,
        String toolName,
        String agentName,
        Long tokens) {
}

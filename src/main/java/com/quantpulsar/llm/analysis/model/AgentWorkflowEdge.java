package com.quantpulsar.llm.analysis.model;

/**
 * Directed workflow edge. Structural edges have no label; inferred edges carry one.
 *
 * @param id     deterministic id derived from source and target
 * @param source source node id
 * @param target target node id
 * @param label  edge label, {@code null} for parent/child edges
 */
public record AgentWorkflowEdge(String id, String source, String target, String label) {

    public static final String SEQUENCE_LABEL = "sequence";

    /** Parent to child edge mirroring span nesting. */
    public static AgentWorkflowEdge structural(String parent, String child) {
        return new AgentWorkflowEdge(parent + "->" + child, parent, child, null);
    }

    /** Edge inferred from temporal adjacency of sibling spans. */
    public static AgentWorkflowEdge sequence(String current, String next) {
        return new AgentWorkflowEdge("seq-" + current + "->" + next, current, next, SEQUENCE_LABEL);
    }

    /** True when this edge joins the two nodes in either direction. */
    public boolean connects(String a, String b) {
        return (source.equals(a) && target.equals(b)) || (source.equals(b) && target.equals(a));
    }
}

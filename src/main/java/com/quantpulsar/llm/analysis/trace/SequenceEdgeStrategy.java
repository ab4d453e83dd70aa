package com.quantpulsar.llm.analysis.trace;

import com.quantpulsar.llm.analysis.model.Span;

/**
 * Decides whether two workflow spans adjacent in start-time order, with no
 * structural edge between them, should be joined by a sequence edge.
 */
@FunctionalInterface
public interface SequenceEdgeStrategy {

    /** Never infers sequence edges; the graph keeps structural edges only. */
    static SequenceEdgeStrategy none() {
        return (current, next) -> false;
    }

    boolean isSequential(Span current, Span next);
}

package com.quantpulsar.llm.analysis.trace;

import com.quantpulsar.llm.analysis.model.Span;

import java.time.Duration;
import java.util.Objects;

/**
 * Joins two spans when the next one starts less than {@code maxGap} after the
 * current one ends. Overlapping spans have a negative gap and are joined.
 */
public class TemporalAdjacencyStrategy implements SequenceEdgeStrategy {

    public static final Duration DEFAULT_MAX_GAP = Duration.ofMillis(100);

    private final long maxGapMillis;

    public TemporalAdjacencyStrategy() {
        this(DEFAULT_MAX_GAP);
    }

    public TemporalAdjacencyStrategy(Duration maxGap) {
        this.maxGapMillis = Objects.requireNonNull(maxGap, "maxGap").toMillis();
    }

    public long getMaxGapMillis() {
        return maxGapMillis;
    }

    @Override
    public boolean isSequential(Span current, Span next) {
        return next.startTime() - current.endTime() < maxGapMillis;
    }
}

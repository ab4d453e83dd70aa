package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;

/** A single heuristic quality check. Implementations never throw on sparse context. */
public interface QualityDetector {

    QualityCheck evaluate(QualityCheckContext context);
}

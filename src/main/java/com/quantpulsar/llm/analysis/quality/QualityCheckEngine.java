package com.quantpulsar.llm.analysis.quality;

import com.quantpulsar.llm.analysis.model.QualityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the heuristic quality detectors over one exchange.
 * <p>
 * Results are in a fixed order: hallucination, relevance, toxicity, sentiment, coherence,
 * skipping the checks the configuration disables. The engine holds no per-call state and
 * can be shared across threads.
 *
 * @author Quantpulsar 2025-2026
 */
public class QualityCheckEngine {

    private static final Logger log = LoggerFactory.getLogger(QualityCheckEngine.class);

    private final QualityCheckConfig defaultConfig;
    private final Clock clock;

    public QualityCheckEngine() {
        this(QualityCheckConfig.defaults(), Clock.systemUTC());
    }

    public QualityCheckEngine(QualityCheckConfig defaultConfig, Clock clock) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public QualityCheckConfig getDefaultConfig() {
        return defaultConfig;
    }

    public List<QualityCheck> runQualityChecks(QualityCheckContext context) {
        return runQualityChecks(context, defaultConfig);
    }

    public List<QualityCheck> runQualityChecks(QualityCheckContext context, QualityCheckConfig config) {
        QualityThresholds thresholds = config.getThresholds();
        List<QualityCheck> checks = new ArrayList<>(5);
        if (config.isCheckHallucination()) {
            checks.add(new HallucinationDetector(thresholds, clock).evaluate(context));
        }
        if (config.isCheckRelevance()) {
            checks.add(new RelevanceScorer(thresholds, clock).evaluate(context));
        }
        if (config.isCheckToxicity()) {
            checks.add(new ToxicityDetector(thresholds, clock).evaluate(context));
        }
        if (config.isCheckSentiment()) {
            checks.add(new SentimentAnalyzer(clock).evaluate(context));
        }
        if (config.isCheckCoherence()) {
            checks.add(new CoherenceEvaluator(thresholds, clock).evaluate(context));
        }
        if (log.isDebugEnabled()) {
            log.debug("Ran {} quality checks, {} issue(s)", checks.size(),
                    checks.stream().filter(QualityCheck::isIssue).count());
        }
        return checks;
    }

    public QualityCheck detectHallucination(QualityCheckContext context) {
        return new HallucinationDetector(defaultConfig.getThresholds(), clock).evaluate(context);
    }

    public QualityCheck scoreRelevance(QualityCheckContext context) {
        return new RelevanceScorer(defaultConfig.getThresholds(), clock).evaluate(context);
    }

    public QualityCheck detectToxicity(QualityCheckContext context) {
        return new ToxicityDetector(defaultConfig.getThresholds(), clock).evaluate(context);
    }

    public QualityCheck analyzeSentiment(QualityCheckContext context) {
        return new SentimentAnalyzer(clock).evaluate(context);
    }

    public QualityCheck evaluateCoherence(QualityCheckContext context) {
        return new CoherenceEvaluator(defaultConfig.getThresholds(), clock).evaluate(context);
    }
}

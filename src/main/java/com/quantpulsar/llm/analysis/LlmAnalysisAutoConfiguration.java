package com.quantpulsar.llm.analysis;

import com.quantpulsar.llm.analysis.cost.CostCalculator;
import com.quantpulsar.llm.analysis.extraction.LlmSpanInfoExtractor;
import com.quantpulsar.llm.analysis.quality.QualityCheckEngine;
import com.quantpulsar.llm.analysis.security.SecurityCheckEngine;
import com.quantpulsar.llm.analysis.trace.AgentWorkflowBuilder;
import com.quantpulsar.llm.analysis.trace.SequenceEdgeStrategy;
import com.quantpulsar.llm.analysis.trace.TemporalAdjacencyStrategy;
import com.quantpulsar.llm.analysis.trace.TraceLlmAggregator;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration for LLM span analysis.
 * Every component backs off when the application defines its own bean of the same type.
 *
 * @author Quantpulsar 2025-2026
 * @see LlmAnalysisProperties
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.observation.ObservationAutoConfiguration")
@EnableConfigurationProperties(LlmAnalysisProperties.class)
@ConditionalOnProperty(prefix = "llm.analysis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LlmAnalysisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LlmAnalysisAutoConfiguration.class);

    /**
     * Default constructor.
     */
    public LlmAnalysisAutoConfiguration() {
    }

    @Bean
    @ConditionalOnMissingBean
    public LlmSpanInfoExtractor llmSpanInfoExtractor() {
        return new LlmSpanInfoExtractor();
    }

    @Bean
    @ConditionalOnMissingBean
    public QualityCheckEngine qualityCheckEngine(LlmAnalysisProperties properties) {
        return new QualityCheckEngine(properties.toQualityCheckConfig(), Clock.systemUTC());
    }

    /**
     * Fails startup when a custom pattern cannot be compiled.
     *
     * @param properties the analysis properties
     * @return the security engine
     */
    @Bean
    @ConditionalOnMissingBean
    public SecurityCheckEngine securityCheckEngine(LlmAnalysisProperties properties) {
        LlmAnalysisProperties.Security security = properties.getSecurity();
        int custom = security.getCustomPiiPatterns().size() + security.getCustomSensitivePatterns().size();
        if (custom > 0) {
            log.info("Registering {} custom security pattern(s)", custom);
        }
        return new SecurityCheckEngine(properties.toSecurityCheckConfig(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public CostCalculator costCalculator(LlmAnalysisProperties properties) {
        int overrides = properties.getPricing().getOverrides().size();
        if (overrides > 0) {
            log.info("Pricing catalog configured with {} override(s)", overrides);
        }
        return new CostCalculator(properties.toPricingCatalog(), properties.toFallbackPricing());
    }

    @Bean
    @ConditionalOnMissingBean
    public SequenceEdgeStrategy sequenceEdgeStrategy(LlmAnalysisProperties properties) {
        return new TemporalAdjacencyStrategy(properties.getWorkflow().getSequenceGap());
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentWorkflowBuilder agentWorkflowBuilder(LlmSpanInfoExtractor extractor,
                                                     SequenceEdgeStrategy sequenceEdgeStrategy) {
        return new AgentWorkflowBuilder(extractor, sequenceEdgeStrategy);
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceLlmAggregator traceLlmAggregator(LlmSpanInfoExtractor extractor) {
        return new TraceLlmAggregator(extractor);
    }

    /**
     * Creates the trace analyzer. Analyses are observed when an ObservationRegistry is present.
     *
     * @param extractor the span extractor
     * @param qualityCheckEngine the quality engine
     * @param securityCheckEngine the security engine
     * @param costCalculator the cost calculator
     * @param agentWorkflowBuilder the workflow builder
     * @param observationRegistryProvider the ObservationRegistry provider
     * @return the analyzer
     */
    @Bean
    @ConditionalOnMissingBean
    public LlmTraceAnalyzer llmTraceAnalyzer(LlmSpanInfoExtractor extractor,
                                             QualityCheckEngine qualityCheckEngine,
                                             SecurityCheckEngine securityCheckEngine,
                                             CostCalculator costCalculator,
                                             AgentWorkflowBuilder agentWorkflowBuilder,
                                             ObjectProvider<ObservationRegistry> observationRegistryProvider) {
        ObservationRegistry registry = observationRegistryProvider.getIfAvailable();
        if (registry != null) {
            log.info("Configuring LLM trace analysis with Observation API");
        } else {
            log.info("Configuring LLM trace analysis without observation (no ObservationRegistry)");
        }
        return new LlmTraceAnalyzer(extractor, qualityCheckEngine, securityCheckEngine, costCalculator,
                agentWorkflowBuilder, registry);
    }
}

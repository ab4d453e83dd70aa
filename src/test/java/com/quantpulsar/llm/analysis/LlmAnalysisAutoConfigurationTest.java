package com.quantpulsar.llm.analysis;

import com.quantpulsar.llm.analysis.cost.CostCalculator;
import com.quantpulsar.llm.analysis.model.Span;
import com.quantpulsar.llm.analysis.observation.TraceAnalysisObservationContext;
import com.quantpulsar.llm.analysis.quality.QualityCheckEngine;
import com.quantpulsar.llm.analysis.security.SecurityCheckEngine;
import com.quantpulsar.llm.analysis.trace.AgentWorkflowBuilder;
import com.quantpulsar.llm.analysis.trace.SequenceEdgeStrategy;
import com.quantpulsar.llm.analysis.trace.TemporalAdjacencyStrategy;
import com.quantpulsar.llm.analysis.trace.TraceLlmAggregator;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.tck.TestObservationRegistry;
import io.micrometer.observation.tck.TestObservationRegistryAssert;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for LlmAnalysisAutoConfiguration.
 */
class LlmAnalysisAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LlmAnalysisAutoConfiguration.class));

    // All components created by default
    @Test
    void components_shouldBeCreated_byDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(LlmAnalysisProperties.class);
            assertThat(context).hasSingleBean(QualityCheckEngine.class);
            assertThat(context).hasSingleBean(SecurityCheckEngine.class);
            assertThat(context).hasSingleBean(CostCalculator.class);
            assertThat(context).hasSingleBean(SequenceEdgeStrategy.class);
            assertThat(context).hasSingleBean(AgentWorkflowBuilder.class);
            assertThat(context).hasSingleBean(TraceLlmAggregator.class);
            assertThat(context).hasSingleBean(LlmTraceAnalyzer.class);
        });
    }

    // Nothing created when disabled
    @Test
    void components_shouldNotBeCreated_whenDisabled() {
        contextRunner
                .withPropertyValues("llm.analysis.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(LlmTraceAnalyzer.class);
                    assertThat(context).doesNotHaveBean(QualityCheckEngine.class);
                    assertThat(context).doesNotHaveBean(LlmAnalysisProperties.class);
                });
    }

    // User bean takes precedence
    @Test
    void costCalculator_shouldBackOff_whenUserDefined() {
        contextRunner
                .withUserConfiguration(CustomCostCalculatorConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(CostCalculator.class);
                    assertThat(context.getBean(CostCalculator.class))
                            .isSameAs(context.getBean(CustomCostCalculatorConfig.class).calculator);
                });
    }

    @Test
    void sequenceGap_shouldBeBound() {
        contextRunner
                .withPropertyValues("llm.analysis.workflow.sequence-gap=250ms")
                .run(context -> {
                    SequenceEdgeStrategy strategy = context.getBean(SequenceEdgeStrategy.class);
                    assertThat(strategy).isInstanceOf(TemporalAdjacencyStrategy.class);
                    assertThat(((TemporalAdjacencyStrategy) strategy).getMaxGapMillis()).isEqualTo(250);
                });
    }

    @Test
    void pricingOverride_shouldBeBound() {
        contextRunner
                .withPropertyValues(
                        "llm.analysis.pricing.overrides[0].provider=acme",
                        "llm.analysis.pricing.overrides[0].model=acme-large",
                        "llm.analysis.pricing.overrides[0].input-token-price=1",
                        "llm.analysis.pricing.overrides[0].output-token-price=2")
                .run(context -> {
                    CostCalculator calculator = context.getBean(CostCalculator.class);
                    assertThat(calculator.findModelPricing("acme-large", null))
                            .hasValueSatisfying(p -> assertThat(p.outputTokenPrice()).isEqualTo(2));
                });
    }

    @Test
    void customPiiPattern_shouldBeBound() {
        contextRunner
                .withPropertyValues(
                        "llm.analysis.security.custom-pii-patterns[0].name=employee_id",
                        "llm.analysis.security.custom-pii-patterns[0].regex=EMP-[0-9]{6}",
                        "llm.analysis.security.custom-pii-patterns[0].severity=HIGH")
                .run(context -> {
                    SecurityCheckEngine engine = context.getBean(SecurityCheckEngine.class);
                    assertThat(engine.getDefaultConfig().getCustomPiiPatterns()).hasSize(1);
                    assertThat(engine.redactPii("badge EMP-123456", engine.getDefaultConfig().getCustomPiiPatterns()))
                            .isEqualTo("badge [EMPLOYEE_ID_REDACTED]");
                });
    }

    // Invalid custom regex fails startup
    @Test
    void invalidCustomPattern_shouldFailStartup() {
        contextRunner
                .withPropertyValues(
                        "llm.analysis.security.custom-sensitive-patterns[0].name=broken",
                        "llm.analysis.security.custom-sensitive-patterns[0].regex=[unclosed")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(IllegalArgumentException.class);
                });
    }

    // Analyses observed when a registry is present
    @Test
    void analyzer_shouldUseObservationRegistry_whenAvailable() {
        contextRunner
                .withUserConfiguration(ObservationConfig.class)
                .run(context -> {
                    TestObservationRegistry registry = (TestObservationRegistry) context.getBean(ObservationRegistry.class);
                    context.getBean(LlmTraceAnalyzer.class).analyzeTrace(List.of(
                            Span.of("a", "chat", 0, 10, null, Map.of("gen_ai.request.model", "gpt-4o"), false)));

                    TestObservationRegistryAssert.assertThat(registry)
                            .hasObservationWithNameEqualTo(TraceAnalysisObservationContext.OBSERVATION_NAME);
                });
    }

    @Configuration
    static class CustomCostCalculatorConfig {

        final CostCalculator calculator = new CostCalculator();

        @Bean
        CostCalculator costCalculator() {
            return calculator;
        }
    }

    @Configuration
    static class ObservationConfig {

        @Bean
        ObservationRegistry observationRegistry() {
            return TestObservationRegistry.create();
        }
    }
}

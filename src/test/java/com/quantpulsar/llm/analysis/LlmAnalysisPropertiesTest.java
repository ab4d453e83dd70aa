package com.quantpulsar.llm.analysis;

import com.quantpulsar.llm.analysis.cost.PricingCatalog;
import com.quantpulsar.llm.analysis.model.ModelPricing;
import com.quantpulsar.llm.analysis.model.SecuritySeverity;
import com.quantpulsar.llm.analysis.quality.QualityCheckConfig;
import com.quantpulsar.llm.analysis.quality.QualityThresholds;
import com.quantpulsar.llm.analysis.security.SecurityCheckConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for LlmAnalysisProperties.
 */
class LlmAnalysisPropertiesTest {

    // Default values
    @Test
    void defaultValues_shouldBeCorrect() {
        LlmAnalysisProperties properties = new LlmAnalysisProperties();

        assertThat(properties.isEnabled()).isTrue();
        assertThat(properties.getQuality().isHallucination()).isTrue();
        assertThat(properties.getQuality().isCoherence()).isTrue();
        assertThat(properties.getSecurity().isPromptInjection()).isTrue();
        assertThat(properties.getSecurity().getCustomPiiPatterns()).isEmpty();
        assertThat(properties.getPricing().getOverrides()).isEmpty();
        assertThat(properties.getWorkflow().getSequenceGap()).isEqualTo(Duration.ofMillis(100));
        assertThat(properties.getCost().getFallbackInputPrice()).isEqualTo(5);
        assertThat(properties.getCost().getFallbackOutputPrice()).isEqualTo(15);
    }

    // Untouched properties convert to the engine defaults
    @Test
    void defaults_shouldConvertToDefaultConfigs() {
        LlmAnalysisProperties properties = new LlmAnalysisProperties();

        QualityCheckConfig quality = properties.toQualityCheckConfig();
        assertThat(quality.getThresholds()).isEqualTo(QualityThresholds.DEFAULTS);
        assertThat(quality.isCheckSentiment()).isTrue();
        assertThat(properties.toPricingCatalog().entries()).isEqualTo(PricingCatalog.DEFAULT_PRICING);
        assertThat(properties.toFallbackPricing().inputTokenPrice()).isEqualTo(5);
        assertThat(properties.toFallbackPricing().currency()).isEqualTo(ModelPricing.USD);
    }

    @Test
    void qualitySettings_shouldFlowIntoConfig() {
        LlmAnalysisProperties properties = new LlmAnalysisProperties();
        properties.getQuality().setSentiment(false);
        properties.getQuality().getThresholds().setCoherenceFail(0.2);

        QualityCheckConfig config = properties.toQualityCheckConfig();

        assertThat(config.isCheckSentiment()).isFalse();
        assertThat(config.getThresholds().coherenceFail()).isEqualTo(0.2);
        assertThat(config.getThresholds().coherenceWarning())
                .isEqualTo(QualityThresholds.DEFAULTS.coherenceWarning());
    }

    @Test
    void customPattern_shouldBecomeRule() {
        LlmAnalysisProperties properties = new LlmAnalysisProperties();
        LlmAnalysisProperties.CustomPattern pattern = new LlmAnalysisProperties.CustomPattern();
        pattern.setName("employee_id");
        pattern.setRegex("emp-\\d{6}");
        pattern.setSeverity(SecuritySeverity.HIGH);
        pattern.setCaseInsensitive(true);
        properties.getSecurity().setCustomPiiPatterns(List.of(pattern));
        properties.getSecurity().setJailbreak(false);

        SecurityCheckConfig config = properties.toSecurityCheckConfig();

        assertThat(config.isCheckJailbreak()).isFalse();
        assertThat(config.getCustomPiiPatterns()).hasSize(1);
        assertThat(config.getCustomPiiPatterns().get(0).grade()).isEqualTo(SecuritySeverity.HIGH);
        assertThat(config.getCustomPiiPatterns().get(0).matchesIn("badge EMP-123456")).isTrue();
    }

    @Test
    void invalidRegex_shouldBeRejected() {
        LlmAnalysisProperties properties = new LlmAnalysisProperties();
        LlmAnalysisProperties.CustomPattern pattern = new LlmAnalysisProperties.CustomPattern();
        pattern.setName("broken");
        pattern.setRegex("[unclosed");
        properties.getSecurity().setCustomSensitivePatterns(List.of(pattern));

        assertThatThrownBy(properties::toSecurityCheckConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void patternWithoutName_shouldBeRejected() {
        LlmAnalysisProperties properties = new LlmAnalysisProperties();
        LlmAnalysisProperties.CustomPattern pattern = new LlmAnalysisProperties.CustomPattern();
        pattern.setRegex("x+");
        properties.getSecurity().setCustomPiiPatterns(List.of(pattern));

        assertThatThrownBy(properties::toSecurityCheckConfig).isInstanceOf(IllegalArgumentException.class);
    }

    // Overrides are consulted before the built-in catalog
    @Test
    void priceOverride_shouldWinOverDefaults() {
        LlmAnalysisProperties properties = new LlmAnalysisProperties();
        LlmAnalysisProperties.PriceOverride override = new LlmAnalysisProperties.PriceOverride();
        override.setProvider("openai");
        override.setModel("gpt-4o");
        override.setInputTokenPrice(2.5);
        override.setOutputTokenPrice(10);
        properties.getPricing().setOverrides(List.of(override));

        PricingCatalog catalog = properties.toPricingCatalog();

        assertThat(catalog.find("gpt-4o")).contains(ModelPricing.usd("openai", "gpt-4o", 2.5, 10));
        assertThat(catalog.getOverrides()).hasSize(1);
    }
}

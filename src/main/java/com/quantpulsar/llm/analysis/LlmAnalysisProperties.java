package com.quantpulsar.llm.analysis;

import com.quantpulsar.llm.analysis.cost.PricingCatalog;
import com.quantpulsar.llm.analysis.model.ModelPricing;
import com.quantpulsar.llm.analysis.model.SecuritySeverity;
import com.quantpulsar.llm.analysis.pattern.PatternRule;
import com.quantpulsar.llm.analysis.quality.QualityCheckConfig;
import com.quantpulsar.llm.analysis.quality.QualityThresholds;
import com.quantpulsar.llm.analysis.security.SecurityCheckConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration properties for LLM span analysis.
 * Converted once at startup into the immutable configuration objects the engines take.
 *
 * @author Quantpulsar 2025-2026
 */
@ConfigurationProperties(prefix = "llm.analysis")
public class LlmAnalysisProperties {

    /**
     * Default constructor.
     */
    public LlmAnalysisProperties() {
    }

    /** Enable/disable the analysis components. */
    private boolean enabled = true;

    /** Quality check toggles and thresholds. */
    private final Quality quality = new Quality();

    /** Security check toggles and custom patterns. */
    private final Security security = new Security();

    /** Pricing overrides. */
    private final Pricing pricing = new Pricing();

    /** Workflow graph settings. */
    private final Workflow workflow = new Workflow();

    /** Trace cost settings. */
    private final Cost cost = new Cost();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Quality getQuality() {
        return quality;
    }

    public Security getSecurity() {
        return security;
    }

    public Pricing getPricing() {
        return pricing;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public Cost getCost() {
        return cost;
    }

    public QualityCheckConfig toQualityCheckConfig() {
        Thresholds t = quality.getThresholds();
        return QualityCheckConfig.builder()
                .checkHallucination(quality.isHallucination())
                .checkRelevance(quality.isRelevance())
                .checkToxicity(quality.isToxicity())
                .checkSentiment(quality.isSentiment())
                .checkCoherence(quality.isCoherence())
                .thresholds(new QualityThresholds(
                        t.getHallucinationWarning(), t.getHallucinationFail(),
                        t.getRelevanceWarning(), t.getRelevanceFail(),
                        t.getToxicityWarning(), t.getToxicityFail(),
                        t.getCoherenceWarning(), t.getCoherenceFail()))
                .build();
    }

    /**
     * @throws IllegalArgumentException if a custom pattern has no name or an invalid regex
     */
    public SecurityCheckConfig toSecurityCheckConfig() {
        return SecurityCheckConfig.builder()
                .checkPromptInjection(security.isPromptInjection())
                .checkJailbreak(security.isJailbreak())
                .checkPii(security.isPii())
                .checkSensitiveData(security.isSensitiveData())
                .customPiiPatterns(toRules(security.getCustomPiiPatterns()))
                .customSensitivePatterns(toRules(security.getCustomSensitivePatterns()))
                .build();
    }

    public PricingCatalog toPricingCatalog() {
        List<ModelPricing> overrides = new ArrayList<>();
        for (PriceOverride override : pricing.getOverrides()) {
            overrides.add(override.toModelPricing());
        }
        return PricingCatalog.withOverrides(overrides);
    }

    public ModelPricing toFallbackPricing() {
        return ModelPricing.usd("estimate", "average", cost.getFallbackInputPrice(), cost.getFallbackOutputPrice());
    }

    private static List<PatternRule<SecuritySeverity>> toRules(List<CustomPattern> patterns) {
        List<PatternRule<SecuritySeverity>> rules = new ArrayList<>(patterns.size());
        for (CustomPattern pattern : patterns) {
            rules.add(pattern.toRule());
        }
        return rules;
    }

    /** Quality check settings. */
    public static class Quality {

        /** Run hallucination detection. */
        private boolean hallucination = true;

        /** Run relevance scoring. */
        private boolean relevance = true;

        /** Run toxicity detection. */
        private boolean toxicity = true;

        /** Run sentiment analysis. */
        private boolean sentiment = true;

        /** Run coherence evaluation. */
        private boolean coherence = true;

        /** Severity thresholds. */
        private final Thresholds thresholds = new Thresholds();

        public boolean isHallucination() {
            return hallucination;
        }

        public void setHallucination(boolean hallucination) {
            this.hallucination = hallucination;
        }

        public boolean isRelevance() {
            return relevance;
        }

        public void setRelevance(boolean relevance) {
            this.relevance = relevance;
        }

        public boolean isToxicity() {
            return toxicity;
        }

        public void setToxicity(boolean toxicity) {
            this.toxicity = toxicity;
        }

        public boolean isSentiment() {
            return sentiment;
        }

        public void setSentiment(boolean sentiment) {
            this.sentiment = sentiment;
        }

        public boolean isCoherence() {
            return coherence;
        }

        public void setCoherence(boolean coherence) {
            this.coherence = coherence;
        }

        public Thresholds getThresholds() {
            return thresholds;
        }
    }

    /** Quality severity cutoffs. Risk scores fail at or above, quality scores at or below. */
    public static class Thresholds {

        private double hallucinationWarning = QualityThresholds.DEFAULTS.hallucinationWarning();
        private double hallucinationFail = QualityThresholds.DEFAULTS.hallucinationFail();
        private double relevanceWarning = QualityThresholds.DEFAULTS.relevanceWarning();
        private double relevanceFail = QualityThresholds.DEFAULTS.relevanceFail();
        private double toxicityWarning = QualityThresholds.DEFAULTS.toxicityWarning();
        private double toxicityFail = QualityThresholds.DEFAULTS.toxicityFail();
        private double coherenceWarning = QualityThresholds.DEFAULTS.coherenceWarning();
        private double coherenceFail = QualityThresholds.DEFAULTS.coherenceFail();

        public double getHallucinationWarning() {
            return hallucinationWarning;
        }

        public void setHallucinationWarning(double hallucinationWarning) {
            this.hallucinationWarning = hallucinationWarning;
        }

        public double getHallucinationFail() {
            return hallucinationFail;
        }

        public void setHallucinationFail(double hallucinationFail) {
            this.hallucinationFail = hallucinationFail;
        }

        public double getRelevanceWarning() {
            return relevanceWarning;
        }

        public void setRelevanceWarning(double relevanceWarning) {
            this.relevanceWarning = relevanceWarning;
        }

        public double getRelevanceFail() {
            return relevanceFail;
        }

        public void setRelevanceFail(double relevanceFail) {
            this.relevanceFail = relevanceFail;
        }

        public double getToxicityWarning() {
            return toxicityWarning;
        }

        public void setToxicityWarning(double toxicityWarning) {
            this.toxicityWarning = toxicityWarning;
        }

        public double getToxicityFail() {
            return toxicityFail;
        }

        public void setToxicityFail(double toxicityFail) {
            this.toxicityFail = toxicityFail;
        }

        public double getCoherenceWarning() {
            return coherenceWarning;
        }

        public void setCoherenceWarning(double coherenceWarning) {
            this.coherenceWarning = coherenceWarning;
        }

        public double getCoherenceFail() {
            return coherenceFail;
        }

        public void setCoherenceFail(double coherenceFail) {
            this.coherenceFail = coherenceFail;
        }
    }

    /** Security check settings. */
    public static class Security {

        /** Run prompt injection detection. */
        private boolean promptInjection = true;

        /** Run jailbreak detection. */
        private boolean jailbreak = true;

        /** Run PII detection. */
        private boolean pii = true;

        /** Run sensitive data detection. */
        private boolean sensitiveData = true;

        /** Extra PII patterns, appended to the built-in catalog. */
        private List<CustomPattern> customPiiPatterns = new ArrayList<>();

        /** Extra sensitive data patterns, appended to the built-in catalog. */
        private List<CustomPattern> customSensitivePatterns = new ArrayList<>();

        public boolean isPromptInjection() {
            return promptInjection;
        }

        public void setPromptInjection(boolean promptInjection) {
            this.promptInjection = promptInjection;
        }

        public boolean isJailbreak() {
            return jailbreak;
        }

        public void setJailbreak(boolean jailbreak) {
            this.jailbreak = jailbreak;
        }

        public boolean isPii() {
            return pii;
        }

        public void setPii(boolean pii) {
            this.pii = pii;
        }

        public boolean isSensitiveData() {
            return sensitiveData;
        }

        public void setSensitiveData(boolean sensitiveData) {
            this.sensitiveData = sensitiveData;
        }

        public List<CustomPattern> getCustomPiiPatterns() {
            return customPiiPatterns;
        }

        public void setCustomPiiPatterns(List<CustomPattern> customPiiPatterns) {
            this.customPiiPatterns = customPiiPatterns;
        }

        public List<CustomPattern> getCustomSensitivePatterns() {
            return customSensitivePatterns;
        }

        public void setCustomSensitivePatterns(List<CustomPattern> customSensitivePatterns) {
            this.customSensitivePatterns = customSensitivePatterns;
        }
    }

    /** A caller supplied detection pattern. */
    public static class CustomPattern {

        /** Rule name, used in details and redaction tokens. */
        private String name;

        /** Java regular expression. */
        private String regex;

        /** Severity reported on a match. */
        private SecuritySeverity severity = SecuritySeverity.MEDIUM;

        /** Human readable description. */
        private String description;

        /** Match case-insensitively. */
        private boolean caseInsensitive = false;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getRegex() {
            return regex;
        }

        public void setRegex(String regex) {
            this.regex = regex;
        }

        public SecuritySeverity getSeverity() {
            return severity;
        }

        public void setSeverity(SecuritySeverity severity) {
            this.severity = severity;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public boolean isCaseInsensitive() {
            return caseInsensitive;
        }

        public void setCaseInsensitive(boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
        }

        PatternRule<SecuritySeverity> toRule() {
            if (name == null || name.isBlank() || regex == null || regex.isEmpty()) {
                throw new IllegalArgumentException("Custom pattern requires a name and a regex: name=" + name);
            }
            try {
                Pattern compiled = Pattern.compile(regex, caseInsensitive ? Pattern.CASE_INSENSITIVE : 0);
                return new PatternRule<>(name, compiled,
                        severity != null ? severity : SecuritySeverity.MEDIUM, description);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regex for custom pattern '" + name + "'", e);
            }
        }
    }

    /** Pricing settings. */
    public static class Pricing {

        /** Entries consulted before the built-in catalog. */
        private List<PriceOverride> overrides = new ArrayList<>();

        public List<PriceOverride> getOverrides() {
            return overrides;
        }

        public void setOverrides(List<PriceOverride> overrides) {
            this.overrides = overrides;
        }
    }

    /** One pricing override. Prices are per million tokens. */
    public static class PriceOverride {

        private String provider;
        private String model;
        private double inputTokenPrice;
        private double outputTokenPrice;
        private String currency = ModelPricing.USD;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getInputTokenPrice() {
            return inputTokenPrice;
        }

        public void setInputTokenPrice(double inputTokenPrice) {
            this.inputTokenPrice = inputTokenPrice;
        }

        public double getOutputTokenPrice() {
            return outputTokenPrice;
        }

        public void setOutputTokenPrice(double outputTokenPrice) {
            this.outputTokenPrice = outputTokenPrice;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        ModelPricing toModelPricing() {
            return new ModelPricing(provider, model, inputTokenPrice, outputTokenPrice,
                    currency != null ? currency : ModelPricing.USD);
        }
    }

    /** Workflow graph settings. */
    public static class Workflow {

        /** Largest gap between two spans still joined by a sequence edge. */
        private Duration sequenceGap = Duration.ofMillis(100);

        public Duration getSequenceGap() {
            return sequenceGap;
        }

        public void setSequenceGap(Duration sequenceGap) {
            this.sequenceGap = sequenceGap;
        }
    }

    /** Trace cost settings. */
    public static class Cost {

        /** Fallback price per million input tokens when no model can be priced. */
        private double fallbackInputPrice = 5;

        /** Fallback price per million output tokens when no model can be priced. */
        private double fallbackOutputPrice = 15;

        public double getFallbackInputPrice() {
            return fallbackInputPrice;
        }

        public void setFallbackInputPrice(double fallbackInputPrice) {
            this.fallbackInputPrice = fallbackInputPrice;
        }

        public double getFallbackOutputPrice() {
            return fallbackOutputPrice;
        }

        public void setFallbackOutputPrice(double fallbackOutputPrice) {
            this.fallbackOutputPrice = fallbackOutputPrice;
        }
    }
}

package com.quantpulsar.llm.analysis.security;

import com.quantpulsar.llm.analysis.model.SecuritySeverity;
import com.quantpulsar.llm.analysis.pattern.PatternRule;

import java.util.List;

/**
 * Which security checks run, plus caller supplied patterns appended to the
 * built-in PII and sensitive data catalogs. Every check is enabled by default.
 *
 * @author Quantpulsar 2025-2026
 */
public final class SecurityCheckConfig {

    private static final SecurityCheckConfig DEFAULTS = builder().build();

    private final boolean checkPromptInjection;
    private final boolean checkJailbreak;
    private final boolean checkPii;
    private final boolean checkSensitiveData;
    private final List<PatternRule<SecuritySeverity>> customPiiPatterns;
    private final List<PatternRule<SecuritySeverity>> customSensitivePatterns;

    private SecurityCheckConfig(Builder builder) {
        this.checkPromptInjection = builder.checkPromptInjection;
        this.checkJailbreak = builder.checkJailbreak;
        this.checkPii = builder.checkPii;
        this.checkSensitiveData = builder.checkSensitiveData;
        this.customPiiPatterns = List.copyOf(builder.customPiiPatterns);
        this.customSensitivePatterns = List.copyOf(builder.customSensitivePatterns);
    }

    public static SecurityCheckConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isCheckPromptInjection() {
        return checkPromptInjection;
    }

    public boolean isCheckJailbreak() {
        return checkJailbreak;
    }

    public boolean isCheckPii() {
        return checkPii;
    }

    public boolean isCheckSensitiveData() {
        return checkSensitiveData;
    }

    public List<PatternRule<SecuritySeverity>> getCustomPiiPatterns() {
        return customPiiPatterns;
    }

    public List<PatternRule<SecuritySeverity>> getCustomSensitivePatterns() {
        return customSensitivePatterns;
    }

    public static final class Builder {
        private boolean checkPromptInjection = true;
        private boolean checkJailbreak = true;
        private boolean checkPii = true;
        private boolean checkSensitiveData = true;
        private List<PatternRule<SecuritySeverity>> customPiiPatterns = List.of();
        private List<PatternRule<SecuritySeverity>> customSensitivePatterns = List.of();

        private Builder() {
        }

        public Builder checkPromptInjection(boolean enabled) {
            this.checkPromptInjection = enabled;
            return this;
        }

        public Builder checkJailbreak(boolean enabled) {
            this.checkJailbreak = enabled;
            return this;
        }

        public Builder checkPii(boolean enabled) {
            this.checkPii = enabled;
            return this;
        }

        public Builder checkSensitiveData(boolean enabled) {
            this.checkSensitiveData = enabled;
            return this;
        }

        public Builder customPiiPatterns(List<PatternRule<SecuritySeverity>> patterns) {
            this.customPiiPatterns = patterns != null ? patterns : List.of();
            return this;
        }

        public Builder customSensitivePatterns(List<PatternRule<SecuritySeverity>> patterns) {
            this.customSensitivePatterns = patterns != null ? patterns : List.of();
            return this;
        }

        public SecurityCheckConfig build() {
            return new SecurityCheckConfig(this);
        }
    }
}

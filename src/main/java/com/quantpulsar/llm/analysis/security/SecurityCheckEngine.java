package com.quantpulsar.llm.analysis.security;

import com.quantpulsar.llm.analysis.model.CheckLocation;
import com.quantpulsar.llm.analysis.model.SecurityCheck;
import com.quantpulsar.llm.analysis.model.SecurityCheckType;
import com.quantpulsar.llm.analysis.model.SecuritySeverity;
import com.quantpulsar.llm.analysis.pattern.MatchFilter;
import com.quantpulsar.llm.analysis.pattern.PatternRule;
import com.quantpulsar.llm.analysis.pattern.PatternRunner;
import com.quantpulsar.llm.analysis.pattern.RuleMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

/**
 * Pattern-based security scanning of one exchange.
 * <p>
 * Prompt injection and jailbreak catalogs run against the input side only; PII and
 * sensitive data catalogs run against input and output, with false positive filtering.
 * A check reports the highest severity among its surviving matches, or
 * {@link SecuritySeverity#LOW} when nothing was detected.
 *
 * @author Quantpulsar 2025-2026
 */
public class SecurityCheckEngine {

    private static final Logger log = LoggerFactory.getLogger(SecurityCheckEngine.class);

    public static final String PROMPT_INJECTION_NAME = "Prompt Injection Detection";
    public static final String JAILBREAK_NAME = "Jailbreak Attempt Detection";
    public static final String PII_NAME = "PII Detection";
    public static final String SENSITIVE_DATA_NAME = "Sensitive Data Detection";

    private final SecurityCheckConfig defaultConfig;
    private final Clock clock;

    public SecurityCheckEngine() {
        this(SecurityCheckConfig.defaults(), Clock.systemUTC());
    }

    public SecurityCheckEngine(SecurityCheckConfig defaultConfig, Clock clock) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SecurityCheckConfig getDefaultConfig() {
        return defaultConfig;
    }

    public List<SecurityCheck> runSecurityChecks(SecurityCheckContext context) {
        return runSecurityChecks(context, defaultConfig);
    }

    public List<SecurityCheck> runSecurityChecks(SecurityCheckContext context, SecurityCheckConfig config) {
        List<SecurityCheck> checks = new ArrayList<>(4);
        if (config.isCheckPromptInjection()) {
            checks.add(detectPromptInjection(context));
        }
        if (config.isCheckJailbreak()) {
            checks.add(detectJailbreak(context));
        }
        if (config.isCheckPii()) {
            checks.add(detectPii(context, config.getCustomPiiPatterns()));
        }
        if (config.isCheckSensitiveData()) {
            checks.add(detectSensitiveData(context, config.getCustomSensitivePatterns()));
        }
        return checks;
    }

    public SecurityCheck detectPromptInjection(SecurityCheckContext context) {
        return scanInput(SecurityCheckType.PROMPT_INJECTION, PROMPT_INJECTION_NAME,
                SecurityPatterns.PROMPT_INJECTION, context);
    }

    public SecurityCheck detectJailbreak(SecurityCheckContext context) {
        return scanInput(SecurityCheckType.JAILBREAK_ATTEMPT, JAILBREAK_NAME,
                SecurityPatterns.JAILBREAK, context);
    }

    public SecurityCheck detectPii(SecurityCheckContext context) {
        return detectPii(context, defaultConfig.getCustomPiiPatterns());
    }

    /** Scans for PII with the built-in catalog followed by {@code extraPatterns}. */
    public SecurityCheck detectPii(SecurityCheckContext context, List<PatternRule<SecuritySeverity>> extraPatterns) {
        List<RuleMatch<SecuritySeverity>> matches = PatternRunner.scan(
                merge(SecurityPatterns.PII, extraPatterns), context.combinedText(), FalsePositiveFilters.PII);
        String details = matches.isEmpty() ? null : "Found: " + matches.stream()
                .map(m -> m.name() + " (" + m.count() + ")")
                .collect(Collectors.joining(", "));
        return scanBothSides(SecurityCheckType.PII_DETECTED, PII_NAME, matches, details, context, FalsePositiveFilters.PII);
    }

    public SecurityCheck detectSensitiveData(SecurityCheckContext context) {
        return detectSensitiveData(context, defaultConfig.getCustomSensitivePatterns());
    }

    /** Scans for secrets with the built-in catalog followed by {@code extraPatterns}. */
    public SecurityCheck detectSensitiveData(SecurityCheckContext context,
                                             List<PatternRule<SecuritySeverity>> extraPatterns) {
        List<RuleMatch<SecuritySeverity>> matches = PatternRunner.scan(
                merge(SecurityPatterns.SENSITIVE_DATA, extraPatterns), context.combinedText(),
                FalsePositiveFilters.SENSITIVE_DATA);
        String details = matches.isEmpty() ? null : matches.stream()
                .map(m -> m.rule().description() != null ? m.rule().description() : m.name())
                .collect(Collectors.joining("; "));
        return scanBothSides(SecurityCheckType.SENSITIVE_DATA, SENSITIVE_DATA_NAME, matches, details, context,
                FalsePositiveFilters.SENSITIVE_DATA);
    }

    public String redactPii(String text) {
        return redactPii(text, defaultConfig.getCustomPiiPatterns());
    }

    /**
     * Returns a copy of {@code text} with every surviving PII match replaced by
     * {@code [<NAME>_REDACTED]}. Redacting already redacted text is a no-op.
     */
    public String redactPii(String text, List<PatternRule<SecuritySeverity>> extraPatterns) {
        return redact(text, merge(SecurityPatterns.PII, extraPatterns), FalsePositiveFilters.PII);
    }

    public String redactSensitiveData(String text) {
        return redactSensitiveData(text, defaultConfig.getCustomSensitivePatterns());
    }

    public String redactSensitiveData(String text, List<PatternRule<SecuritySeverity>> extraPatterns) {
        return redact(text, merge(SecurityPatterns.SENSITIVE_DATA, extraPatterns), FalsePositiveFilters.SENSITIVE_DATA);
    }

    private SecurityCheck scanInput(SecurityCheckType type, String name,
                                    List<PatternRule<SecuritySeverity>> catalog, SecurityCheckContext context) {
        List<RuleMatch<SecuritySeverity>> matches = PatternRunner.scan(catalog, context.inputText());
        boolean detected = !matches.isEmpty();
        String details = detected
                ? "Detected patterns: " + matches.stream().map(RuleMatch::name).collect(Collectors.joining(", "))
                : null;
        SecuritySeverity severity = PatternRunner.maxGrade(matches, SecuritySeverity.LOW);
        if (detected) {
            log.debug("{} matched {} pattern(s), severity {}", name, matches.size(), severity.value());
        }
        return new SecurityCheck(type, name, detected, severity, details, CheckLocation.INPUT, Instant.now(clock));
    }

    private SecurityCheck scanBothSides(SecurityCheckType type, String name, List<RuleMatch<SecuritySeverity>> matches,
                                        String details, SecurityCheckContext context,
                                        MatchFilter<SecuritySeverity> filter) {
        boolean inInput = false;
        boolean inOutput = false;
        String input = context.inputText();
        String output = context.outputText();
        for (RuleMatch<SecuritySeverity> match : matches) {
            inInput |= survives(match.rule(), input, filter);
            inOutput |= survives(match.rule(), output, filter);
        }
        boolean detected = !matches.isEmpty();
        SecuritySeverity severity = PatternRunner.maxGrade(matches, SecuritySeverity.LOW);
        if (detected) {
            log.debug("{} matched {} rule(s), severity {}", name, matches.size(), severity.value());
        }
        return new SecurityCheck(type, name, detected, severity, details, CheckLocation.of(inInput, inOutput),
                Instant.now(clock));
    }

    private static boolean survives(PatternRule<SecuritySeverity> rule, String text,
                                    MatchFilter<SecuritySeverity> filter) {
        List<String> found = PatternRunner.findAll(rule.pattern(), text);
        return !found.isEmpty() && !filter.filter(rule, found).isEmpty();
    }

    private static String redact(String text, List<PatternRule<SecuritySeverity>> rules,
                                 MatchFilter<SecuritySeverity> filter) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String redacted = text;
        for (PatternRule<SecuritySeverity> rule : rules) {
            redacted = redactRule(redacted, rule, filter);
        }
        return redacted;
    }

    private static String redactRule(String text, PatternRule<SecuritySeverity> rule,
                                     MatchFilter<SecuritySeverity> filter) {
        String token = "[" + rule.name().toUpperCase(Locale.ROOT) + "_REDACTED]";
        Matcher matcher = rule.pattern().matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        int last = 0;
        boolean replaced = false;
        while (matcher.find()) {
            String match = matcher.group();
            if (filter.filter(rule, List.of(match)).isEmpty()) {
                continue;
            }
            result.append(text, last, matcher.start()).append(token);
            last = matcher.end();
            replaced = true;
        }
        if (!replaced) {
            return text;
        }
        return result.append(text, last, text.length()).toString();
    }

    private static List<PatternRule<SecuritySeverity>> merge(List<PatternRule<SecuritySeverity>> builtIn,
                                                             List<PatternRule<SecuritySeverity>> extra) {
        if (extra == null || extra.isEmpty()) {
            return builtIn;
        }
        List<PatternRule<SecuritySeverity>> merged = new ArrayList<>(builtIn.size() + extra.size());
        merged.addAll(builtIn);
        merged.addAll(extra);
        return merged;
    }
}

package com.quantpulsar.llm.analysis.security;

import com.quantpulsar.llm.analysis.model.SecuritySeverity;
import com.quantpulsar.llm.analysis.pattern.PatternRule;

import java.util.List;

import static com.quantpulsar.llm.analysis.model.SecuritySeverity.CRITICAL;
import static com.quantpulsar.llm.analysis.model.SecuritySeverity.HIGH;
import static com.quantpulsar.llm.analysis.model.SecuritySeverity.LOW;
import static com.quantpulsar.llm.analysis.model.SecuritySeverity.MEDIUM;

/**
 * Built-in security detector catalogs, in evaluation order.
 * Rule names are stable and appear in finding details and redaction tokens.
 *
 * @author Quantpulsar 2025-2026
 */
public final class SecurityPatterns {

    /** Attempts to override or extract the system instructions. Checked against input only. */
    public static final List<PatternRule<SecuritySeverity>> PROMPT_INJECTION = List.of(
            // instruction override
            PatternRule.caseInsensitive("ignore_instructions",
                    "ignore\\s+(all\\s+)?(previous|prior|above)\\s+(instructions?|prompts?|rules?)", HIGH),
            PatternRule.caseInsensitive("disregard_previous", "disregard\\s+(all\\s+)?(previous|prior|above)", HIGH),
            PatternRule.caseInsensitive("forget_everything", "forget\\s+(everything|all|your)\\s+(previous|you\\s+know)", HIGH),
            PatternRule.caseInsensitive("new_instructions", "new\\s+instructions?:\\s*", HIGH),
            PatternRule.caseInsensitive("override_system",
                    "override\\s+(system|previous|your)\\s+(prompt|instructions?|rules?)", CRITICAL),
            // prompt extraction
            PatternRule.caseInsensitive("extract_prompt",
                    "(?:what\\s+(are|is)|reveal)\\s+your\\s+(system\\s+)?(prompt|instructions?|rules?)", MEDIUM),
            PatternRule.caseInsensitive("show_prompt", "show\\s+(me\\s+)?your\\s+(system\\s+)?(prompt|instructions?)", MEDIUM),
            PatternRule.caseInsensitive("repeat_prompt", "repeat\\s+(your\\s+)?(system\\s+)?(prompt|instructions?)", MEDIUM),
            PatternRule.caseInsensitive("print_prompt", "print\\s+(your\\s+)?(initial|system)\\s+(prompt|instructions?)", MEDIUM),
            // role confusion
            PatternRule.caseInsensitive("role_override", "you\\s+are\\s+now\\s+(a|an|the)", MEDIUM),
            PatternRule.caseInsensitive("pretend_role", "pretend\\s+(you\\s+are|to\\s+be)\\s+(a|an|the)", MEDIUM),
            PatternRule.caseInsensitive("act_as", "act\\s+as\\s+(if\\s+you\\s+are\\s+)?(a|an|the)", LOW),
            PatternRule.caseInsensitive("from_now_on", "from\\s+now\\s+on,?\\s+you\\s+(are|will)", MEDIUM),
            // delimiters and special tokens
            PatternRule.caseInsensitive("delimiter_injection", "```[\\s\\S]*?(system|user|assistant)[\\s\\S]*?```", HIGH),
            PatternRule.caseInsensitive("special_token_injection", "<\\|?(system|user|assistant|im_start|im_end)\\|?>", HIGH),
            PatternRule.caseInsensitive("llama_token_injection", "\\[INST\\]|\\[/INST\\]|\\[SYS\\]|\\[/SYS\\]", HIGH),
            // context manipulation
            PatternRule.caseInsensitive("end_marker_injection", "end\\s+of\\s+(system\\s+)?(prompt|message|instructions?)", HIGH),
            PatternRule.caseInsensitive("separator_injection", "---+\\s*(new|user|actual)\\s*(prompt|instructions?|query)", HIGH),
            PatternRule.caseInsensitive("important_ignore", "IMPORTANT:\\s*ignore", HIGH));

    /** Attempts to bypass safety behaviour. Checked against input only. */
    public static final List<PatternRule<SecuritySeverity>> JAILBREAK = List.of(
            PatternRule.caseInsensitive("dan_jailbreak", "\\bDAN\\b.*?(do\\s+anything\\s+now|mode)", CRITICAL),
            PatternRule.caseInsensitive("developer_mode", "developer\\s+mode\\s+(enabled|activated|on)", CRITICAL),
            PatternRule.caseInsensitive("jailbreak_explicit", "jailbreak(ed)?\\s+(mode|prompt)", CRITICAL),
            PatternRule.caseInsensitive("remove_ethics",
                    "pretend\\s+(there\\s+are\\s+)?no\\s+(ethical|moral|safety)\\s+(guidelines|rules|restrictions)", CRITICAL),
            PatternRule.caseInsensitive("respond_without_safety", "respond\\s+without\\s+(any\\s+)?(moral|ethical|safety)", CRITICAL),
            PatternRule.caseInsensitive("hypothetical_bypass",
                    "hypothetical(ly)?\\s+speaking,?\\s+if\\s+you\\s+(had|could|were)", MEDIUM),
            // encoding and obfuscation
            PatternRule.caseInsensitive("base64_obfuscation", "base64\\s+(decode|encoded?):\\s*", MEDIUM),
            PatternRule.caseInsensitive("rot13_obfuscation", "rot13\\s+this", MEDIUM),
            PatternRule.caseInsensitive("encoding_request", "respond\\s+in\\s+(hex|binary|base64|morse)", MEDIUM),
            PatternRule.caseInsensitive("leet_speak", "translate\\s+to\\s+(leet|l33t|1337)", LOW),
            // instruction reversal
            PatternRule.caseInsensitive("opposite_day", "opposite\\s+day", MEDIUM),
            PatternRule.caseInsensitive("do_opposite", "do\\s+the\\s+(exact\\s+)?opposite", MEDIUM),
            PatternRule.caseInsensitive("invert_behavior", "invert\\s+(your\\s+)?(responses?|behavior|output)", MEDIUM),
            // token manipulation
            PatternRule.caseInsensitive("token_splitting",
                    "split\\s+(this|your)\\s+(response|answer)\\s+into\\s+(tokens|characters|parts)", LOW),
            PatternRule.caseInsensitive("char_by_char", "one\\s+(letter|character|word)\\s+(per|at\\s+a)\\s+(line|time)", LOW),
            // fictional framing
            PatternRule.caseInsensitive("fiction_framing", "write\\s+a\\s+(story|fiction|scenario)\\s+where\\s+(you|an?\\s+AI)", LOW),
            PatternRule.caseInsensitive("fictional_world",
                    "in\\s+this\\s+(fictional|hypothetical|imaginary)\\s+(world|scenario|universe)", LOW),
            // privilege escalation
            PatternRule.caseInsensitive("sudo_mode", "sudo\\s+(mode|enable|activate)", HIGH),
            PatternRule.caseInsensitive("admin_mode", "admin(istrator)?\\s+(mode|access|override)", HIGH),
            PatternRule.caseInsensitive("root_access", "root\\s+(access|mode|privileges)", HIGH));

    /** Personally identifiable information. Checked against input and output. */
    public static final List<PatternRule<SecuritySeverity>> PII = List.of(
            PatternRule.of("email", "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}", MEDIUM,
                    "Email address detected"),
            PatternRule.of("phone_us", "(?:\\+1[-.\\s]?)?\\(?[2-9]\\d{2}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}", MEDIUM,
                    "US phone number detected"),
            PatternRule.of("phone_intl", "\\+[1-9]\\d{1,14}", MEDIUM,
                    "International phone number detected"),
            PatternRule.of("ssn", "\\b\\d{3}[-.\\s]?\\d{2}[-.\\s]?\\d{4}\\b", CRITICAL,
                    "Social Security Number detected"),
            PatternRule.of("credit_card",
                    "\\b(?:4[0-9]{12}(?:[0-9]{3})?|5[1-5][0-9]{14}|3[47][0-9]{13}|6(?:011|5[0-9]{2})[0-9]{12})\\b", CRITICAL,
                    "Credit card number detected"),
            PatternRule.of("credit_card_formatted", "\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b", HIGH,
                    "Formatted credit card number detected"),
            PatternRule.of("ip_address",
                    "\\b(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\b", LOW,
                    "IP address detected"),
            PatternRule.of("dob", "\\b(?:0[1-9]|1[0-2])[/\\-.](?:0[1-9]|[12]\\d|3[01])[/\\-.](?:19|20)\\d{2}\\b", MEDIUM,
                    "Date of birth pattern detected"),
            PatternRule.of("passport", "\\b[A-Z]{1,2}\\d{6,9}\\b", HIGH,
                    "Possible passport number detected"),
            PatternRule.of("drivers_license", "\\b[A-Z]{1,2}\\d{5,8}\\b", MEDIUM,
                    "Possible driver's license number detected"),
            PatternRule.of("bank_account", "\\b\\d{8,17}\\b", MEDIUM,
                    "Possible bank account number detected"),
            PatternRule.of("iban", "\\b[A-Z]{2}\\d{2}[A-Z0-9]{4}\\d{7}([A-Z0-9]?){0,16}\\b", HIGH,
                    "IBAN detected"),
            PatternRule.caseInsensitive("mrn", "\\b(?:MRN|mrn|Medical\\s*Record)[:\\s#]*\\d{6,10}\\b", HIGH,
                    "Medical Record Number detected"));

    /** Credentials and secrets. Checked against input and output. */
    public static final List<PatternRule<SecuritySeverity>> SENSITIVE_DATA = List.of(
            PatternRule.of("api_key", "\\b(sk|pk|api)[-_]?[a-zA-Z0-9]{20,}", CRITICAL,
                    "API key detected"),
            PatternRule.caseInsensitive("bearer_token", "\\b(Bearer|token)\\s+[a-zA-Z0-9._-]{20,}", CRITICAL,
                    "Bearer token detected"),
            PatternRule.of("aws_access_key", "\\bAKIA[0-9A-Z]{16}\\b", CRITICAL,
                    "AWS Access Key detected"),
            PatternRule.of("aws_secret_key_candidate", "\\b[A-Za-z0-9/+=]{40}\\b", HIGH,
                    "Possible AWS Secret Key"),
            PatternRule.caseInsensitive("private_key", "-----BEGIN\\s+(RSA|DSA|EC|OPENSSH)?\\s*PRIVATE\\s+KEY-----", CRITICAL,
                    "Private key detected"),
            PatternRule.caseInsensitive("db_connection", "(?:mongodb|mysql|postgres|postgresql|redis|mssql)://[^\\s]+", CRITICAL,
                    "Database connection string detected"),
            PatternRule.caseInsensitive("password_pattern", "\\b(password|passwd|pwd)\\s*[:=]\\s*[\"']?[^\\s\"']{4,}", CRITICAL,
                    "Password pattern detected"),
            PatternRule.of("jwt_token", "eyJ[a-zA-Z0-9_-]*\\.eyJ[a-zA-Z0-9_-]*\\.[a-zA-Z0-9_-]*", HIGH,
                    "JWT token detected"),
            PatternRule.of("github_token", "\\b(ghp|gho|ghu|ghs|ghr)_[a-zA-Z0-9]{36,}\\b", CRITICAL,
                    "GitHub token detected"),
            PatternRule.of("slack_token", "xox[baprs]-[0-9a-zA-Z-]+", CRITICAL,
                    "Slack token detected"),
            PatternRule.caseInsensitive("generic_secret", "\\b(secret|key|apikey|api_key|auth)\\s*[:=]\\s*[\"']?[^\\s\"']{8,}", HIGH,
                    "Generic secret pattern detected"));

    private SecurityPatterns() {
    }
}

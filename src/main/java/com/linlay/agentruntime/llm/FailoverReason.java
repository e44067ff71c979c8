package com.linlay.agentruntime.llm;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public enum FailoverReason {
    RATE_LIMIT("rate limit", "429", "too many requests", "ratelimit"),
    AUTH("401", "403", "invalid api key", "unauthorized", "authentication"),
    BILLING("402", "payment required", "insufficient credits", "billing", "quota exceeded"),
    TIMEOUT("timeout", "timed out", "deadline exceeded"),
    FORMAT("400", "invalid request", "bad request", "malformed"),
    COOLDOWN,
    UNKNOWN;

    private static final List<FailoverReason> CLASSIFY_ORDER = List.of(RATE_LIMIT, AUTH, BILLING, TIMEOUT, FORMAT);

    private static final List<String> CONTEXT_OVERFLOW_PATTERNS = List.of(
            "context length",
            "context_length_exceeded",
            "maximum context",
            "too many tokens",
            "prompt is too long"
    );

    private final List<String> phrases;
    private final List<Pattern> statusCodes;

    FailoverReason(String... patterns) {
        this.phrases = List.of(patterns).stream()
                .filter(pattern -> !isNumeric(pattern))
                .toList();
        // numeric codes must not match inside longer numbers such as token counts
        this.statusCodes = List.of(patterns).stream()
                .filter(FailoverReason::isNumeric)
                .map(code -> Pattern.compile("(?<!\\d)" + code + "(?!\\d)"))
                .toList();
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies by case-insensitive match over the exception's simple class name and message. Text patterns
     * match as substrings, status codes only as whole numbers.
     */
    public static FailoverReason classify(Throwable error) {
        if (error == null) {
            return UNKNOWN;
        }
        String haystack = (error.getClass().getSimpleName() + " " + error.getMessage()).toLowerCase(Locale.ROOT);
        for (FailoverReason reason : CLASSIFY_ORDER) {
            if (reason.matches(haystack)) {
                return reason;
            }
        }
        return UNKNOWN;
    }

    /**
     * Whether an error message says the prompt no longer fits the model's context window.
     */
    public static boolean isContextOverflow(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return CONTEXT_OVERFLOW_PATTERNS.stream().anyMatch(lower::contains);
    }

    private boolean matches(String haystack) {
        for (Pattern code : statusCodes) {
            if (code.matcher(haystack).find()) {
                return true;
            }
        }
        for (String phrase : phrases) {
            if (haystack.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNumeric(String pattern) {
        return !pattern.isEmpty() && pattern.chars().allMatch(Character::isDigit);
    }
}

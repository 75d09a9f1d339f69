package com.fever.resilience.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * Error taxonomy for failed remote calls.
 * Declaration order is the matching order: the first category whose keywords
 * appear in an error message wins.
 */
public enum ErrorCategory {

    CONNECTION("connection", ErrorSeverity.MEDIUM,
            List.of("connection", "network", "timeout", "unreachable"),
            List.of("Check internet connection",
                    "Verify service endpoint is accessible",
                    "Try again in a few moments",
                    "Consider switching to offline mode")),

    AUTHENTICATION("authentication", ErrorSeverity.HIGH,
            List.of("unauthorized", "forbidden", "api key", "auth"),
            List.of("Verify API key is correct",
                    "Check API key permissions",
                    "Regenerate API key if needed",
                    "Ensure account is in good standing")),

    RATE_LIMIT("rate_limit", ErrorSeverity.MEDIUM,
            List.of("rate limit", "too many requests", "quota", "429"),
            List.of("Wait before making more requests",
                    "Upgrade to higher tier plan",
                    "Implement request batching",
                    "Use caching to reduce requests")),

    MODEL_UNAVAILABLE("model_unavailable", ErrorSeverity.HIGH,
            List.of("model not found", "unavailable", "does not exist"),
            List.of("Check model name spelling",
                    "List available models",
                    "Try a different model",
                    "Update model repository")),

    RESOURCE_EXHAUSTED("resource_exhausted", ErrorSeverity.CRITICAL,
            List.of("memory", "disk space", "cpu", "resources"),
            List.of("Free up system resources",
                    "Restart the application",
                    "Increase resource limits",
                    "Check for memory leaks")),

    UNKNOWN("unknown", ErrorSeverity.MEDIUM,
            List.of(),
            List.of("Try the operation again",
                    "Check system logs for details",
                    "Restart the application",
                    "Contact support if issue persists"));

    private final String code;
    private final ErrorSeverity severity;
    private final List<String> keywords;
    private final List<String> suggestions;

    ErrorCategory(String code, ErrorSeverity severity, List<String> keywords, List<String> suggestions) {
        this.code = code;
        this.severity = severity;
        this.keywords = keywords;
        this.suggestions = suggestions;
    }

    public String code() {
        return code;
    }

    public ErrorSeverity severity() {
        return severity;
    }

    public List<String> keywords() {
        return keywords;
    }

    public List<String> suggestions() {
        return suggestions;
    }

    /**
     * @param lowerCaseMessage message already folded with {@link Locale#ROOT}
     */
    public boolean matches(String lowerCaseMessage) {
        return keywords.stream().anyMatch(lowerCaseMessage::contains);
    }
}

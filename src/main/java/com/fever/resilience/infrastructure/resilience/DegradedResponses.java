package com.fever.resilience.infrastructure.resilience;

import java.util.Map;

/**
 * Fixed, user-facing replies for services that are down.
 * Unknown or missing service names get a generic message that names the service and the error.
 */
public final class DegradedResponses {

    private static final Map<String, String> RESPONSES = Map.of(
            "llm", "[AI Service Temporarily Unavailable] The language model is not responding right now. "
                    + "Please try again in a few moments. Error: %s",
            "memory", "[Memory Service Unavailable] Stored context cannot be reached right now, "
                    + "but the current request can still be handled.",
            "skills", "[Skills Service Limited] Some advanced features are unavailable, "
                    + "but basic tasks still work.",
            "plugins", "[Plugin Service Unavailable] Custom plugins are temporarily unavailable.",
            "web_search", "[Web Search Unavailable] Web search is not reachable right now, "
                    + "other tasks are not affected.",
            "code_generation", "[Code Generation Limited] Advanced code generation is failing, "
                    + "only basic code examples are available."
    );

    private static final String GENERIC = "[Service Degraded] %s is experiencing issues: %s";

    private DegradedResponses() {
    }

    public static String forService(String serviceName, Throwable error) {
        String message = ErrorClassifier.describe(error);
        String template = serviceName == null ? null : RESPONSES.get(serviceName);
        if (template == null) {
            return String.format(GENERIC, serviceName, message);
        }
        return template.contains("%s") ? String.format(template, message) : template;
    }

    public static boolean isKnownService(String serviceName) {
        return serviceName != null && RESPONSES.containsKey(serviceName);
    }
}

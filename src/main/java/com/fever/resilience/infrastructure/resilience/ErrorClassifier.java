package com.fever.resilience.infrastructure.resilience;

import com.fever.resilience.domain.model.ErrorCategory;
import com.fever.resilience.domain.model.ErrorContext;
import java.time.Clock;
import java.util.Locale;

/**
 * Keyword based classification of error messages.
 * Categories are tried in {@link ErrorCategory} declaration order and the first match wins;
 * anything unmatched is {@link ErrorCategory#UNKNOWN}.
 */
public class ErrorClassifier {

    private final Clock clock;

    public ErrorClassifier(Clock clock) {
        this.clock = clock;
    }

    public ErrorContext classify(String errorMessage) {
        String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
        for (ErrorCategory category : ErrorCategory.values()) {
            if (category != ErrorCategory.UNKNOWN && category.matches(lower)) {
                return ErrorContext.of(category, clock.instant());
            }
        }
        return ErrorContext.of(ErrorCategory.UNKNOWN, clock.instant());
    }

    public ErrorContext classify(Throwable error) {
        return classify(describe(error));
    }

    /**
     * Message of the error, or its simple class name when it carries none
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}

package com.fever.resilience.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SizeEstimatorTest {

    private final SizeEstimator estimator = new SizeEstimator(new ObjectMapper());

    @Test
    void shouldUseJsonLengthForSerializableValues() {
        assertThat(estimator.estimate("abc")).isEqualTo(5); // quotes included
        assertThat(estimator.estimate(List.of(1, 2, 3))).isEqualTo("[1,2,3]".length());
    }

    @Test
    void shouldFallBackToStringLengthWhenSerializationFails() {
        // Given
        Object unserializable = new Object() {
            @Override
            public String toString() {
                return "opaque-value";
            }
        };

        // When / Then
        assertThat(estimator.estimate(unserializable)).isEqualTo("opaque-value".length());
    }

    @Test
    void shouldGrowWithValueSize() {
        assertThat(estimator.estimate("x".repeat(1000)))
                .isGreaterThan(estimator.estimate("x".repeat(10)));
    }

    @Test
    void shouldReturnZeroForNull() {
        assertThat(estimator.estimate(null)).isZero();
    }
}

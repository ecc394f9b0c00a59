package com.pfesentinel.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisRequest}.
 */
class AnalysisRequestTest {

    @Test
    @DisplayName("Should default every parameter")
    void shouldApplyDefaults() {
        AnalysisRequest request = AnalysisRequest.defaults();

        assertThat(request.getLookback()).isEqualTo(Duration.ofHours(1));
        assertThat(request.getMinConsecutiveSamples()).isEqualTo(3);
        assertThat(request.isUseMl()).isTrue();
        assertThat(request.getMlConfidenceThreshold()).isEqualTo(0.65);
        assertThat(request.isUseDynamicBaseline()).isTrue();
    }

    @Test
    @DisplayName("Should reject out-of-range parameters")
    void shouldValidate() {
        assertThatThrownBy(() -> AnalysisRequest.builder().lookbackHours(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookbackHours");
        assertThatThrownBy(() -> AnalysisRequest.builder().minConsecutiveSamples(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minConsecutiveSamples");
        assertThatThrownBy(() -> AnalysisRequest.builder().mlConfidenceThreshold(1.1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mlConfidenceThreshold");
    }
}

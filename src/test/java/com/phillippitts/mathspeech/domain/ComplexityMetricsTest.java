package com.phillippitts.mathspeech.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComplexityMetricsTest {

    private static ComplexityMetrics withScore(double score) {
        return new ComplexityMetrics(1, 1, 1, 1, 0, 0.1, score);
    }

    @Test
    void levelShouldFollowScoreBands() {
        assertThat(withScore(0.0).level()).isEqualTo(ComplexityMetrics.Level.SIMPLE);
        assertThat(withScore(1.99).level()).isEqualTo(ComplexityMetrics.Level.SIMPLE);
        assertThat(withScore(2.0).level()).isEqualTo(ComplexityMetrics.Level.MODERATE);
        assertThat(withScore(4.0).level()).isEqualTo(ComplexityMetrics.Level.COMPLEX);
        assertThat(withScore(6.0).level()).isEqualTo(ComplexityMetrics.Level.VERY_COMPLEX);
        assertThat(withScore(10.0).level()).isEqualTo(ComplexityMetrics.Level.VERY_COMPLEX);
    }

    @Test
    void suitabilityShouldDependOnAudience() {
        ComplexityMetrics moderate = withScore(3.0);

        assertThat(moderate.isSuitableFor(AudienceLevel.ELEMENTARY)).isFalse();
        assertThat(moderate.isSuitableFor(AudienceLevel.HIGH_SCHOOL)).isTrue();
        assertThat(withScore(10.0).isSuitableFor(AudienceLevel.GRADUATE)).isFalse();
        assertThat(withScore(10.0).isSuitableFor(AudienceLevel.RESEARCH)).isTrue();
    }

    @Test
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> withScore(10.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> withScore(-0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ComplexityMetrics(-1, 0, 0, 0, 0, 0.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ComplexityMetrics(0, 0, 0, 0, 0, 1.5, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Length score");
    }
}

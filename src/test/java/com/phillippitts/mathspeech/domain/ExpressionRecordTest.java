package com.phillippitts.mathspeech.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionRecordTest {

    private final ComplexityMetrics metrics = new ComplexityMetrics(0, 0, 1, 0, 0, 0.01, 0.3);

    @Test
    void derivedFieldsShouldBeUnavailableBeforeAnalysis() {
        ExpressionRecord record = new ExpressionRecord("x", AudienceLevel.GRADUATE, "general", null);

        assertThat(record.isAnalyzed()).isFalse();
        assertThat(record.domainHint()).isEmpty();
        assertThatThrownBy(record::domain).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(record::metrics).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void analysisShouldBeAppliedOnlyOnce() {
        ExpressionRecord record = new ExpressionRecord("{x", AudienceLevel.GRADUATE, "general", null);
        record.applyAnalysis(MathDomain.GENERAL, ExpressionCategory.SIMPLE, metrics, TokenInventory.EMPTY,
                List.of("malformed nesting: 1 unclosed brace(s)"));

        assertThat(record.domain()).isEqualTo(MathDomain.GENERAL);
        assertThat(record.analysisWarnings()).containsExactly("malformed nesting: 1 unclosed brace(s)");
        assertThat(record.metadata().warnings()).containsExactly("malformed nesting: 1 unclosed brace(s)");
        assertThatThrownBy(() -> record.applyAnalysis(MathDomain.CALCULUS, ExpressionCategory.SIMPLE,
                metrics, TokenInventory.EMPTY, List.of()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void metadataShouldListEachRuleOncePerPass() {
        ProcessingMetadata metadata = new ProcessingMetadata();
        metadata.recordApplication(new RuleApplication("op_plus", 1, 1, 4), true);
        metadata.recordApplication(new RuleApplication("op_plus", 1, 6, 9), false);
        metadata.recordApplication(new RuleApplication("op_plus", 2, 0, 3), true);
        metadata.addWarning("w");
        metadata.addWarning("w");

        assertThat(metadata.appliedRules()).containsExactly("op_plus", "op_plus");
        assertThat(metadata.applications()).hasSize(3);
        assertThat(metadata.warnings()).containsExactly("w");
    }

    @Test
    void applicationsShouldDetectOverlapWithinAPassOnly() {
        RuleApplication a = new RuleApplication("a", 1, 0, 5);

        assertThat(a.overlaps(new RuleApplication("b", 1, 4, 8))).isTrue();
        assertThat(a.overlaps(new RuleApplication("b", 1, 5, 8))).isFalse();
        assertThat(a.overlaps(new RuleApplication("b", 2, 0, 5))).isFalse();
        assertThatThrownBy(() -> new RuleApplication("c", 0, 0, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}

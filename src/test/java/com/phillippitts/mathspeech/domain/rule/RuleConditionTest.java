package com.phillippitts.mathspeech.domain.rule;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleConditionTest {

    private static final String TEXT = "\\vec{a} \\cdot \\vec{b}";

    @Test
    void precedingShouldLookOnlyBeforeTheMatch() {
        int start = TEXT.indexOf("\\cdot");
        int end = start + "\\cdot".length();
        RuleCondition condition = new RuleCondition(RuleCondition.Type.PRECEDING, "\\vec", false);

        assertThat(condition.test(TEXT, start, end, 24)).isTrue();
        assertThat(condition.test(TEXT, 0, 4, 24)).isFalse();
    }

    @Test
    void precedingShouldRespectTheWindow() {
        int start = TEXT.indexOf("\\cdot");
        RuleCondition condition = new RuleCondition(RuleCondition.Type.PRECEDING, "\\vec", false);

        assertThat(condition.test(TEXT, start, start + 5, 3)).isFalse();
    }

    @Test
    void followingShouldLookOnlyAfterTheMatch() {
        int start = TEXT.indexOf("\\cdot");
        int end = start + "\\cdot".length();
        RuleCondition condition = new RuleCondition(RuleCondition.Type.FOLLOWING, "{b}", false);

        assertThat(condition.test(TEXT, start, end, 24)).isTrue();
        assertThat(condition.test(TEXT, end, TEXT.length(), 24)).isFalse();
    }

    @Test
    void containsShouldSearchTheWholeText() {
        RuleCondition condition = new RuleCondition(RuleCondition.Type.CONTAINS, "{b}", false);

        assertThat(condition.test(TEXT, 0, 1, 0)).isTrue();
    }

    @Test
    void negateShouldInvertTheOutcome() {
        RuleCondition condition = new RuleCondition(RuleCondition.Type.CONTAINS, "\\matrix", true);

        assertThat(condition.test(TEXT, 0, 1, 24)).isTrue();
    }

    @Test
    void typeTagsShouldParseCaseInsensitively() {
        assertThat(RuleCondition.Type.fromTag("Following")).isEqualTo(RuleCondition.Type.FOLLOWING);
        assertThatThrownBy(() -> RuleCondition.Type.fromTag("around"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("around");
        assertThatThrownBy(() -> new RuleCondition(RuleCondition.Type.CONTAINS, "", false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

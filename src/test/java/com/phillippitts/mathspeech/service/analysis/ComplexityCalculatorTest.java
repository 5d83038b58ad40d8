package com.phillippitts.mathspeech.service.analysis;

import com.phillippitts.mathspeech.domain.ComplexityMetrics;
import com.phillippitts.mathspeech.domain.TokenInventory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ComplexityCalculatorTest {

    private final ComplexityCalculator calculator = new ComplexityCalculator();

    @Test
    void shouldInventoryTokens() {
        TokenInventory tokens = calculator.tokens("\\sin(x) + \\sin(y) \\cdot \\sqrt{z} = 2x");

        assertThat(tokens.commands()).containsExactly("sin", "cdot", "sqrt");
        assertThat(tokens.variables()).containsExactly("x", "y", "z");
        assertThat(tokens.operators()).containsExactly("+", "\\cdot", "=");
        assertThat(tokens.functions()).containsExactly("sin", "sqrt");
    }

    @Test
    void variablesShouldExcludeCommandLetters() {
        assertThat(calculator.tokens("\\alpha + ab").variables()).isEmpty();
    }

    @Test
    void nestingShouldTrackMaximumDepth() {
        ComplexityCalculator.Nesting nesting = calculator.nesting("\\frac{\\sqrt{x^{2}}}{y}");

        assertThat(nesting.maxDepth()).isEqualTo(3);
        assertThat(nesting.warnings()).isEmpty();
    }

    @Test
    void escapedBracesShouldBeIgnored() {
        assertThat(calculator.nesting("\\{ x \\}").maxDepth()).isZero();
    }

    @Test
    void malformedNestingShouldWarnAndClampAtZero() {
        ComplexityCalculator.Nesting nesting = calculator.nesting("}x{{");

        assertThat(nesting.maxDepth()).isEqualTo(2);
        assertThat(nesting.warnings()).containsExactly(
                "malformed nesting: 1 unmatched closing brace(s)",
                "malformed nesting: 2 unclosed brace(s)");
    }

    @Test
    void scoreShouldCombineWeightedFactors() {
        String expression = "\\sin(x) + \\sin(y) \\cdot \\sqrt{z} = 2x";
        TokenInventory tokens = calculator.tokens(expression);
        ComplexityMetrics metrics = calculator.metrics(expression, tokens, 1);

        double expected = (1 / 5.0) * 2.5 + (3 / 10.0) * 2.0 + (3 / 10.0) * 1.5 + (2 / 5.0) * 2.5
                + (expression.length() / 100.0) * 1.5;
        assertThat(metrics.overallScore()).isCloseTo(expected, within(1e-9));
        assertThat(metrics.variableCount()).isEqualTo(3);
    }

    @Test
    void scoreShouldBeBoundedByTen() {
        StringBuilder huge = new StringBuilder();
        for (String cmd : new String[] {"sin", "cos", "tan", "log", "ln", "exp", "sqrt", "lim", "int", "sum", "prod"}) {
            huge.append('\\').append(cmd).append("{x}+");
        }
        String expression = huge.append("=".repeat(100)).toString();
        ComplexityMetrics metrics = calculator.metrics(expression, calculator.tokens(expression), 12);

        assertThat(metrics.overallScore()).isEqualTo(10.0);
        assertThat(metrics.lengthScore()).isEqualTo(1.0);
    }
}

package com.phillippitts.mathspeech.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateShouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void truncateShouldKeepShortStrings() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void truncateShouldCutLongStrings() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).isEqualTo("a".repeat(100));
    }

    @Test
    void previewShouldFlattenControlCharacters() {
        assertThat(LogSanitizer.preview("x\n+\ty")).isEqualTo("x + y");
    }

    @Test
    void previewShouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void previewShouldCutLongExpressionsAndReportLength() {
        String expression = "\\frac{a}{b}".repeat(20);

        String preview = LogSanitizer.preview(expression);

        assertThat(preview).startsWith(expression.substring(0, 80));
        assertThat(preview).endsWith("...(220 chars)");
    }

    @Test
    void previewShouldKeepExpressionsAtLimit() {
        String expression = "x".repeat(80);

        assertThat(LogSanitizer.preview(expression)).isEqualTo(expression);
    }
}

package com.phillippitts.mathspeech.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Limits and budgets for a single conversion.
 */
@Validated
@ConfigurationProperties(prefix = "mathspeech.conversion")
public class ConversionProperties {

    /** Longest accepted expression, in characters. */
    @Positive
    private final int maxExpressionLength;

    /** Deepest accepted brace nesting; deeper input is rejected as too complex. */
    @Positive
    private final int maxNestingDepth;

    /** Highest accepted overall complexity score (0..10). */
    @Min(0)
    @Max(10)
    private final double maxComplexityScore;

    /** Ceiling on rewrite passes; reaching it is a warning. */
    @Positive
    private final int maxPasses;

    /** Wall-clock budget for rule evaluation per expression. */
    @Positive
    private final long timeoutMs;

    /** Characters inspected on each side of a match by preceding/following conditions. */
    @Min(0)
    private final int conditionWindow;

    /** Budget for a whole batch conversion. */
    @Positive
    private final long batchTimeoutMs;

    @ConstructorBinding
    public ConversionProperties(Integer maxExpressionLength, Integer maxNestingDepth, Double maxComplexityScore,
                                Integer maxPasses, Long timeoutMs, Integer conditionWindow, Long batchTimeoutMs) {
        this.maxExpressionLength = maxExpressionLength == null ? 10_000 : maxExpressionLength;
        this.maxNestingDepth = maxNestingDepth == null ? 20 : maxNestingDepth;
        double score = maxComplexityScore == null ? 10.0 : maxComplexityScore;
        if (score < 0.0 || score > 10.0) {
            throw new IllegalArgumentException("mathspeech.conversion.max-complexity-score must be in [0,10]");
        }
        this.maxComplexityScore = score;
        this.maxPasses = maxPasses == null ? 10 : maxPasses;
        this.timeoutMs = timeoutMs == null ? 5_000L : timeoutMs;
        this.conditionWindow = conditionWindow == null ? 24 : conditionWindow;
        this.batchTimeoutMs = batchTimeoutMs == null ? 30_000L : batchTimeoutMs;
    }

    /** All defaults. */
    public static ConversionProperties defaults() {
        return new ConversionProperties(null, null, null, null, null, null, null);
    }

    public int getMaxExpressionLength() {
        return maxExpressionLength;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public double getMaxComplexityScore() {
        return maxComplexityScore;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getConditionWindow() {
        return conditionWindow;
    }

    public long getBatchTimeoutMs() {
        return batchTimeoutMs;
    }
}

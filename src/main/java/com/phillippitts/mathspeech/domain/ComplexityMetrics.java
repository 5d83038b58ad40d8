package com.phillippitts.mathspeech.domain;

/**
 * Structural measurements of an expression.
 *
 * @param nestingDepth         maximum brace depth reached
 * @param commandCount         number of distinct backslash commands
 * @param variableCount        number of distinct single-letter variables outside commands
 * @param operatorCount        number of operator occurrences
 * @param specialFunctionCount number of distinct special functions (sin, log, int, ...)
 * @param lengthScore          {@code min(length / 100, 1.0)}
 * @param overallScore         weighted score in [0, 10]
 */
public record ComplexityMetrics(
        int nestingDepth,
        int commandCount,
        int variableCount,
        int operatorCount,
        int specialFunctionCount,
        double lengthScore,
        double overallScore
) {

    public static final double MAX_SCORE = 10.0;

    /** Coarse difficulty label derived from the overall score. */
    public enum Level {
        SIMPLE,
        MODERATE,
        COMPLEX,
        VERY_COMPLEX
    }

    public ComplexityMetrics {
        if (nestingDepth < 0 || commandCount < 0 || variableCount < 0
                || operatorCount < 0 || specialFunctionCount < 0) {
            throw new IllegalArgumentException("Complexity counts must not be negative");
        }
        if (lengthScore < 0.0 || lengthScore > 1.0) {
            throw new IllegalArgumentException("Length score must be between 0.0 and 1.0, got: " + lengthScore);
        }
        if (overallScore < 0.0 || overallScore > MAX_SCORE) {
            throw new IllegalArgumentException("Overall score must be between 0.0 and 10.0, got: " + overallScore);
        }
    }

    public Level level() {
        if (overallScore < 2.0) {
            return Level.SIMPLE;
        }
        if (overallScore < 4.0) {
            return Level.MODERATE;
        }
        if (overallScore < 6.0) {
            return Level.COMPLEX;
        }
        return Level.VERY_COMPLEX;
    }

    /**
     * True if the overall score is within what the audience is expected to follow:
     * elementary 1.5, high school 5.0, undergraduate 7.0, graduate 8.5, research 10.0.
     */
    public boolean isSuitableFor(AudienceLevel audience) {
        double threshold = switch (audience) {
            case ELEMENTARY -> 1.5;
            case HIGH_SCHOOL -> 5.0;
            case UNDERGRADUATE -> 7.0;
            case GRADUATE -> 8.5;
            case RESEARCH -> MAX_SCORE;
        };
        return overallScore <= threshold;
    }
}

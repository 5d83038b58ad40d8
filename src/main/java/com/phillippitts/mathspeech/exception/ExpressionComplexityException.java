package com.phillippitts.mathspeech.exception;

/**
 * Thrown when an expression exceeds a configured structural limit (nesting depth or
 * overall complexity score) and is refused before any rule is applied.
 */
public class ExpressionComplexityException extends MathSpeechException {

    private final String metric;
    private final double actual;
    private final double limit;

    public ExpressionComplexityException(String metric, double actual, double limit) {
        super("Expression too complex: " + metric + " " + format(actual) + " exceeds limit " + format(limit));
        this.metric = metric;
        this.actual = actual;
        this.limit = limit;
    }

    public String getMetric() {
        return metric;
    }

    public double getActual() {
        return actual;
    }

    public double getLimit() {
        return limit;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}

package com.phillippitts.mathspeech.domain;

/**
 * Structural category assigned by the analyzer. Informational only; rule selection is driven
 * by domain and context, not by category.
 */
public enum ExpressionCategory {
    FRACTION,
    INTEGRAL,
    DERIVATIVE,
    LIMIT,
    SUM,
    PRODUCT,
    MATRIX,
    EQUATION,
    INEQUALITY,
    FUNCTION_CALL,
    SERIES,
    SIMPLE,
    COMPLEX
}

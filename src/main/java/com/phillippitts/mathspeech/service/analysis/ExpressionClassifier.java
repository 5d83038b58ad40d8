package com.phillippitts.mathspeech.service.analysis;

import com.phillippitts.mathspeech.domain.ExpressionCategory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Assigns a structural category by testing heuristics in a fixed order; the first one that
 * fires wins. Expressions matching none are SIMPLE or COMPLEX depending on size.
 */
public class ExpressionClassifier {

    static final int SIMPLE_MAX_COMMANDS = 3;
    static final int SIMPLE_MAX_LENGTH = 50;
    static final int SIMPLE_MAX_DEPTH = 2;

    private record Heuristic(ExpressionCategory category, Pattern pattern) {
    }

    private static final String END = "(?![a-zA-Z])";

    private static final List<Heuristic> ORDER = List.of(
            heuristic(ExpressionCategory.DERIVATIVE, "\\\\[dt]?frac\\{(?:d|\\\\partial)"),
            heuristic(ExpressionCategory.INTEGRAL, "\\\\i*o?int" + END),
            heuristic(ExpressionCategory.DERIVATIVE, "\\\\(?:partial|nabla)" + END),
            heuristic(ExpressionCategory.LIMIT, "\\\\lim(?:sup|inf)?" + END),
            heuristic(ExpressionCategory.SERIES, "\\\\sum" + END + ".*\\\\infty" + END),
            heuristic(ExpressionCategory.SUM, "\\\\sum" + END),
            heuristic(ExpressionCategory.PRODUCT, "\\\\prod" + END),
            heuristic(ExpressionCategory.MATRIX, "\\\\begin\\{(?:[pbvBV]?matrix|array)\\}"),
            heuristic(ExpressionCategory.FRACTION, "\\\\[dt]?frac" + END),
            heuristic(ExpressionCategory.INEQUALITY,
                    "[<>≤≥≠]|\\\\(?:leq?|geq?|neq?|lt|gt|ll|gg|leqslant|geqslant)" + END),
            heuristic(ExpressionCategory.FUNCTION_CALL,
                    "\\\\(?:sin|cos|tan|cot|sec|csc|arcsin|arccos|arctan|sinh|cosh|tanh|log|ln|exp)" + END
                            + "|(?<![\\\\a-zA-Z])[a-zA-Z]\\("),
            heuristic(ExpressionCategory.EQUATION, "=")
    );

    private static Heuristic heuristic(ExpressionCategory category, String regex) {
        return new Heuristic(category, Pattern.compile(regex, Pattern.DOTALL));
    }

    /**
     * @param expression    raw expression
     * @param distinctCommands number of distinct commands in the expression
     * @param nestingDepth  maximum brace depth
     * @return first matching category, otherwise SIMPLE or COMPLEX
     */
    public ExpressionCategory classify(String expression, int distinctCommands, int nestingDepth) {
        for (Heuristic h : ORDER) {
            if (h.pattern().matcher(expression).find()) {
                return h.category();
            }
        }
        boolean simple = distinctCommands <= SIMPLE_MAX_COMMANDS
                && expression.length() <= SIMPLE_MAX_LENGTH
                && nestingDepth <= SIMPLE_MAX_DEPTH;
        return simple ? ExpressionCategory.SIMPLE : ExpressionCategory.COMPLEX;
    }
}

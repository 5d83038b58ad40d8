package com.phillippitts.mathspeech.service.analysis;

import com.phillippitts.mathspeech.domain.ComplexityMetrics;
import com.phillippitts.mathspeech.domain.TokenInventory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts token inventories and computes {@link ComplexityMetrics}.
 *
 * <p>The overall score is a weighted sum of five factors, each normalized and capped at 1.0:
 * <pre>
 *   nesting depth / 5        x 2.5
 *   distinct commands / 10   x 2.0
 *   operators / 10           x 1.5
 *   special functions / 5    x 2.5
 *   length score             x 1.5
 * </pre>
 * The weights add up to 10, the score ceiling.
 */
public class ComplexityCalculator {

    static final double NESTING_WEIGHT = 2.5;
    static final double COMMAND_WEIGHT = 2.0;
    static final double OPERATOR_WEIGHT = 1.5;
    static final double FUNCTION_WEIGHT = 2.5;
    static final double LENGTH_WEIGHT = 1.5;

    private static final Pattern COMMAND = Pattern.compile("\\\\([a-zA-Z]+)");
    private static final Pattern VARIABLE = Pattern.compile("(?<![\\\\a-zA-Z])([a-zA-Z])(?![a-zA-Z])");
    private static final Pattern OPERATOR = Pattern.compile(
            "[+\\-*/=<>≤≥≠∈∉⊂⊆∪∩∧∨]"
                    + "|\\\\(?:cdot|times|div|pm|mp|leq?|geq?|neq?|in|notin|subset|subseteq|cup|cap"
                    + "|land|lor|to|approx|equiv)(?![a-zA-Z])");
    private static final Set<String> SPECIAL_FUNCTIONS = Set.of(
            "sin", "cos", "tan", "log", "ln", "exp", "sqrt", "lim", "int", "sum", "prod");

    /** Result of a brace scan. */
    public record Nesting(int maxDepth, List<String> warnings) {
    }

    public TokenInventory tokens(String expression) {
        Set<String> commands = new LinkedHashSet<>();
        Matcher cm = COMMAND.matcher(expression);
        while (cm.find()) {
            commands.add(cm.group(1));
        }
        Set<String> variables = new LinkedHashSet<>();
        Matcher vm = VARIABLE.matcher(expression);
        while (vm.find()) {
            variables.add(vm.group(1));
        }
        List<String> operators = new ArrayList<>();
        Matcher om = OPERATOR.matcher(expression);
        while (om.find()) {
            operators.add(om.group());
        }
        Set<String> functions = new LinkedHashSet<>();
        for (String command : commands) {
            if (SPECIAL_FUNCTIONS.contains(command)) {
                functions.add(command);
            }
        }
        return new TokenInventory(commands, variables, operators, functions);
    }

    /**
     * Scans brace balance. Escaped braces ({@code \{}, {@code \}}) are ignored. The running depth
     * never goes below zero; an unmatched closing brace and unclosed braces at the end each
     * produce a warning.
     */
    public Nesting nesting(String expression) {
        int depth = 0;
        int max = 0;
        int overClosed = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (i > 0 && expression.charAt(i - 1) == '\\') {
                continue;
            }
            if (c == '{') {
                depth++;
                max = Math.max(max, depth);
            } else if (c == '}') {
                if (depth == 0) {
                    overClosed++;
                } else {
                    depth--;
                }
            }
        }
        List<String> warnings = new ArrayList<>(2);
        if (overClosed > 0) {
            warnings.add("malformed nesting: " + overClosed + " unmatched closing brace(s)");
        }
        if (depth > 0) {
            warnings.add("malformed nesting: " + depth + " unclosed brace(s)");
        }
        return new Nesting(max, warnings);
    }

    public ComplexityMetrics metrics(String expression, TokenInventory tokens, int nestingDepth) {
        double lengthScore = Math.min(expression.length() / 100.0, 1.0);
        double score = capped(nestingDepth / 5.0) * NESTING_WEIGHT
                + capped(tokens.commands().size() / 10.0) * COMMAND_WEIGHT
                + capped(tokens.operators().size() / 10.0) * OPERATOR_WEIGHT
                + capped(tokens.functions().size() / 5.0) * FUNCTION_WEIGHT
                + lengthScore * LENGTH_WEIGHT;
        return new ComplexityMetrics(
                nestingDepth,
                tokens.commands().size(),
                tokens.variables().size(),
                tokens.operators().size(),
                tokens.functions().size(),
                lengthScore,
                Math.min(score, ComplexityMetrics.MAX_SCORE));
    }

    private static double capped(double factor) {
        return Math.min(factor, 1.0);
    }
}

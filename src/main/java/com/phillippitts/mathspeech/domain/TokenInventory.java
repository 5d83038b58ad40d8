package com.phillippitts.mathspeech.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tokens found in an expression. Sets preserve first-occurrence order.
 *
 * @param commands  distinct command names without the leading backslash
 * @param variables distinct single-letter variables outside commands
 * @param operators operator occurrences in source order
 * @param functions distinct special functions
 */
public record TokenInventory(
        Set<String> commands,
        Set<String> variables,
        List<String> operators,
        Set<String> functions
) {

    public static final TokenInventory EMPTY = new TokenInventory(Set.of(), Set.of(), List.of(), Set.of());

    public TokenInventory {
        Objects.requireNonNull(commands, "commands");
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(operators, "operators");
        Objects.requireNonNull(functions, "functions");
        commands = Collections.unmodifiableSet(new LinkedHashSet<>(commands));
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        operators = List.copyOf(operators);
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
    }
}

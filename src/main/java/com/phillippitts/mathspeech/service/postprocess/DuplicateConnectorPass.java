package com.phillippitts.mathspeech.service.postprocess;

import java.util.regex.Pattern;

/**
 * Collapses a connector word repeated back to back ("of of", "the The") into one occurrence.
 * Rule templates that end and begin with the same connector produce these seams.
 */
public class DuplicateConnectorPass implements TextPass {

    private static final Pattern REPEATED = Pattern.compile(
            "\\b(of|the|a|an|and|to|by|is|with|over|from|at|in)(?:\\s+\\1\\b)+",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "duplicate-connector";
    }

    @Override
    public String apply(String text) {
        return REPEATED.matcher(text).replaceAll("$1");
    }
}

package com.phillippitts.mathspeech.service.postprocess;

import java.util.regex.Pattern;

/** Collapses whitespace runs, trims, and removes spaces before punctuation. */
public class WhitespacePass implements TextPass {

    private static final Pattern RUNS = Pattern.compile("\\s+");
    private static final Pattern BEFORE_PUNCTUATION = Pattern.compile(" +([.,;:!?])");

    @Override
    public String name() {
        return "whitespace";
    }

    @Override
    public String apply(String text) {
        String collapsed = RUNS.matcher(text).replaceAll(" ").trim();
        return BEFORE_PUNCTUATION.matcher(collapsed).replaceAll("$1");
    }
}

package com.phillippitts.mathspeech.service.postprocess;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Runs text passes in a fixed order.
 *
 * <p>The whole list is repeated until the text is stable, so the chain is idempotent even where
 * one pass exposes work for an earlier one (a nested numeral marker unwraps one layer per round).
 * The standard passes always settle: whitespace and connector passes only shorten the text, and
 * every numeral expansion removes a marker without adding brackets. Custom passes that never
 * settle are cut off once the round count exceeds the input length.
 */
public class PostProcessorChain {

    private static final Logger LOG = LogManager.getLogger(PostProcessorChain.class);

    private final List<TextPass> passes;

    public PostProcessorChain(List<TextPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /** Whitespace, then duplicate connectors, then numerals. */
    public static PostProcessorChain standard() {
        return new PostProcessorChain(List.of(
                new WhitespacePass(),
                new DuplicateConnectorPass(),
                new NumeralPass()));
    }

    public String apply(String text) {
        String current = text;
        int limit = text.length() + 2;
        for (int round = 0; round < limit; round++) {
            String next = current;
            for (TextPass pass : passes) {
                next = pass.apply(next);
            }
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        LOG.warn("Post-processing did not settle after {} rounds", limit);
        return current;
    }

    public List<String> passNames() {
        return passes.stream().map(TextPass::name).toList();
    }
}

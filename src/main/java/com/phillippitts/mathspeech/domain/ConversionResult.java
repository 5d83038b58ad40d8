package com.phillippitts.mathspeech.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a conversion.
 *
 * @param speech          final speech text with pronunciation hints
 * @param appliedRules    rule ids in order of application
 * @param warnings        non-fatal findings (no rule matched, malformed nesting, pass ceiling)
 * @param elapsedMillis   wall-clock time spent on this request
 * @param cacheHit        true if the speech text came from the result cache
 * @param domain          domain used for rule selection
 * @param category        structural category
 * @param complexityScore overall complexity score in [0, 10]
 */
public record ConversionResult(
        SpeechText speech,
        List<String> appliedRules,
        List<String> warnings,
        long elapsedMillis,
        boolean cacheHit,
        MathDomain domain,
        ExpressionCategory category,
        double complexityScore
) {

    public ConversionResult {
        Objects.requireNonNull(speech, "Speech must not be null");
        appliedRules = appliedRules == null ? List.of() : List.copyOf(appliedRules);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        Objects.requireNonNull(domain, "Domain must not be null");
        Objects.requireNonNull(category, "Category must not be null");
        if (elapsedMillis < 0) {
            throw new IllegalArgumentException("Elapsed time must be >= 0, got: " + elapsedMillis);
        }
    }

    /** Convenience accessor for the plain speech text. */
    public String text() {
        return speech.text();
    }
}

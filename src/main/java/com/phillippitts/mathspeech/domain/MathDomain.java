package com.phillippitts.mathspeech.domain;

import java.util.Locale;

/**
 * Mathematical subject areas used to scope rewrite rules.
 *
 * <p>Declaration order doubles as the tie-break order for domain detection: when two domains
 * score the same number of indicator hits, the one declared first wins. {@link #GENERAL} is the
 * fallback and rules tagged with it are eligible for every expression.
 */
public enum MathDomain {
    CALCULUS,
    LINEAR_ALGEBRA,
    STATISTICS,
    SET_THEORY,
    LOGIC,
    NUMBER_THEORY,
    ALGEBRA,
    COMPLEX_ANALYSIS,
    TOPOLOGY,
    REAL_ANALYSIS,
    COMBINATORICS,
    DIFFERENTIAL_EQUATIONS,
    GENERAL;

    /**
     * Parses a domain tag such as {@code "linear_algebra"} or {@code "Linear-Algebra"}.
     *
     * @param tag domain tag, case-insensitive; hyphens and spaces are treated as underscores
     * @return matching domain
     * @throws IllegalArgumentException if the tag is blank or unknown
     */
    public static MathDomain fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Domain tag must not be blank");
        }
        String normalized = tag.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        try {
            return MathDomain.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown domain: " + tag, e);
        }
    }

    /** Lower-case tag used in rule files, logs and metric tags. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.phillippitts.mathspeech.domain;

import java.util.Locale;

/**
 * Intended listener sophistication. Carried through the pipeline and into the cache
 * fingerprint so that results for different audiences never collide.
 */
public enum AudienceLevel {
    ELEMENTARY,
    HIGH_SCHOOL,
    UNDERGRADUATE,
    GRADUATE,
    RESEARCH;

    /**
     * @param tag audience tag, case-insensitive ({@code "high_school"}, {@code "high-school"})
     * @return matching level
     * @throws IllegalArgumentException if the tag is blank or unknown
     */
    public static AudienceLevel fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Audience tag must not be blank");
        }
        String normalized = tag.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        try {
            return AudienceLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown audience level: " + tag, e);
        }
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

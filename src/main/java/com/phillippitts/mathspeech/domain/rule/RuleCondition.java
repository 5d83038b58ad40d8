package com.phillippitts.mathspeech.domain.rule;

import java.util.Locale;
import java.util.Objects;

/**
 * Extra predicate a match must satisfy before its rule may replace it.
 *
 * <ul>
 *   <li>{@code PRECEDING} - the value occurs in the window of text just before the match</li>
 *   <li>{@code FOLLOWING} - the value occurs in the window of text just after the match</li>
 *   <li>{@code CONTAINS} - the value occurs anywhere in the current text</li>
 * </ul>
 *
 * @param type   condition kind
 * @param value  substring looked for; must not be empty
 * @param negate invert the outcome
 */
public record RuleCondition(Type type, String value, boolean negate) {

    public enum Type {
        PRECEDING,
        FOLLOWING,
        CONTAINS;

        public static Type fromTag(String tag) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException("Condition type must not be blank");
            }
            try {
                return Type.valueOf(tag.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown condition type: " + tag, e);
            }
        }
    }

    public RuleCondition {
        Objects.requireNonNull(type, "Condition type must not be null");
        Objects.requireNonNull(value, "Condition value must not be null");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Condition value must not be empty");
        }
    }

    /**
     * Evaluates the condition for one match.
     *
     * @param text   current text being rewritten
     * @param start  match start offset
     * @param end    match end offset
     * @param window number of characters inspected on each side of the match
     * @return true if the match may be replaced
     */
    public boolean test(CharSequence text, int start, int end, int window) {
        boolean found = switch (type) {
            case PRECEDING -> indexOf(text, Math.max(0, start - window), start) >= 0;
            case FOLLOWING -> indexOf(text, end, Math.min(text.length(), end + window)) >= 0;
            case CONTAINS -> indexOf(text, 0, text.length()) >= 0;
        };
        return negate != found;
    }

    private int indexOf(CharSequence text, int from, int to) {
        if (to - from < value.length()) {
            return -1;
        }
        return text.subSequence(from, to).toString().indexOf(value);
    }
}

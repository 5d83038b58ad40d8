package com.phillippitts.mathspeech.domain.rule;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * How a rule finds its target: either a regular expression or a literal string.
 *
 * <p>Both kinds are compiled to a {@link Pattern} once, when the rule is built, so matching
 * code handles them uniformly. Literal specs define no capture groups besides the whole match.
 */
public final class MatchSpec {

    public enum Kind { REGEX, LITERAL }

    private final Kind kind;
    private final String pattern;
    private final Pattern compiled;

    private MatchSpec(Kind kind, String pattern) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.compiled = switch (kind) {
            case REGEX -> Pattern.compile(pattern);
            case LITERAL -> Pattern.compile(pattern, Pattern.LITERAL);
        };
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if the expression does not compile
     */
    public static MatchSpec regex(String pattern) {
        return new MatchSpec(Kind.REGEX, pattern);
    }

    public static MatchSpec literal(String text) {
        return new MatchSpec(Kind.LITERAL, text);
    }

    public static MatchSpec of(Kind kind, String pattern) {
        return new MatchSpec(kind, pattern);
    }

    public Kind kind() {
        return kind;
    }

    public String pattern() {
        return pattern;
    }

    public Pattern compiled() {
        return compiled;
    }

    /** Number of capture groups, not counting group 0. */
    public int groupCount() {
        return compiled.matcher("").groupCount();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchSpec other)) {
            return false;
        }
        return kind == other.kind && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, pattern);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + pattern;
    }
}

package com.phillippitts.mathspeech.domain.rule;

import com.phillippitts.mathspeech.domain.AudienceLevel;
import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.exception.InvalidRuleException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Declarative rewrite rule: when {@link #match()} finds text in a matching domain and context,
 * the match is replaced by {@link #outputTemplate()} with its placeholders filled in.
 *
 * <p>Structural constraints (priority range, placeholder references) are enforced by
 * {@code RuleValidator} when the rule enters a store.
 *
 * @param id                 unique, stable identifier
 * @param match              pattern and how to interpret it
 * @param outputTemplate     replacement text with {@code ${name}} and {@code $N} placeholders
 * @param priority           0..2000, higher rules are applied first
 * @param domain             domain the rule belongs to; {@link MathDomain#GENERAL} applies everywhere
 * @param contexts           context tags, lower-case; {@value #ANY_CONTEXT} matches every context
 * @param audiences          listener levels the rule is meant for; empty means every level
 * @param conditions         additional predicates evaluated per match
 * @param active             inactive rules are never selected
 * @param pronunciationHints optional prosody hints, may be null
 * @param description        free text for logs, may be null
 */
public record Rule(
        String id,
        MatchSpec match,
        String outputTemplate,
        int priority,
        MathDomain domain,
        Set<String> contexts,
        Set<AudienceLevel> audiences,
        List<RuleCondition> conditions,
        boolean active,
        PronunciationHints pronunciationHints,
        String description
) {

    public static final String ANY_CONTEXT = "any";
    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 2000;

    public Rule {
        Objects.requireNonNull(id, "Rule id must not be null");
        Objects.requireNonNull(match, "Match spec must not be null");
        Objects.requireNonNull(outputTemplate, "Output template must not be null");
        domain = domain == null ? MathDomain.GENERAL : domain;
        contexts = normalizeContexts(contexts);
        audiences = audiences == null || audiences.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(audiences));
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /** True if this rule is eligible for an expression of the given domain and context. */
    public boolean appliesTo(MathDomain expressionDomain, String context) {
        if (!active) {
            return false;
        }
        if (domain != MathDomain.GENERAL && domain != expressionDomain) {
            return false;
        }
        return matchesContext(context);
    }

    public boolean matchesContext(String context) {
        return contexts.contains(ANY_CONTEXT)
                || (context != null && contexts.contains(context.toLowerCase(Locale.ROOT)));
    }

    /** True if the rule has no audience restriction or lists the given level. */
    public boolean matchesAudience(AudienceLevel audience) {
        return audiences.isEmpty() || audiences.contains(audience);
    }

    public Rule withActive(boolean newActive) {
        return new Rule(id, match, outputTemplate, priority, domain, contexts, audiences, conditions,
                newActive, pronunciationHints, description);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id)
                .match(match)
                .template(outputTemplate)
                .priority(priority)
                .domain(domain)
                .active(active)
                .hints(pronunciationHints)
                .description(description);
        contexts.forEach(builder::context);
        audiences.forEach(builder::audience);
        conditions.forEach(builder::condition);
        return builder;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    private static Set<String> normalizeContexts(Set<String> contexts) {
        if (contexts == null || contexts.isEmpty()) {
            return Set.of(ANY_CONTEXT);
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String c : contexts) {
            if (c != null && !c.isBlank()) {
                normalized.add(c.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized.isEmpty() ? Set.of(ANY_CONTEXT) : Collections.unmodifiableSet(normalized);
    }

    /**
     * Fluent builder used by the rule loader and by tests.
     */
    public static final class Builder {
        private final String id;
        private MatchSpec match;
        private MatchSpec.Kind kind = MatchSpec.Kind.REGEX;
        private String pattern;
        private String template;
        private int priority = 500;
        private MathDomain domain = MathDomain.GENERAL;
        private final Set<String> contexts = new LinkedHashSet<>();
        private final Set<AudienceLevel> audiences = EnumSet.noneOf(AudienceLevel.class);
        private final List<RuleCondition> conditions = new ArrayList<>();
        private boolean active = true;
        private PronunciationHints hints;
        private String description;

        private Builder(String id) {
            this.id = id;
        }

        public Builder regex(String regex) {
            this.kind = MatchSpec.Kind.REGEX;
            this.pattern = regex;
            this.match = null;
            return this;
        }

        public Builder literal(String text) {
            this.kind = MatchSpec.Kind.LITERAL;
            this.pattern = text;
            this.match = null;
            return this;
        }

        public Builder match(MatchSpec spec) {
            this.match = spec;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder domain(MathDomain domain) {
            this.domain = domain;
            return this;
        }

        public Builder context(String context) {
            this.contexts.add(context);
            return this;
        }

        public Builder audience(AudienceLevel audience) {
            this.audiences.add(audience);
            return this;
        }

        public Builder condition(RuleCondition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder hints(PronunciationHints hints) {
            this.hints = hints;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @throws InvalidRuleException if id, pattern or template is missing or the pattern does not compile
         */
        public Rule build() {
            if (id == null || id.isBlank()) {
                throw new InvalidRuleException("Rule id is required", String.valueOf(id));
            }
            if (template == null) {
                throw new InvalidRuleException("Output template is required", id);
            }
            MatchSpec spec = match;
            if (spec == null) {
                if (pattern == null || pattern.isEmpty()) {
                    throw new InvalidRuleException("Pattern is required", id);
                }
                try {
                    spec = MatchSpec.of(kind, pattern);
                } catch (PatternSyntaxException e) {
                    throw new InvalidRuleException("Pattern does not compile: " + e.getDescription(), id, e);
                }
            }
            return new Rule(id, spec, template, priority, domain, contexts, audiences, conditions, active, hints,
                    description);
        }
    }
}

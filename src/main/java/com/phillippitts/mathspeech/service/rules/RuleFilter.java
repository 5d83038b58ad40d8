package com.phillippitts.mathspeech.service.rules;

import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.rule.Rule;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compound lookup criteria. Null fields are not applied.
 *
 * @param domains     accepted domains
 * @param contexts    accepted contexts; a rule matches if it lists any of them or the wildcard
 * @param minPriority inclusive lower bound
 * @param maxPriority inclusive upper bound
 * @param active      required active flag
 */
public record RuleFilter(
        Set<MathDomain> domains,
        Set<String> contexts,
        Integer minPriority,
        Integer maxPriority,
        Boolean active
) {

    public static final RuleFilter ALL = new RuleFilter(null, null, null, null, null);

    public RuleFilter {
        domains = domains == null ? null : Set.copyOf(domains);
        contexts = contexts == null ? null : Set.copyOf(contexts);
        if (minPriority != null && maxPriority != null && minPriority > maxPriority) {
            throw new IllegalArgumentException(
                    "minPriority must be <= maxPriority, got: " + minPriority + " > " + maxPriority);
        }
    }

    public boolean test(Rule rule) {
        if (domains != null && !domains.contains(rule.domain())) {
            return false;
        }
        if (contexts != null && contexts.stream().noneMatch(rule::matchesContext)) {
            return false;
        }
        if (minPriority != null && rule.priority() < minPriority) {
            return false;
        }
        if (maxPriority != null && rule.priority() > maxPriority) {
            return false;
        }
        return active == null || rule.active() == active;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Set<MathDomain> domains;
        private Set<String> contexts;
        private Integer minPriority;
        private Integer maxPriority;
        private Boolean active;

        public Builder domains(MathDomain... values) {
            this.domains = Set.of(values);
            return this;
        }

        public Builder contexts(String... values) {
            this.contexts = Arrays.stream(values)
                    .map(v -> v.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
            return this;
        }

        public Builder minPriority(int value) {
            this.minPriority = value;
            return this;
        }

        public Builder maxPriority(int value) {
            this.maxPriority = value;
            return this;
        }

        public Builder active(boolean value) {
            this.active = value;
            return this;
        }

        public RuleFilter build() {
            return new RuleFilter(domains, contexts, minPriority, maxPriority, active);
        }
    }
}

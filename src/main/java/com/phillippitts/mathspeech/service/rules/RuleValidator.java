package com.phillippitts.mathspeech.service.rules;

import com.phillippitts.mathspeech.domain.rule.MatchSpec;
import com.phillippitts.mathspeech.domain.rule.Rule;
import com.phillippitts.mathspeech.exception.InvalidRuleException;
import com.phillippitts.mathspeech.service.transform.TemplateRenderer;
import com.phillippitts.mathspeech.service.transform.TemplateRenderer.Placeholder;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural checks applied to every rule before it enters a store.
 *
 * <p>A rule is valid when:
 * <ul>
 *   <li>its id is not blank</li>
 *   <li>its pattern is not empty (compilation is checked when the rule is built)</li>
 *   <li>its priority lies in [{@value Rule#MIN_PRIORITY}, {@value Rule#MAX_PRIORITY}]</li>
 *   <li>every template placeholder refers to a group the pattern defines</li>
 * </ul>
 */
public final class RuleValidator {

    // Named group openings preceded by an even run of backslashes; "(?<=" and "(?<!" do not match.
    private static final Pattern NAMED_GROUP =
            Pattern.compile("(?<!\\\\)(?:\\\\\\\\)*\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private RuleValidator() {
    }

    /**
     * @throws InvalidRuleException describing the first violation found
     */
    public static void validate(Rule rule) {
        String id = rule.id();
        if (id.isBlank()) {
            throw new InvalidRuleException("Rule id must not be blank", id);
        }
        if (rule.match().pattern().isEmpty()) {
            throw new InvalidRuleException("Pattern must not be empty", id);
        }
        if (rule.priority() < Rule.MIN_PRIORITY || rule.priority() > Rule.MAX_PRIORITY) {
            throw new InvalidRuleException("Priority must be between " + Rule.MIN_PRIORITY + " and "
                    + Rule.MAX_PRIORITY + ", got: " + rule.priority(), id);
        }
        validatePlaceholders(rule);
    }

    /** Names of the named groups the rule's pattern defines. Literal rules define none. */
    static Set<String> namedGroups(Rule rule) {
        Set<String> names = new LinkedHashSet<>();
        if (rule.match().kind() == MatchSpec.Kind.LITERAL) {
            return names;
        }
        Matcher m = NAMED_GROUP.matcher(rule.match().pattern());
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    private static void validatePlaceholders(Rule rule) {
        int groupCount = rule.match().groupCount();
        Set<String> named = namedGroups(rule);
        for (Placeholder placeholder : TemplateRenderer.placeholders(rule.outputTemplate())) {
            if (placeholder.isNamed() && !named.contains(placeholder.name())) {
                throw new InvalidRuleException("Template placeholder " + placeholder
                        + " references an undefined group", rule.id());
            }
            if (!placeholder.isNamed() && placeholder.index() > groupCount) {
                throw new InvalidRuleException("Template placeholder " + placeholder
                        + " exceeds group count " + groupCount, rule.id());
            }
        }
    }
}

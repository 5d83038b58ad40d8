package com.phillippitts.mathspeech.service.rules;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.phillippitts.mathspeech.domain.AudienceLevel;
import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.rule.MatchSpec;
import com.phillippitts.mathspeech.domain.rule.PronunciationHints;
import com.phillippitts.mathspeech.domain.rule.Rule;
import com.phillippitts.mathspeech.domain.rule.RuleCondition;
import com.phillippitts.mathspeech.exception.InvalidRuleException;
import com.phillippitts.mathspeech.exception.RuleDefinitionException;
import com.phillippitts.mathspeech.service.rules.RuleDefinition.ConditionDefinition;
import com.phillippitts.mathspeech.service.rules.RuleDefinition.HintsDefinition;
import com.phillippitts.mathspeech.service.rules.RuleDefinition.RuleFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;

/**
 * Loads rewrite rules from YAML files.
 *
 * <p>File format:
 * <pre>
 * rules:
 *   - id: fraction_half
 *     pattern: '\frac{1}{2}'
 *     match_type: literal          # regex (default) or literal
 *     output_template: one half
 *     priority: 1550
 *     domain: general
 *     contexts: [any]
 *     audience: [elementary]     # optional, one tag or a list; omitted means every audience
 *     conditions:
 *       - {type: preceding, value: '\vec', negate: false}
 *     pronunciation_hints: {pause_after: 100}
 * </pre>
 *
 * <p>Loading is all-or-nothing: the first invalid record aborts with an exception naming the
 * file and the rule, so a broken catalogue is caught at startup rather than at conversion time.
 */
public class YamlRuleLoader {

    private static final Logger LOG = LogManager.getLogger(YamlRuleLoader.class);

    private final ObjectMapper mapper;
    private final ResourcePatternResolver resolver;

    public YamlRuleLoader() {
        this(new PathMatchingResourcePatternResolver());
    }

    public YamlRuleLoader(ResourcePatternResolver resolver) {
        this.resolver = resolver;
        this.mapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads every resource matching the given location patterns, in pattern order and,
     * within a pattern, in file name order.
     *
     * @param locations Spring resource patterns such as {@code classpath*:rules/*.yaml}
     * @return rules in load order
     * @throws RuleDefinitionException if a file cannot be read or contains an invalid record
     */
    public List<Rule> load(List<String> locations) {
        List<Rule> rules = new ArrayList<>();
        for (String location : locations) {
            Resource[] resources;
            try {
                resources = resolver.getResources(location);
            } catch (IOException e) {
                throw new RuleDefinitionException("Failed to resolve rule location " + location, e);
            }
            Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));
            if (resources.length == 0) {
                LOG.warn("No rule files found at {}", location);
            }
            for (Resource resource : resources) {
                rules.addAll(load(resource));
            }
        }
        LOG.info("Loaded {} rules from {}", rules.size(), locations);
        return rules;
    }

    /**
     * Loads a single rule file.
     *
     * @throws RuleDefinitionException if the file cannot be read or contains an invalid record
     */
    public List<Rule> load(Resource resource) {
        String source = resource.getFilename();
        RuleFile file;
        try (InputStream in = resource.getInputStream()) {
            file = mapper.readValue(in, RuleFile.class);
        } catch (IOException e) {
            throw new RuleDefinitionException("Failed to read rule file " + source, e);
        }
        if (file == null || file.rules() == null) {
            LOG.warn("Rule file {} contains no rules", source);
            return List.of();
        }
        List<Rule> rules = new ArrayList<>(file.rules().size());
        for (RuleDefinition definition : file.rules()) {
            Rule rule = toRule(definition, source);
            try {
                RuleValidator.validate(rule);
            } catch (InvalidRuleException e) {
                LOG.error("Invalid rule in {}: {}", source, e.getMessage());
                throw e;
            }
            rules.add(rule);
        }
        LOG.debug("Loaded {} rules from {}", rules.size(), source);
        return rules;
    }

    private Rule toRule(RuleDefinition def, String source) {
        String id = def.id();
        if (id == null || id.isBlank()) {
            throw new InvalidRuleException("Rule id is required in " + source, String.valueOf(id));
        }
        if (def.pattern() == null || def.pattern().isEmpty()) {
            throw new InvalidRuleException("pattern is required in " + source, id);
        }
        if (def.outputTemplate() == null) {
            throw new InvalidRuleException("output_template is required in " + source, id);
        }
        if (def.priority() == null) {
            throw new InvalidRuleException("priority is required in " + source, id);
        }
        if (def.domain() == null || def.domain().isBlank()) {
            throw new InvalidRuleException("domain is required in " + source, id);
        }
        if (def.contexts() == null || def.contexts().isEmpty()) {
            throw new InvalidRuleException("contexts is required in " + source, id);
        }
        try {
            Rule.Builder builder = Rule.builder(id)
                    .template(def.outputTemplate())
                    .priority(def.priority())
                    .domain(MathDomain.fromTag(def.domain()))
                    .active(def.active() == null || def.active())
                    .hints(toHints(def.pronunciationHints()))
                    .description(def.description());
            builder.match(MatchSpec.of(matchKind(def.matchType()), def.pattern()));
            def.contexts().forEach(builder::context);
            if (def.audience() != null) {
                def.audience().forEach(tag -> builder.audience(AudienceLevel.fromTag(tag)));
            }
            if (def.conditions() != null) {
                for (ConditionDefinition c : def.conditions()) {
                    if (c.value() == null) {
                        throw new InvalidRuleException("condition value is required in " + source, id);
                    }
                    builder.condition(new RuleCondition(RuleCondition.Type.fromTag(c.type()), c.value(),
                            Boolean.TRUE.equals(c.negate())));
                }
            }
            return builder.build();
        } catch (PatternSyntaxException e) {
            throw new InvalidRuleException("Pattern does not compile in " + source + ": " + e.getDescription(), id, e);
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException(e.getMessage() + " in " + source, id, e);
        }
    }

    private static MatchSpec.Kind matchKind(String tag) {
        if (tag == null || tag.isBlank()) {
            return MatchSpec.Kind.REGEX;
        }
        return MatchSpec.Kind.valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }

    private static PronunciationHints toHints(HintsDefinition def) {
        if (def == null) {
            return null;
        }
        return new PronunciationHints(def.emphasis(), def.pauseBefore(), def.pauseAfter(),
                def.rate(), def.pitch(), def.volume());
    }
}

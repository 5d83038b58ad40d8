package com.phillippitts.mathspeech.service.rules;

import com.phillippitts.mathspeech.domain.AudienceLevel;
import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.rule.MatchSpec;
import com.phillippitts.mathspeech.domain.rule.Rule;
import com.phillippitts.mathspeech.domain.rule.RuleCondition;
import com.phillippitts.mathspeech.exception.InvalidRuleException;
import com.phillippitts.mathspeech.exception.RuleDefinitionException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlRuleLoaderTest {

    private final YamlRuleLoader loader = new YamlRuleLoader();

    @Test
    void shouldLoadEveryField() {
        List<Rule> rules = loader.load(new ClassPathResource("rules-test/valid.yaml"));

        assertThat(rules).extracting(Rule::id).containsExactly("test_half", "test_dot", "test_disabled");

        Rule half = rules.get(0);
        assertThat(half.match().kind()).isEqualTo(MatchSpec.Kind.LITERAL);
        assertThat(half.match().pattern()).isEqualTo("\\frac{1}{2}");
        assertThat(half.domain()).isEqualTo(MathDomain.GENERAL);
        assertThat(half.contexts()).containsExactly(Rule.ANY_CONTEXT);
        assertThat(half.audiences()).containsExactly(AudienceLevel.ELEMENTARY);

        Rule dot = rules.get(1);
        assertThat(dot.domain()).isEqualTo(MathDomain.LINEAR_ALGEBRA);
        assertThat(dot.contexts()).containsExactly("physics", "engineering");
        assertThat(dot.conditions()).containsExactly(
                new RuleCondition(RuleCondition.Type.PRECEDING, "\\vec", false),
                new RuleCondition(RuleCondition.Type.CONTAINS, "\\matrix", true));
        assertThat(dot.pronunciationHints().pauseBeforeMs()).isEqualTo(50);
        assertThat(dot.pronunciationHints().pauseAfterMs()).isEqualTo(100);
        assertThat(dot.pronunciationHints().rate()).isEqualTo(0.9);

        assertThat(dot.audiences()).isEmpty();

        assertThat(rules.get(2).active()).isFalse();
        assertThat(rules.get(2).audiences()).containsExactlyInAnyOrder(AudienceLevel.HIGH_SCHOOL, AudienceLevel.GRADUATE);
    }

    @Test
    void missingPriorityShouldNameFileAndRule() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("rules-test/missing-priority.yaml")))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("priority is required")
                .hasMessageContaining("missing-priority.yaml")
                .hasMessageContaining("rule: no_priority");
    }

    @Test
    void missingDomainShouldBeRejected() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("rules-test/missing-domain.yaml")))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("domain is required")
                .hasMessageContaining("missing-domain.yaml")
                .hasMessageContaining("rule: no_domain");
    }

    @Test
    void missingContextsShouldBeRejected() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("rules-test/missing-contexts.yaml")))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("contexts is required")
                .hasMessageContaining("rule: no_contexts");
    }

    @Test
    void emptyContextListShouldBeRejected() {
        ByteArrayResource yaml = yaml("""
                rules:
                  - id: nowhere
                    pattern: 'x'
                    output_template: 'y'
                    priority: 5
                    domain: general
                    contexts: []
                """);

        assertThatThrownBy(() -> loader.load(yaml))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("contexts is required");
    }

    @Test
    void unknownAudienceShouldBeRejected() {
        ByteArrayResource yaml = yaml("""
                rules:
                  - id: toddler_only
                    pattern: 'x'
                    output_template: 'y'
                    priority: 5
                    domain: general
                    contexts: [any]
                    audience: toddler
                """);

        assertThatThrownBy(() -> loader.load(yaml))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("toddler");
    }

    @Test
    void uncompilablePatternShouldBeRejected() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("rules-test/bad-pattern.yaml")))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("does not compile")
                .hasMessageContaining("rule: unclosed_group");
    }

    @Test
    void undefinedPlaceholderShouldBeRejected() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("rules-test/bad-placeholder.yaml")))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("${radicand}");
    }

    @Test
    void unknownDomainShouldBeRejected() {
        ByteArrayResource yaml = yaml("""
                rules:
                  - id: astro
                    pattern: 'x'
                    output_template: 'y'
                    priority: 5
                    domain: astrology
                    contexts: [any]
                """);

        assertThatThrownBy(() -> loader.load(yaml))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("astrology");
    }

    @Test
    void emptyFileShouldYieldNoRules() {
        assertThat(loader.load(new ClassPathResource("rules-test/empty.yaml"))).isEmpty();
    }

    @Test
    void malformedYamlShouldBeReportedAsDefinitionError() {
        ByteArrayResource yaml = yaml("rules: [ {id: broken, pattern: 'x'");

        assertThatThrownBy(() -> loader.load(yaml))
                .isInstanceOf(RuleDefinitionException.class)
                .hasMessageContaining("Failed to read rule file");
    }

    @Test
    void locationsWithoutMatchesShouldBeSkipped() {
        List<Rule> rules = loader.load(List.of("classpath:rules-test/valid.yaml", "classpath*:rules-test/none-*.yaml"));

        assertThat(rules).hasSize(3);
    }

    @Test
    void defaultCatalogueShouldLoadIntoAStore() {
        List<Rule> rules = loader.load(List.of("classpath*:rules/*.yaml"));
        InMemoryRuleStore store = new InMemoryRuleStore(rules);

        assertThat(store.count()).isEqualTo(rules.size()).isGreaterThan(50);
        assertThat(store.getById("fraction_half")).isPresent();
        assertThat(store.findByDomain(MathDomain.CALCULUS)).isNotEmpty();
    }

    private static ByteArrayResource yaml(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "inline.yaml";
            }
        };
    }
}

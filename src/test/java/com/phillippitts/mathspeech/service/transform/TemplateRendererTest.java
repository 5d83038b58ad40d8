package com.phillippitts.mathspeech.service.transform;

import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private static Matcher matched(String regex, String input) {
        Matcher m = Pattern.compile(regex).matcher(input);
        assertThat(m.find()).isTrue();
        return m;
    }

    @Test
    void shouldSubstituteNamedAndPositionalGroups() {
        Matcher m = matched("\\\\frac\\{(?<num>[^{}]+)\\}\\{([^{}]+)\\}", "\\frac{a}{b}");

        assertThat(TemplateRenderer.render("${num} over $2", m)).isEqualTo("a over b");
        assertThat(TemplateRenderer.render("[$0]", m)).isEqualTo("[\\frac{a}{b}]");
    }

    @Test
    void unmatchedGroupsShouldRenderEmpty() {
        Matcher m = matched("\\\\sin(?:\\((?<arg>[^()]+)\\)|(?<sym>[a-z]))", "\\sinx");
        assertThat(TemplateRenderer.render("sine of ${arg}${sym}", m)).isEqualTo("sine of x");
    }

    @Test
    void doubleDollarShouldBeALiteralDollar() {
        Matcher m = matched("(\\d+)", "price 12");

        assertThat(TemplateRenderer.render("$$$1", m)).isEqualTo("$12");
    }

    @Test
    void groupTextShouldNotBeReinterpreted() {
        Matcher m = matched("(?<v>.+)", "${v} $1");

        assertThat(TemplateRenderer.render("<${v}>", m)).isEqualTo("<${v} $1>");
    }

    @Test
    void placeholdersShouldBeListedInOrder() {
        assertThat(TemplateRenderer.placeholders("${a} and $2 cost $$3"))
                .extracting(TemplateRenderer.Placeholder::toString)
                .containsExactly("${a}", "$2");
    }
}

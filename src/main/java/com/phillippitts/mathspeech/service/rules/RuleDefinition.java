package com.phillippitts.mathspeech.service.rules;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Rule record as written in a YAML rule file. Property names are snake_case in the file.
 * Converted to a {@code Rule} by {@link YamlRuleLoader}. {@code audience} takes one tag or a list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RuleDefinition(
        String id,
        String description,
        String pattern,
        String matchType,
        String outputTemplate,
        Integer priority,
        String domain,
        List<String> contexts,
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> audience,
        List<ConditionDefinition> conditions,
        HintsDefinition pronunciationHints,
        Boolean active
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConditionDefinition(String type, String value, Boolean negate) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HintsDefinition(
            String emphasis,
            Integer pauseBefore,
            Integer pauseAfter,
            Double rate,
            Double pitch,
            Double volume
    ) {
    }

    /** Top-level document: {@code rules:} followed by a list of records. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleFile(List<RuleDefinition> rules) {
    }
}

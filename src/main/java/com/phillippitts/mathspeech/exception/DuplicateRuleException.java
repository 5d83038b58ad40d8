package com.phillippitts.mathspeech.exception;

/** Thrown when adding a rule whose id is already stored. */
public class DuplicateRuleException extends RuleDefinitionException {

    public DuplicateRuleException(String ruleId) {
        super("Rule already exists", ruleId);
    }
}

package com.phillippitts.mathspeech.exception;

/** Thrown when updating or deleting a rule id that is not stored. */
public class RuleNotFoundException extends RuleDefinitionException {

    public RuleNotFoundException(String ruleId) {
        super("Rule not found", ruleId);
    }
}

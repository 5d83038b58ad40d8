package com.phillippitts.mathspeech.exception;

/**
 * Thrown when a rule definition violates a structural constraint: missing field,
 * priority out of range, uncompilable pattern or a template placeholder without a group.
 */
public class InvalidRuleException extends RuleDefinitionException {

    public InvalidRuleException(String message, String ruleId) {
        super(message, ruleId);
    }

    public InvalidRuleException(String message, String ruleId, Throwable cause) {
        super(message, ruleId, cause);
    }
}

package com.phillippitts.mathspeech.exception;

/**
 * Thrown when a rewrite rule cannot be loaded, stored or looked up.
 * Subclasses distinguish invalid definitions, duplicate ids and missing ids.
 */
public class RuleDefinitionException extends MathSpeechException {

    private final String ruleId;

    public RuleDefinitionException(String message) {
        super(message);
        this.ruleId = "unknown";
    }

    public RuleDefinitionException(String message, String ruleId) {
        super(message + " (rule: " + ruleId + ")");
        this.ruleId = ruleId;
    }

    public RuleDefinitionException(String message, Throwable cause) {
        super(message, cause);
        this.ruleId = "unknown";
    }

    public RuleDefinitionException(String message, String ruleId, Throwable cause) {
        super(message + " (rule: " + ruleId + ")", cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}

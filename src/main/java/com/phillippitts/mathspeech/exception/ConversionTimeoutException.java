package com.phillippitts.mathspeech.exception;

/**
 * Thrown when a conversion does not finish within its wall-clock budget. Raised from inside
 * regular expression evaluation so that catastrophic backtracking cannot stall a worker.
 */
public class ConversionTimeoutException extends MathSpeechException {

    private final long timeoutMs;
    private final String ruleId;

    public ConversionTimeoutException(long timeoutMs) {
        super("Conversion exceeded timeout of " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
        this.ruleId = null;
    }

    public ConversionTimeoutException(long timeoutMs, String ruleId) {
        super("Conversion exceeded timeout of " + timeoutMs + "ms (rule: " + ruleId + ")");
        this.timeoutMs = timeoutMs;
        this.ruleId = ruleId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * @return id of the rule being evaluated when the deadline passed, or null if unknown
     */
    public String getRuleId() {
        return ruleId;
    }
}

package com.phillippitts.mathspeech.exception;

/**
 * Thrown when an input expression is rejected before analysis: empty input, input over the
 * configured length, embedded null bytes or a command that is not allowed.
 */
public class InvalidExpressionException extends MathSpeechException {

    private final int expressionLength;
    private final String reason;

    public InvalidExpressionException(String reason) {
        super("Invalid expression: " + reason);
        this.expressionLength = 0;
        this.reason = reason;
    }

    public InvalidExpressionException(int expressionLength, String reason) {
        super("Invalid expression (" + expressionLength + " chars): " + reason);
        this.expressionLength = expressionLength;
        this.reason = reason;
    }

    public int getExpressionLength() {
        return expressionLength;
    }

    public String getReason() {
        return reason;
    }
}

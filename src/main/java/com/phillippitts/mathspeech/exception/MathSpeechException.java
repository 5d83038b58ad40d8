package com.phillippitts.mathspeech.exception;

/**
 * Base exception for all mathspeech application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MathSpeechException extends RuntimeException {

    public MathSpeechException(String message) {
        super(message);
    }

    public MathSpeechException(String message, Throwable cause) {
        super(message, cause);
    }

    public MathSpeechException(Throwable cause) {
        super(cause);
    }
}

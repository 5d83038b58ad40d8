package com.phillippitts.mathspeech.service.conversion;

import com.phillippitts.mathspeech.domain.ConversionRequest;
import com.phillippitts.mathspeech.domain.ConversionResult;
import com.phillippitts.mathspeech.exception.MathSpeechException;

import java.util.Objects;

/**
 * Outcome of one request in a batch: exactly one of result and error is set.
 */
public record BatchItem(ConversionRequest request, ConversionResult result, MathSpeechException error) {

    public BatchItem {
        Objects.requireNonNull(request, "request");
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static BatchItem success(ConversionRequest request, ConversionResult result) {
        return new BatchItem(request, result, null);
    }

    public static BatchItem failure(ConversionRequest request, MathSpeechException error) {
        return new BatchItem(request, null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}

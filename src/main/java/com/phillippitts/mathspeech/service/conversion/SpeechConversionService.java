package com.phillippitts.mathspeech.service.conversion;

import com.phillippitts.mathspeech.domain.ConversionRequest;
import com.phillippitts.mathspeech.domain.ConversionResult;
import com.phillippitts.mathspeech.exception.ConversionTimeoutException;
import com.phillippitts.mathspeech.exception.ExpressionComplexityException;
import com.phillippitts.mathspeech.exception.InvalidExpressionException;

import java.util.List;

/**
 * Converts mathematical expressions into speech text.
 *
 * <p>Pipeline: validate, analyze, fingerprint, cache lookup, complexity gate, transform,
 * post-process, cache write. A cache hit skips everything after the lookup.
 *
 * <p><b>Error Handling:</b>
 * <ul>
 *   <li>{@link InvalidExpressionException} - input rejected before analysis</li>
 *   <li>{@link ExpressionComplexityException} - nesting depth or score over the ceiling</li>
 *   <li>{@link ConversionTimeoutException} - rule evaluation overran its budget</li>
 * </ul>
 * No-match, malformed nesting and the pass ceiling are reported as warnings on the result.
 *
 * <p>Implementations must be thread-safe.
 */
public interface SpeechConversionService {

    /**
     * Converts one expression.
     *
     * @param request expression with audience, context and optional domain hint
     * @return speech text and processing metadata
     */
    ConversionResult convert(ConversionRequest request);

    /**
     * Converts several expressions concurrently. Failures are captured per item; one bad
     * expression does not fail the batch.
     *
     * @param requests expressions to convert
     * @return one item per request, in request order
     */
    List<BatchItem> convertBatch(List<ConversionRequest> requests);
}

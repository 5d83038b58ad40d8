package com.phillippitts.mathspeech.service.analysis;

import com.phillippitts.mathspeech.domain.ConversionRequest;
import com.phillippitts.mathspeech.domain.ExpressionRecord;

/**
 * Computes structural metadata for an expression without rewriting it.
 *
 * <p>Analysis is best-effort and never fails on malformed input: unbalanced braces and similar
 * defects become warnings on the returned record so that the transformer always receives a
 * usable record.
 *
 * <p>Implementations must be stateless and thread-safe.
 */
public interface ExpressionAnalyzer {

    /**
     * Creates and analyzes a record for the request.
     *
     * @param request validated request
     * @return analyzed record with domain, category, metrics and token inventories set
     */
    ExpressionRecord analyze(ConversionRequest request);
}

/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so callers can handle
 * conversion failures uniformly.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mathspeech.exception.MathSpeechException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.mathspeech.exception.InvalidExpressionException} - Thrown when
 *       input fails validation (empty, too long, null bytes, disallowed commands)</li>
 *   <li>{@link com.phillippitts.mathspeech.exception.ExpressionComplexityException} - Thrown when
 *       nesting depth or complexity score exceeds the configured ceiling</li>
 *   <li>{@link com.phillippitts.mathspeech.exception.ConversionTimeoutException} - Thrown when
 *       rule evaluation runs past its wall-clock budget</li>
 *   <li>{@link com.phillippitts.mathspeech.exception.RuleDefinitionException} - Thrown for rule
 *       load and store failures, with {@code InvalidRuleException}, {@code DuplicateRuleException}
 *       and {@code RuleNotFoundException} as subtypes</li>
 * </ul>
 *
 * <p>Conditions that still yield usable output (no rule matched, malformed nesting, pass
 * ceiling reached) are reported as warnings on the result, not as exceptions.
 *
 * @see com.phillippitts.mathspeech.exception.MathSpeechException
 * @since 1.0
 */
package com.phillippitts.mathspeech.exception;

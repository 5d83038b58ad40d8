package com.phillippitts.mathspeech.domain;

import com.phillippitts.mathspeech.exception.InvalidExpressionException;

import java.util.Locale;
import java.util.Objects;

/**
 * Input to a conversion.
 *
 * @param expression raw LaTeX-style expression (must not be null)
 * @param audience   listener level, defaults to {@link AudienceLevel#UNDERGRADUATE}
 * @param context    context tag used for rule selection, lower-cased, defaults to {@value #DEFAULT_CONTEXT}
 * @param domainHint caller-supplied domain that bypasses detection, may be null
 */
public record ConversionRequest(
        String expression,
        AudienceLevel audience,
        String context,
        MathDomain domainHint
) {

    public static final String DEFAULT_CONTEXT = "general";

    public ConversionRequest {
        Objects.requireNonNull(expression, "Expression must not be null");
        audience = audience == null ? AudienceLevel.UNDERGRADUATE : audience;
        context = context == null || context.isBlank()
                ? DEFAULT_CONTEXT
                : context.trim().toLowerCase(Locale.ROOT);
    }

    public static ConversionRequest of(String expression) {
        return new ConversionRequest(expression, null, null, null);
    }

    public static ConversionRequest of(String expression, String context) {
        return new ConversionRequest(expression, null, context, null);
    }

    /**
     * Builds a request from caller-supplied tags.
     *
     * @param audienceTag audience tag, null or blank for the default
     * @param domainTag   domain hint tag, null or blank for detection
     * @throws InvalidExpressionException if either tag is unknown
     */
    public static ConversionRequest fromTags(String expression, String audienceTag, String context, String domainTag) {
        try {
            AudienceLevel audience = audienceTag == null || audienceTag.isBlank()
                    ? null
                    : AudienceLevel.fromTag(audienceTag);
            MathDomain domain = domainTag == null || domainTag.isBlank() ? null : MathDomain.fromTag(domainTag);
            return new ConversionRequest(expression, audience, context, domain);
        } catch (IllegalArgumentException e) {
            throw new InvalidExpressionException(e.getMessage());
        }
    }
}

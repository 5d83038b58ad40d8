package com.phillippitts.mathspeech.service.cache;

import com.phillippitts.mathspeech.domain.SpeechText;

import java.util.List;
import java.util.Objects;

/**
 * What the result cache keeps for a conversion: the final speech text and the trace needed to
 * rebuild a result without re-running the rules.
 */
public record CachedConversion(SpeechText speech, List<String> appliedRules, List<String> warnings) {

    public CachedConversion {
        Objects.requireNonNull(speech, "speech");
        appliedRules = List.copyOf(appliedRules);
        warnings = List.copyOf(warnings);
    }
}

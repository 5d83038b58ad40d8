package com.phillippitts.mathspeech.domain;

import com.phillippitts.mathspeech.domain.rule.PronunciationHints;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Speech-ready text with the prosody hints of the rules that produced it.
 *
 * @param text  pronounceable text
 * @param hints rule id to hints, in order of first application; rules without hints are absent
 */
public record SpeechText(String text, Map<String, PronunciationHints> hints) {

    public SpeechText {
        Objects.requireNonNull(text, "Speech text must not be null");
        hints = hints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hints));
    }

    public static SpeechText of(String text) {
        return new SpeechText(text, Map.of());
    }

    public SpeechText withText(String newText) {
        return new SpeechText(newText, hints);
    }
}

package com.phillippitts.mathspeech.domain.rule;

/**
 * Optional prosody hints attached to a rule. The engine does not interpret them; they are
 * passed through to the speech synthesis collaborator for every rule that fired.
 *
 * @param emphasis      emphasis level name (e.g. "strong", "moderate"), or null
 * @param pauseBeforeMs pause before the rule's output in milliseconds, or null
 * @param pauseAfterMs  pause after the rule's output in milliseconds, or null
 * @param rate          speaking rate multiplier, or null
 * @param pitch         pitch multiplier, or null
 * @param volume        volume multiplier, or null
 */
public record PronunciationHints(
        String emphasis,
        Integer pauseBeforeMs,
        Integer pauseAfterMs,
        Double rate,
        Double pitch,
        Double volume
) {

    public PronunciationHints {
        if (pauseBeforeMs != null && pauseBeforeMs < 0) {
            throw new IllegalArgumentException("pauseBeforeMs must be >= 0, got: " + pauseBeforeMs);
        }
        if (pauseAfterMs != null && pauseAfterMs < 0) {
            throw new IllegalArgumentException("pauseAfterMs must be >= 0, got: " + pauseAfterMs);
        }
        requirePositive("rate", rate);
        requirePositive("pitch", pitch);
        requirePositive("volume", volume);
    }

    public boolean isEmpty() {
        return emphasis == null && pauseBeforeMs == null && pauseAfterMs == null
                && rate == null && pitch == null && volume == null;
    }

    private static void requirePositive(String name, Double value) {
        if (value != null && value <= 0.0) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
    }
}

package com.phillippitts.mathspeech.domain;

/**
 * One replacement made by a rule. Offsets are relative to the text the pass started from.
 *
 * @param ruleId id of the rule that produced the replacement
 * @param pass   1-based pass number
 * @param start  inclusive start offset in the pass input
 * @param end    exclusive end offset in the pass input
 */
public record RuleApplication(String ruleId, int pass, int start, int end) {

    public RuleApplication {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("Rule id must not be blank");
        }
        if (pass < 1) {
            throw new IllegalArgumentException("Pass must be >= 1, got: " + pass);
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public boolean overlaps(RuleApplication other) {
        return pass == other.pass && start < other.end && other.start < end;
    }
}

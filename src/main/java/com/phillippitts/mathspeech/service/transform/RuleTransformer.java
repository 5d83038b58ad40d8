package com.phillippitts.mathspeech.service.transform;

import com.phillippitts.mathspeech.domain.ExpressionRecord;
import com.phillippitts.mathspeech.domain.ProcessingMetadata;
import com.phillippitts.mathspeech.domain.RuleApplication;
import com.phillippitts.mathspeech.domain.SpeechText;
import com.phillippitts.mathspeech.domain.rule.PronunciationHints;
import com.phillippitts.mathspeech.domain.rule.Rule;
import com.phillippitts.mathspeech.domain.rule.RuleCondition;
import com.phillippitts.mathspeech.exception.ConversionTimeoutException;
import com.phillippitts.mathspeech.service.rules.RuleStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;

/**
 * Applies rewrite rules to an analyzed expression.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Candidates are the active rules whose domain is the expression's domain or GENERAL and
 *       whose contexts include the expression's context or the wildcard. Rules restricted to
 *       particular audiences are skipped for other listeners.</li>
 *   <li>Candidates are ordered by priority descending, then id ascending.</li>
 *   <li>In each pass every candidate, in order, replaces all of its occurrences that lie
 *       entirely in text no earlier rule of the same pass has claimed. Conditions are checked
 *       per occurrence. All replacements of a pass are spliced in at the end of the pass.</li>
 *   <li>Passes repeat until a pass leaves the text unchanged or the pass ceiling is reached;
 *       hitting the ceiling is a warning.</li>
 *   <li>If no rule ever matched, the input is returned unchanged with a
 *       {@value #NO_MATCH_WARNING} warning.</li>
 * </ol>
 *
 * <p>Every regular expression evaluation runs against a deadline; overrunning it raises
 * {@link ConversionTimeoutException}.
 *
 * <p>Thread-safe: all per-call state lives on the stack and in the caller's record.
 */
public class RuleTransformer {

    public static final String NO_MATCH_WARNING = "no rule matched";

    private static final Logger LOG = LogManager.getLogger(RuleTransformer.class);

    static final Comparator<Rule> APPLICATION_ORDER =
            Comparator.comparingInt(Rule::priority).reversed().thenComparing(Rule::id);

    private final RuleStore ruleStore;
    private final int maxPasses;
    private final long timeoutMs;
    private final int conditionWindow;

    public RuleTransformer(RuleStore ruleStore, int maxPasses, long timeoutMs, int conditionWindow) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be >= 1, got: " + maxPasses);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0, got: " + timeoutMs);
        }
        if (conditionWindow < 0) {
            throw new IllegalArgumentException("conditionWindow must be >= 0, got: " + conditionWindow);
        }
        this.ruleStore = ruleStore;
        this.maxPasses = maxPasses;
        this.timeoutMs = timeoutMs;
        this.conditionWindow = conditionWindow;
    }

    /**
     * Transforms the record's raw text, writing applied rules, spans, warnings and the pass
     * count into its processing metadata.
     *
     * @param record analyzed expression record
     * @return transformed text with the hints of the rules that fired
     * @throws ConversionTimeoutException if the wall-clock budget is exceeded
     */
    public SpeechText transform(ExpressionRecord record) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        ProcessingMetadata metadata = record.metadata();
        List<Rule> candidates = candidates(record);
        Map<String, PronunciationHints> hints = new LinkedHashMap<>();

        String text = record.rawText();
        boolean matched = false;
        boolean changedOnLastPass = false;
        int pass = 0;
        while (pass < maxPasses) {
            pass++;
            PassOutcome outcome = runPass(text, candidates, pass, deadline, metadata, hints);
            matched |= outcome.replacements() > 0;
            changedOnLastPass = !outcome.text().equals(text);
            text = outcome.text();
            if (!changedOnLastPass) {
                break;
            }
        }
        metadata.setPasses(pass);

        if (!matched) {
            metadata.addWarning(NO_MATCH_WARNING);
            LOG.debug("No rule matched among {} candidates", candidates.size());
            return SpeechText.of(record.rawText());
        }
        if (changedOnLastPass && pass == maxPasses) {
            metadata.addWarning("pass ceiling reached (" + maxPasses + ")");
            LOG.warn("Pass ceiling {} reached; returning partially transformed text", maxPasses);
        }
        LOG.debug("Transformed in {} pass(es), applied rules {}", pass, metadata.appliedRules());
        return new SpeechText(text, hints);
    }

    /** Eligible rules for the record in application order. */
    List<Rule> candidates(ExpressionRecord record) {
        List<Rule> eligible = new ArrayList<>();
        for (Rule rule : ruleStore.getAll()) {
            if (rule.appliesTo(record.domain(), record.context()) && rule.matchesAudience(record.audience())) {
                eligible.add(rule);
            }
        }
        eligible.sort(APPLICATION_ORDER);
        return eligible;
    }

    private record Replacement(int start, int end, String text) {
    }

    private record PassOutcome(String text, int replacements) {
    }

    private PassOutcome runPass(String input, List<Rule> candidates, int pass, long deadline,
                                ProcessingMetadata metadata, Map<String, PronunciationHints> hints) {
        TreeMap<Integer, Replacement> claims = new TreeMap<>();
        Set<String> firedThisPass = new HashSet<>();

        for (Rule rule : candidates) {
            DeadlineCharSequence guarded = new DeadlineCharSequence(input, deadline, timeoutMs, rule.id());
            guarded.checkDeadline();
            Matcher m = rule.match().compiled().matcher(guarded);
            m.useTransparentBounds(true);
            m.useAnchoringBounds(false);

            List<Replacement> found = new ArrayList<>();
            for (int[] gap : freeRegions(claims, input.length())) {
                m.region(gap[0], gap[1]);
                while (m.find()) {
                    if (m.start() == m.end() || !conditionsHold(rule, input, m.start(), m.end())) {
                        continue;
                    }
                    found.add(new Replacement(m.start(), m.end(), TemplateRenderer.render(rule.outputTemplate(), m)));
                }
            }
            for (Replacement r : found) {
                claims.put(r.start(), r);
                metadata.recordApplication(new RuleApplication(rule.id(), pass, r.start(), r.end()),
                        firedThisPass.add(rule.id()));
            }
            if (!found.isEmpty() && rule.pronunciationHints() != null && !rule.pronunciationHints().isEmpty()) {
                hints.putIfAbsent(rule.id(), rule.pronunciationHints());
            }
        }

        if (claims.isEmpty()) {
            return new PassOutcome(input, 0);
        }
        StringBuilder out = new StringBuilder(input.length() + 32);
        int last = 0;
        for (Replacement r : claims.values()) {
            out.append(input, last, r.start()).append(r.text());
            last = r.end();
        }
        out.append(input, last, input.length());
        return new PassOutcome(out.toString(), claims.size());
    }

    private boolean conditionsHold(Rule rule, CharSequence text, int start, int end) {
        for (RuleCondition condition : rule.conditions()) {
            if (!condition.test(text, start, end, conditionWindow)) {
                return false;
            }
        }
        return true;
    }

    /** Unclaimed [start, end) regions between the claimed spans, in order. */
    private static List<int[]> freeRegions(TreeMap<Integer, Replacement> claims, int length) {
        List<int[]> regions = new ArrayList<>(claims.size() + 1);
        int cursor = 0;
        for (Replacement r : claims.values()) {
            if (r.start() > cursor) {
                regions.add(new int[] {cursor, r.start()});
            }
            cursor = Math.max(cursor, r.end());
        }
        if (cursor < length) {
            regions.add(new int[] {cursor, length});
        }
        return regions;
    }
}

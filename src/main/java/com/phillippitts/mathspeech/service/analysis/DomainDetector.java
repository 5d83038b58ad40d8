package com.phillippitts.mathspeech.service.analysis;

import com.phillippitts.mathspeech.domain.MathDomain;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores each domain by counting occurrences of its indicator tokens and picks the best one.
 *
 * <p>Highest non-zero score wins; ties go to the domain declared first in {@link MathDomain}.
 * If nothing scores the result is {@link MathDomain#GENERAL}.
 */
public class DomainDetector {

    // Command names must not continue with a letter: "\in" must not hit "\int" or "\infty".
    private static final String END = "(?![a-zA-Z])";

    private static final Map<MathDomain, List<Pattern>> INDICATORS = new EnumMap<>(MathDomain.class);

    static {
        indicators(MathDomain.CALCULUS,
                "\\\\int" + END, "\\\\oint" + END, "\\\\iint" + END, "\\\\frac\\{d", "\\\\partial" + END,
                "\\\\lim" + END, "\\\\nabla" + END, "\\\\infty" + END, "\\\\prime" + END);
        indicators(MathDomain.LINEAR_ALGEBRA,
                "\\\\begin\\{[pbvBV]?matrix\\}", "\\\\det" + END, "\\\\vec" + END, "\\\\mathbf" + END,
                "\\\\cdot" + END, "\\\\times" + END, "\\\\otimes" + END, "\\\\operatorname\\{(?:tr|rank)\\}");
        indicators(MathDomain.STATISTICS,
                "\\\\mathbb\\{[PE]\\}", "\\\\(?:text|operatorname)\\{(?:Var|Cov)\\}", "\\\\sim" + END,
                "\\\\bar" + END, "\\\\hat" + END, "\\\\sigma" + END, "\\\\mu" + END, "\\\\chi" + END);
        indicators(MathDomain.SET_THEORY,
                "\\\\in" + END, "\\\\notin" + END, "\\\\subset" + END, "\\\\subseteq" + END, "\\\\cup" + END,
                "\\\\cap" + END, "\\\\emptyset" + END, "\\\\varnothing" + END, "\\\\setminus" + END);
        indicators(MathDomain.LOGIC,
                "\\\\forall" + END, "\\\\exists" + END, "\\\\land" + END, "\\\\lor" + END, "\\\\neg" + END,
                "\\\\implies" + END, "\\\\iff" + END, "\\\\Rightarrow" + END, "\\\\vdash" + END,
                "\\\\models" + END);
        indicators(MathDomain.NUMBER_THEORY,
                "\\\\pmod" + END, "\\\\bmod" + END, "\\\\equiv" + END, "\\\\gcd" + END, "\\\\mid" + END,
                "\\\\mathbb\\{Z\\}");
        indicators(MathDomain.ALGEBRA,
                "\\\\sqrt" + END, "\\\\frac" + END, "\\\\pm" + END, "\\\\mp" + END);
        indicators(MathDomain.COMPLEX_ANALYSIS,
                "\\\\overline" + END, "\\\\Re" + END, "\\\\Im" + END, "\\\\arg" + END, "\\\\mathbb\\{C\\}");
        indicators(MathDomain.TOPOLOGY,
                "\\\\mathcal" + END, "\\\\mathring" + END, "\\\\cong" + END, "\\\\simeq" + END,
                "\\\\operatorname\\{(?:int|cl)\\}");
        indicators(MathDomain.REAL_ANALYSIS,
                "\\\\sup" + END, "\\\\inf" + END, "\\\\limsup" + END, "\\\\liminf" + END,
                "\\\\epsilon" + END, "\\\\varepsilon" + END, "\\\\delta" + END, "\\\\mathbb\\{R\\}");
        indicators(MathDomain.COMBINATORICS,
                "\\\\binom" + END, "\\\\dbinom" + END, "\\\\choose" + END, "[a-zA-Z0-9}]!");
        indicators(MathDomain.DIFFERENTIAL_EQUATIONS,
                "\\\\frac\\{d\\^", "(?<![\\\\a-zA-Z])[a-zA-Z]'+", "\\\\dot\\{", "\\\\ddot\\{");
    }

    private static void indicators(MathDomain domain, String... regexes) {
        INDICATORS.put(domain, Arrays.stream(regexes).map(Pattern::compile).toList());
    }

    /**
     * @return the best-scoring domain, or GENERAL if no indicator occurs
     */
    public MathDomain detect(String expression) {
        Map<MathDomain, Integer> scores = score(expression);
        MathDomain best = MathDomain.GENERAL;
        int bestScore = 0;
        // EnumMap iterates in declaration order, so strict '>' keeps the earlier domain on ties.
        for (Map.Entry<MathDomain, Integer> entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return best;
    }

    /** Indicator hit counts for every domain with at least one hit. */
    public Map<MathDomain, Integer> score(String expression) {
        Map<MathDomain, Integer> scores = new EnumMap<>(MathDomain.class);
        for (Map.Entry<MathDomain, List<Pattern>> entry : INDICATORS.entrySet()) {
            int hits = 0;
            for (Pattern indicator : entry.getValue()) {
                Matcher m = indicator.matcher(expression);
                while (m.find()) {
                    hits++;
                }
            }
            if (hits > 0) {
                scores.put(entry.getKey(), hits);
            }
        }
        return scores;
    }
}

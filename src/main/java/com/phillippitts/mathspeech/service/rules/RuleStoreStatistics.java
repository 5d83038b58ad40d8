package com.phillippitts.mathspeech.service.rules;

import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.rule.Rule;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot counts over the rules in a store.
 *
 * @param total     number of rules
 * @param active    number of active rules
 * @param byDomain  rule count per domain, domains without rules omitted
 * @param byBand    rule count per priority band, every band present
 * @param byContext rule count per context tag
 */
public record RuleStoreStatistics(
        int total,
        int active,
        Map<MathDomain, Integer> byDomain,
        Map<PriorityBand, Integer> byBand,
        Map<String, Integer> byContext
) {

    /** Priority bands: critical >= 1500, high >= 1000, medium >= 500, low below. */
    public enum PriorityBand {
        CRITICAL(1500),
        HIGH(1000),
        MEDIUM(500),
        LOW(0);

        private final int floor;

        PriorityBand(int floor) {
            this.floor = floor;
        }

        public int floor() {
            return floor;
        }

        public static PriorityBand of(int priority) {
            for (PriorityBand band : values()) {
                if (priority >= band.floor) {
                    return band;
                }
            }
            return LOW;
        }
    }

    public RuleStoreStatistics {
        byDomain = Map.copyOf(byDomain);
        byBand = Map.copyOf(byBand);
        byContext = Map.copyOf(byContext);
    }

    static RuleStoreStatistics of(Iterable<Rule> rules) {
        int total = 0;
        int active = 0;
        Map<MathDomain, Integer> byDomain = new EnumMap<>(MathDomain.class);
        Map<PriorityBand, Integer> byBand = new LinkedHashMap<>();
        for (PriorityBand band : PriorityBand.values()) {
            byBand.put(band, 0);
        }
        Map<String, Integer> byContext = new TreeMap<>();
        for (Rule rule : rules) {
            total++;
            if (rule.active()) {
                active++;
            }
            byDomain.merge(rule.domain(), 1, Integer::sum);
            byBand.merge(PriorityBand.of(rule.priority()), 1, Integer::sum);
            rule.contexts().forEach(c -> byContext.merge(c, 1, Integer::sum));
        }
        return new RuleStoreStatistics(total, active, byDomain, byBand, byContext);
    }
}

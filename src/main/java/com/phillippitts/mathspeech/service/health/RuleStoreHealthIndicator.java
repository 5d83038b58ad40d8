package com.phillippitts.mathspeech.service.health;

import com.phillippitts.mathspeech.service.rules.RuleStore;
import com.phillippitts.mathspeech.service.rules.RuleStoreStatistics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when the rule store holds no active rules, since every conversion would then
 * pass its input through unchanged.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RuleStoreHealthIndicator implements HealthIndicator {

    private final RuleStore ruleStore;

    public RuleStoreHealthIndicator(RuleStore ruleStore) {
        this.ruleStore = ruleStore;
    }

    @Override
    public Health health() {
        RuleStoreStatistics stats = ruleStore.getStatistics();
        Health.Builder builder = stats.active() > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("status", stats.active() > 0 ? "Rules loaded" : "No active rules loaded")
                .withDetail("totalRules", stats.total())
                .withDetail("activeRules", stats.active())
                .withDetail("byBand", stats.byBand())
                .build();
    }
}

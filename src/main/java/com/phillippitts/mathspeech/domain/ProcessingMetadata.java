package com.phillippitts.mathspeech.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable trace of a single conversion. Owned by one request and written only by the
 * transformer and the conversion service, so it is not thread-safe.
 */
public final class ProcessingMetadata {

    private final List<String> appliedRules = new ArrayList<>();
    private final List<RuleApplication> applications = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private long elapsedMillis;
    private boolean cacheHit;
    private int passes;

    public void recordApplication(RuleApplication application, boolean firstInPass) {
        applications.add(application);
        if (firstInPass) {
            appliedRules.add(application.ruleId());
        }
    }

    public void addWarning(String warning) {
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    public List<String> appliedRules() {
        return Collections.unmodifiableList(appliedRules);
    }

    public List<RuleApplication> applications() {
        return Collections.unmodifiableList(applications);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public long elapsedMillis() {
        return elapsedMillis;
    }

    public void setElapsedMillis(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
    }

    public boolean cacheHit() {
        return cacheHit;
    }

    public void setCacheHit(boolean cacheHit) {
        this.cacheHit = cacheHit;
    }

    public int passes() {
        return passes;
    }

    public void setPasses(int passes) {
        this.passes = passes;
    }
}

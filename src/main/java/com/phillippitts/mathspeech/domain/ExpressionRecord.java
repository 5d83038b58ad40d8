package com.phillippitts.mathspeech.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-request working record for one expression.
 *
 * <p>Input fields are fixed at construction. Derived fields are written once by the analyzer
 * through {@link #applyAnalysis}; processing metadata is written by the transformer and the
 * conversion service. A record belongs to a single request and is discarded with the response.
 */
public final class ExpressionRecord {

    private final String rawText;
    private final AudienceLevel audience;
    private final String context;
    private final MathDomain domainHint;
    private final ProcessingMetadata metadata = new ProcessingMetadata();
    private final List<String> analysisWarnings = new ArrayList<>();

    private MathDomain domain;
    private ExpressionCategory category;
    private ComplexityMetrics metrics;
    private TokenInventory tokens = TokenInventory.EMPTY;
    private boolean analyzed;

    public ExpressionRecord(String rawText, AudienceLevel audience, String context, MathDomain domainHint) {
        this.rawText = Objects.requireNonNull(rawText, "Expression text must not be null");
        this.audience = Objects.requireNonNull(audience, "Audience must not be null");
        this.context = Objects.requireNonNull(context, "Context must not be null");
        this.domainHint = domainHint;
    }

    /**
     * Stores analyzer output. May be called only once.
     *
     * @throws IllegalStateException if the record was already analyzed
     */
    public void applyAnalysis(MathDomain domain, ExpressionCategory category, ComplexityMetrics metrics,
                              TokenInventory tokens, List<String> warnings) {
        if (analyzed) {
            throw new IllegalStateException("Expression already analyzed");
        }
        this.domain = Objects.requireNonNull(domain, "domain");
        this.category = Objects.requireNonNull(category, "category");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.analysisWarnings.addAll(warnings);
        warnings.forEach(metadata::addWarning);
        this.analyzed = true;
    }

    public String rawText() {
        return rawText;
    }

    public AudienceLevel audience() {
        return audience;
    }

    public String context() {
        return context;
    }

    public Optional<MathDomain> domainHint() {
        return Optional.ofNullable(domainHint);
    }

    /** Domain used for rule selection: the hint when given, otherwise the detected domain. */
    public MathDomain domain() {
        requireAnalyzed();
        return domain;
    }

    public ExpressionCategory category() {
        requireAnalyzed();
        return category;
    }

    public ComplexityMetrics metrics() {
        requireAnalyzed();
        return metrics;
    }

    public TokenInventory tokens() {
        return tokens;
    }

    public List<String> analysisWarnings() {
        return Collections.unmodifiableList(analysisWarnings);
    }

    public ProcessingMetadata metadata() {
        return metadata;
    }

    public boolean isAnalyzed() {
        return analyzed;
    }

    private void requireAnalyzed() {
        if (!analyzed) {
            throw new IllegalStateException("Expression has not been analyzed");
        }
    }
}

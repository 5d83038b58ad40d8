package com.phillippitts.mathspeech.service.analysis;

import com.phillippitts.mathspeech.domain.ComplexityMetrics;
import com.phillippitts.mathspeech.domain.ConversionRequest;
import com.phillippitts.mathspeech.domain.ExpressionCategory;
import com.phillippitts.mathspeech.domain.ExpressionRecord;
import com.phillippitts.mathspeech.domain.MathDomain;
import com.phillippitts.mathspeech.domain.TokenInventory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Analyzer composed of a {@link DomainDetector}, an {@link ExpressionClassifier} and a
 * {@link ComplexityCalculator}. A domain hint on the request skips detection.
 */
public class DefaultExpressionAnalyzer implements ExpressionAnalyzer {

    private static final Logger LOG = LogManager.getLogger(DefaultExpressionAnalyzer.class);

    private final DomainDetector domainDetector;
    private final ExpressionClassifier classifier;
    private final ComplexityCalculator calculator;

    public DefaultExpressionAnalyzer() {
        this(new DomainDetector(), new ExpressionClassifier(), new ComplexityCalculator());
    }

    public DefaultExpressionAnalyzer(DomainDetector domainDetector,
                                     ExpressionClassifier classifier,
                                     ComplexityCalculator calculator) {
        this.domainDetector = domainDetector;
        this.classifier = classifier;
        this.calculator = calculator;
    }

    @Override
    public ExpressionRecord analyze(ConversionRequest request) {
        ExpressionRecord record = new ExpressionRecord(
                request.expression(), request.audience(), request.context(), request.domainHint());
        String text = request.expression();

        MathDomain domain = request.domainHint() != null
                ? request.domainHint()
                : domainDetector.detect(text);
        TokenInventory tokens = calculator.tokens(text);
        ComplexityCalculator.Nesting nesting = calculator.nesting(text);
        ComplexityMetrics metrics = calculator.metrics(text, tokens, nesting.maxDepth());
        ExpressionCategory category = classifier.classify(text, tokens.commands().size(), nesting.maxDepth());

        record.applyAnalysis(domain, category, metrics, tokens, nesting.warnings());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Analyzed expression: domain={} (hint={}), category={}, depth={}, score={}, level={}",
                    domain.tag(), request.domainHint() != null, category, metrics.nestingDepth(),
                    String.format("%.2f", metrics.overallScore()), metrics.level());
        }
        return record;
    }
}

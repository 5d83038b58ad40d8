package com.phillippitts.mathspeech.service.conversion;

import com.phillippitts.mathspeech.config.properties.ConversionProperties;
import com.phillippitts.mathspeech.domain.ComplexityMetrics;
import com.phillippitts.mathspeech.domain.ConversionRequest;
import com.phillippitts.mathspeech.domain.ConversionResult;
import com.phillippitts.mathspeech.domain.ExpressionRecord;
import com.phillippitts.mathspeech.domain.ProcessingMetadata;
import com.phillippitts.mathspeech.domain.SpeechText;
import com.phillippitts.mathspeech.exception.ConversionTimeoutException;
import com.phillippitts.mathspeech.exception.ExpressionComplexityException;
import com.phillippitts.mathspeech.exception.InvalidExpressionException;
import com.phillippitts.mathspeech.exception.MathSpeechException;
import com.phillippitts.mathspeech.service.analysis.ExpressionAnalyzer;
import com.phillippitts.mathspeech.service.cache.CachedConversion;
import com.phillippitts.mathspeech.service.cache.FingerprintGenerator;
import com.phillippitts.mathspeech.service.cache.ResultCache;
import com.phillippitts.mathspeech.service.metrics.ConversionMetrics;
import com.phillippitts.mathspeech.service.postprocess.PostProcessorChain;
import com.phillippitts.mathspeech.service.transform.RuleTransformer;
import com.phillippitts.mathspeech.service.validation.ExpressionValidator;
import com.phillippitts.mathspeech.util.LogSanitizer;
import com.phillippitts.mathspeech.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link SpeechConversionService}.
 *
 * <p>Each call sets the Log4j2 ThreadContext keys {@code conversionId} and {@code fingerprint}
 * for the duration of the conversion. Batch items run on the supplied executor, which is
 * expected to propagate the ThreadContext to its workers.
 */
public class DefaultSpeechConversionService implements SpeechConversionService {

    private static final Logger LOG = LogManager.getLogger(DefaultSpeechConversionService.class);

    static final String CONVERSION_ID_KEY = "conversionId";
    static final String FINGERPRINT_KEY = "fingerprint";

    private final ExpressionValidator validator;
    private final ExpressionAnalyzer analyzer;
    private final RuleTransformer transformer;
    private final PostProcessorChain postProcessor;
    private final ResultCache<CachedConversion> cache;
    private final ConversionMetrics metrics;
    private final ConversionProperties props;
    private final Executor executor;

    /**
     * @param cache    result cache, or null to disable caching
     * @param executor executor for batch conversions
     */
    public DefaultSpeechConversionService(ExpressionValidator validator,
                                          ExpressionAnalyzer analyzer,
                                          RuleTransformer transformer,
                                          PostProcessorChain postProcessor,
                                          ResultCache<CachedConversion> cache,
                                          ConversionMetrics metrics,
                                          ConversionProperties props,
                                          Executor executor) {
        this.validator = Objects.requireNonNull(validator);
        this.analyzer = Objects.requireNonNull(analyzer);
        this.transformer = Objects.requireNonNull(transformer);
        this.postProcessor = Objects.requireNonNull(postProcessor);
        this.cache = cache;
        this.metrics = Objects.requireNonNull(metrics);
        this.props = Objects.requireNonNull(props);
        this.executor = Objects.requireNonNull(executor);
    }

    @Override
    public ConversionResult convert(ConversionRequest request) {
        Objects.requireNonNull(request, "request");
        long t0 = System.nanoTime();
        ThreadContext.put(CONVERSION_ID_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            ConversionResult result = doConvert(request, t0);
            metrics.recordLatency(result.domain().tag(), System.nanoTime() - t0);
            metrics.incrementSuccess(result.cacheHit());
            LOG.info("Converted expression in {} ms (domain={}, rules={}, cacheHit={})",
                    result.elapsedMillis(), result.domain().tag(), result.appliedRules().size(), result.cacheHit());
            return result;
        } catch (MathSpeechException e) {
            metrics.incrementFailure(failureReason(e));
            LOG.warn("Conversion failed for '{}': {}", LogSanitizer.preview(request.expression()), e.getMessage());
            throw e;
        } finally {
            ThreadContext.remove(CONVERSION_ID_KEY);
            ThreadContext.remove(FINGERPRINT_KEY);
        }
    }

    private ConversionResult doConvert(ConversionRequest raw, long t0) {
        validator.validate(raw.expression());
        // the pipeline sees exactly the text the fingerprint is built from
        ConversionRequest request = new ConversionRequest(FingerprintGenerator.normalize(raw.expression()),
                raw.audience(), raw.context(), raw.domainHint());
        ExpressionRecord record = analyzer.analyze(request);

        String fingerprint = FingerprintGenerator.fingerprint(
                request.expression(), request.audience(), request.context(), record.domain());
        ThreadContext.put(FINGERPRINT_KEY, fingerprint.substring(0, 12));

        if (cache != null) {
            Optional<CachedConversion> cached = cache.get(fingerprint);
            if (cached.isPresent()) {
                LOG.debug("Cache hit");
                return toResult(record, cached.get(), true, TimeUtils.elapsedMillis(t0));
            }
        }

        enforceComplexityLimits(record);

        ProcessingMetadata metadata = record.metadata();
        SpeechText speech = transformer.transform(record);
        if (metadata.warnings().contains(RuleTransformer.NO_MATCH_WARNING)) {
            metrics.incrementNoMatch();
            LOG.info("No rule matched '{}'", LogSanitizer.preview(request.expression()));
        } else {
            speech = speech.withText(postProcessor.apply(speech.text()));
        }
        if (!record.metrics().isSuitableFor(request.audience())) {
            metadata.addWarning("complexity above " + request.audience().tag() + " level");
        }

        CachedConversion conversion = new CachedConversion(speech, metadata.appliedRules(), metadata.warnings());
        if (cache != null) {
            cache.put(fingerprint, conversion);
        }
        return toResult(record, conversion, false, TimeUtils.elapsedMillis(t0));
    }

    private void enforceComplexityLimits(ExpressionRecord record) {
        ComplexityMetrics m = record.metrics();
        if (m.nestingDepth() > props.getMaxNestingDepth()) {
            throw new ExpressionComplexityException("nesting depth", m.nestingDepth(), props.getMaxNestingDepth());
        }
        if (m.overallScore() > props.getMaxComplexityScore()) {
            throw new ExpressionComplexityException("complexity score", m.overallScore(),
                    props.getMaxComplexityScore());
        }
    }

    private static ConversionResult toResult(ExpressionRecord record, CachedConversion conversion,
                                             boolean cacheHit, long elapsedMs) {
        ProcessingMetadata metadata = record.metadata();
        metadata.setCacheHit(cacheHit);
        metadata.setElapsedMillis(elapsedMs);
        return new ConversionResult(
                conversion.speech(),
                conversion.appliedRules(),
                conversion.warnings(),
                elapsedMs,
                cacheHit,
                record.domain(),
                record.category(),
                record.metrics().overallScore());
    }

    @Override
    public List<BatchItem> convertBatch(List<ConversionRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        if (requests.isEmpty()) {
            return List.of();
        }
        long t0 = System.nanoTime();
        List<CompletableFuture<BatchItem>> futures = new ArrayList<>(requests.size());
        for (ConversionRequest request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> convertCapturing(request), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(props.getBatchTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Batch of {} timed out after {} ms", requests.size(), props.getBatchTimeoutMs());
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
        } catch (ExecutionException ee) {
            // Unexpected failures are reported per item below
            LOG.error("Unexpected batch failure", ee.getCause());
        }

        List<BatchItem> items = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            items.add(collect(requests.get(i), futures.get(i)));
        }
        long failed = items.stream().filter(item -> !item.isSuccess()).count();
        LOG.info("Converted batch of {} in {} ms ({} failed)", items.size(), TimeUtils.elapsedMillis(t0), failed);
        return items;
    }

    private BatchItem convertCapturing(ConversionRequest request) {
        try {
            return BatchItem.success(request, convert(request));
        } catch (MathSpeechException e) {
            return BatchItem.failure(request, e);
        }
    }

    private BatchItem collect(ConversionRequest request, CompletableFuture<BatchItem> future) {
        if (!future.isDone() || future.isCancelled()) {
            return BatchItem.failure(request, new ConversionTimeoutException(props.getBatchTimeoutMs()));
        }
        try {
            return future.join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return BatchItem.failure(request, new MathSpeechException("Unexpected conversion failure", cause));
        }
    }

    private static String failureReason(MathSpeechException e) {
        if (e instanceof InvalidExpressionException) {
            return "validation";
        }
        if (e instanceof ExpressionComplexityException) {
            return "complexity";
        }
        if (e instanceof ConversionTimeoutException) {
            return "timeout";
        }
        return "error";
    }
}

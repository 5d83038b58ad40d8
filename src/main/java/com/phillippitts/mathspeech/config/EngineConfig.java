package com.phillippitts.mathspeech.config;

import com.phillippitts.mathspeech.config.properties.CacheProperties;
import com.phillippitts.mathspeech.config.properties.ConversionProperties;
import com.phillippitts.mathspeech.config.properties.RuleProperties;
import com.phillippitts.mathspeech.service.analysis.DefaultExpressionAnalyzer;
import com.phillippitts.mathspeech.service.analysis.ExpressionAnalyzer;
import com.phillippitts.mathspeech.service.cache.CacheMaintenance;
import com.phillippitts.mathspeech.service.cache.CachedConversion;
import com.phillippitts.mathspeech.service.cache.LruResultCache;
import com.phillippitts.mathspeech.service.cache.ResultCache;
import com.phillippitts.mathspeech.service.conversion.DefaultSpeechConversionService;
import com.phillippitts.mathspeech.service.conversion.SpeechConversionService;
import com.phillippitts.mathspeech.service.metrics.ConversionMetrics;
import com.phillippitts.mathspeech.service.postprocess.PostProcessorChain;
import com.phillippitts.mathspeech.service.rules.InMemoryRuleStore;
import com.phillippitts.mathspeech.service.rules.RuleStore;
import com.phillippitts.mathspeech.service.rules.YamlRuleLoader;
import com.phillippitts.mathspeech.service.transform.RuleTransformer;
import com.phillippitts.mathspeech.service.validation.ExpressionValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the conversion pipeline: rule store, analyzer, transformer, post-processor, result
 * cache and the service that ties them together.
 */
@Configuration
public class EngineConfig {

    private static final Logger LOG = LogManager.getLogger(EngineConfig.class);

    /**
     * Loads the rule catalogue at startup. An invalid rule file fails context startup.
     */
    @Bean
    public RuleStore ruleStore(RuleProperties ruleProperties) {
        YamlRuleLoader loader = new YamlRuleLoader();
        InMemoryRuleStore store = new InMemoryRuleStore(loader.load(ruleProperties.getLocations()));
        LOG.info("Rule store ready: {} rules ({} active)", store.count(), store.getStatistics().active());
        return store;
    }

    @Bean
    public ExpressionAnalyzer expressionAnalyzer() {
        return new DefaultExpressionAnalyzer();
    }

    @Bean
    public RuleTransformer ruleTransformer(RuleStore ruleStore, ConversionProperties props) {
        return new RuleTransformer(ruleStore, props.getMaxPasses(), props.getTimeoutMs(), props.getConditionWindow());
    }

    @Bean
    public PostProcessorChain postProcessorChain() {
        return PostProcessorChain.standard();
    }

    @Bean
    @ConditionalOnProperty(prefix = "mathspeech.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ResultCache<CachedConversion> resultCache(CacheProperties cacheProperties, ConversionMetrics metrics) {
        LruResultCache<CachedConversion> cache = new LruResultCache<>(
                cacheProperties.getMaxSize(), Duration.ofSeconds(cacheProperties.getTtlSeconds()));
        metrics.registerCacheSize(() -> cache.stats().size());
        return cache;
    }

    @Bean
    @ConditionalOnProperty(prefix = "mathspeech.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CacheMaintenance cacheMaintenance(ResultCache<CachedConversion> resultCache) {
        return new CacheMaintenance(resultCache);
    }

    @Bean
    public SpeechConversionService speechConversionService(ExpressionValidator validator,
                                                           ExpressionAnalyzer analyzer,
                                                           RuleTransformer transformer,
                                                           PostProcessorChain postProcessor,
                                                           ObjectProvider<ResultCache<CachedConversion>> cache,
                                                           ConversionMetrics metrics,
                                                           ConversionProperties props,
                                                           @Qualifier("conversionExecutor") Executor executor) {
        return new DefaultSpeechConversionService(validator, analyzer, transformer, postProcessor,
                cache.getIfAvailable(), metrics, props, executor);
    }
}

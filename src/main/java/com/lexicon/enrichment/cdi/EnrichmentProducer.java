package com.lexicon.enrichment.cdi;

import com.lexicon.enrichment.cache.CacheConfig;
import com.lexicon.enrichment.cache.CaffeineResolutionCache;
import com.lexicon.enrichment.cache.NoOpResolutionCache;
import com.lexicon.enrichment.cache.ResolutionCache;
import com.lexicon.enrichment.context.ContextAssembler;
import com.lexicon.enrichment.context.ContextOptions;
import com.lexicon.enrichment.dedup.ClusteringPolicy;
import com.lexicon.enrichment.dedup.DuplicateClusterer;
import com.lexicon.enrichment.executor.ExecutorConfig;
import com.lexicon.enrichment.executor.RateLimitedBatchExecutor;
import com.lexicon.enrichment.executor.ResilientOracle;
import com.lexicon.enrichment.executor.RetryPolicy;
import com.lexicon.enrichment.executor.Sleeper;
import com.lexicon.enrichment.graph.CypherExecutor;
import com.lexicon.enrichment.graph.FalkorDBConnection;
import com.lexicon.enrichment.graph.GraphConnection;
import com.lexicon.enrichment.knowledge.*;
import com.lexicon.enrichment.ledger.GraphJobLedger;
import com.lexicon.enrichment.ledger.JobLedger;
import com.lexicon.enrichment.metrics.MetricsService;
import com.lexicon.enrichment.metrics.MicrometerMetricsService;
import com.lexicon.enrichment.metrics.NoOpMetricsService;
import com.lexicon.enrichment.oracle.NoOpOracleProvider;
import com.lexicon.enrichment.oracle.OllamaOracleProvider;
import com.lexicon.enrichment.oracle.OpenAiOracleProvider;
import com.lexicon.enrichment.oracle.OracleProvider;
import com.lexicon.enrichment.persist.ResultPersister;
import com.lexicon.enrichment.pipeline.EnrichmentPipeline;
import com.lexicon.enrichment.pipeline.HighlightCleaningPipeline;
import com.lexicon.enrichment.pipeline.PipelineRunner;
import com.lexicon.enrichment.resolution.ResolutionCascade;
import com.lexicon.enrichment.similarity.LevenshteinSimilarity;
import com.lexicon.enrichment.tracing.NoOpTracingService;
import com.lexicon.enrichment.tracing.OpenTelemetryTracingService;
import com.lexicon.enrichment.tracing.TracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the enrichment pipelines from MicroProfile Config properties.
 *
 * <h2>Minimal configuration</h2>
 * <pre>
 * lexicon-enrichment:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: lexicon
 *   oracle:
 *     provider: ollama
 *     model: llama3.2
 * </pre>
 *
 * <p>Metrics go to the container's {@link MeterRegistry} when one is available. Spans go to the
 * globally registered OpenTelemetry instance when tracing is enabled.</p>
 */
@ApplicationScoped
public class EnrichmentProducer {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.falkordb.graph-name", defaultValue = "lexicon")
    String falkordbGraphName;

    // ── Oracle ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.oracle.provider", defaultValue = "ollama")
    String oracleProvider;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.oracle.base-url")
    Optional<String> oracleBaseUrl;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.oracle.model")
    Optional<String> oracleModel;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.oracle.api-key")
    Optional<String> oracleApiKey;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.oracle.timeout-seconds", defaultValue = "120")
    int oracleTimeoutSeconds;

    // ── Executor ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.executor.sub-batch-size", defaultValue = "3")
    int subBatchSize;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.executor.concurrency", defaultValue = "10")
    int concurrency;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.executor.stagger-millis", defaultValue = "100")
    long staggerMillis;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.executor.cooldown-millis", defaultValue = "1000")
    long cooldownMillis;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.executor.call-budget", defaultValue = "1000")
    int callBudget;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.executor.call-timeout-seconds", defaultValue = "120")
    int callTimeoutSeconds;

    // ── Retry ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.retry.max-attempts", defaultValue = "4")
    int retryMaxAttempts;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.retry.base-delay-millis", defaultValue = "5000")
    long retryBaseDelayMillis;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.retry.multiplier", defaultValue = "2.0")
    double retryMultiplier;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.retry.max-jitter-millis", defaultValue = "1000")
    long retryMaxJitterMillis;

    // ── Clustering and context ────────────────────────────────

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.clustering.key-threshold", defaultValue = "0.8")
    double keyThreshold;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.clustering.explanation-threshold", defaultValue = "0.7")
    double explanationThreshold;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.clustering.max-chunk-size", defaultValue = "500")
    int maxChunkSize;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.context.min-highlight-relevance", defaultValue = "6")
    int minHighlightRelevance;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.context.window-before", defaultValue = "2")
    int windowBefore;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.context.window-after", defaultValue = "2")
    int windowAfter;

    // ── Cache and observability ───────────────────────────────

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "lexicon-enrichment.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Infrastructure
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection() {
        log.info("Producing GraphConnection: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        GraphConnection connection = new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
        connection.createIndexes();
        return connection;
    }

    public void closeConnection(@Disposes GraphConnection connection) {
        log.info("Closing GraphConnection");
        connection.close();
    }

    @Produces
    @ApplicationScoped
    public CypherExecutor cypherExecutor(GraphConnection connection) {
        return new CypherExecutor(connection);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Metrics enabled: registry={}", meterRegistry.get().getClass().getSimpleName());
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("No MeterRegistry available, metrics disabled");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public TracingService tracingService() {
        if (tracingEnabled) {
            return new OpenTelemetryTracingService(GlobalOpenTelemetry.get());
        }
        return new NoOpTracingService();
    }

    // ══════════════════════════════════════════════════════════
    //  Stores
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public JobLedger jobLedger(CypherExecutor executor) {
        return new GraphJobLedger(executor);
    }

    @Produces
    @ApplicationScoped
    public ConceptRepository conceptRepository(CypherExecutor executor) {
        return new GraphConceptRepository(executor);
    }

    @Produces
    @ApplicationScoped
    public HighlightRepository highlightRepository(CypherExecutor executor) {
        return new GraphHighlightRepository(executor);
    }

    @Produces
    @ApplicationScoped
    public TranslationRepository translationRepository(CypherExecutor executor) {
        return new GraphTranslationRepository(executor);
    }

    @Produces
    @ApplicationScoped
    public LexicalRecordRepository lexicalRecordRepository(CypherExecutor executor) {
        return new GraphLexicalRecordRepository(executor);
    }

    @Produces
    @ApplicationScoped
    public ResolutionCascade resolutionCascade(ConceptRepository concepts, MetricsService metrics) {
        ResolutionCache cache = cacheEnabled
                ? new CaffeineResolutionCache(new CacheConfig(cacheMaxSize, cacheTtlSeconds, true))
                : new NoOpResolutionCache();
        return ResolutionCascade.standard(concepts, cache, metrics);
    }

    // ══════════════════════════════════════════════════════════
    //  Oracle and executor
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ResilientOracle resilientOracle(MetricsService metrics, TracingService tracing) {
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(retryMaxAttempts)
                .baseDelay(Duration.ofMillis(retryBaseDelayMillis))
                .multiplier(retryMultiplier)
                .maxJitter(Duration.ofMillis(retryMaxJitterMillis))
                .build();
        OracleProvider provider = createOracleProvider();
        log.info("Oracle: provider={} retry={}x base={}ms", provider.getProviderName(), retryMaxAttempts,
                retryBaseDelayMillis);
        return new ResilientOracle(provider, retryPolicy, metrics, tracing, executorConfig().getCallTimeout());
    }

    public void closeResilientOracle(@Disposes ResilientOracle oracle) {
        oracle.close();
    }

    @Produces
    @ApplicationScoped
    public RateLimitedBatchExecutor batchExecutor(MetricsService metrics) {
        return new RateLimitedBatchExecutor(executorConfig(), Sleeper.SYSTEM, metrics);
    }

    public void closeExecutor(@Disposes RateLimitedBatchExecutor executor) {
        executor.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Pipelines
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    @Named("enrichment")
    public PipelineRunner enrichmentRunner(JobLedger ledger, ConceptRepository concepts,
                                           HighlightRepository highlights, TranslationRepository translations,
                                           ResolutionCascade cascade, ResilientOracle oracle,
                                           RateLimitedBatchExecutor executor, MetricsService metrics,
                                           TracingService tracing) {
        ContextOptions contextOptions = new ContextOptions(minHighlightRelevance, windowBefore, windowAfter);
        EnrichmentPipeline pipeline = EnrichmentPipeline.builder()
                .ledger(ledger)
                .contextAssembler(new ContextAssembler(concepts, highlights, ledger, contextOptions))
                .oracle(oracle)
                .persister(new ResultPersister(translations, highlights, concepts, cascade, ledger, metrics))
                .executor(executor)
                .metrics(metrics)
                .tracing(tracing)
                .build();
        return new PipelineRunner(pipeline, callBudget);
    }

    public void closeEnrichmentRunner(@Disposes @Named("enrichment") PipelineRunner runner) {
        runner.close();
    }

    @Produces
    @ApplicationScoped
    @Named("highlight-cleaning")
    public PipelineRunner highlightCleaningRunner(LexicalRecordRepository records, HighlightRepository highlights,
                                                  ResilientOracle oracle, RateLimitedBatchExecutor executor,
                                                  MetricsService metrics) {
        DuplicateClusterer clusterer = new DuplicateClusterer(
                new ClusteringPolicy(keyThreshold, explanationThreshold, maxChunkSize),
                new LevenshteinSimilarity());
        HighlightCleaningPipeline pipeline = new HighlightCleaningPipeline(records, highlights, clusterer,
                oracle, executor, metrics);
        return new PipelineRunner(pipeline, callBudget);
    }

    public void closeHighlightCleaningRunner(@Disposes @Named("highlight-cleaning") PipelineRunner runner) {
        runner.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    ExecutorConfig executorConfig() {
        return ExecutorConfig.builder()
                .subBatchSize(subBatchSize)
                .concurrency(concurrency)
                .staggerDelay(Duration.ofMillis(staggerMillis))
                .groupCooldown(Duration.ofMillis(cooldownMillis))
                .callBudget(callBudget)
                .callTimeout(Duration.ofSeconds(callTimeoutSeconds))
                .build();
    }

    OracleProvider createOracleProvider() {
        Duration timeout = Duration.ofSeconds(oracleTimeoutSeconds);
        if ("ollama".equalsIgnoreCase(oracleProvider)) {
            OllamaOracleProvider.Builder builder = OllamaOracleProvider.builder().timeout(timeout);
            oracleBaseUrl.ifPresent(builder::baseUrl);
            oracleModel.ifPresent(builder::model);
            return builder.build();
        }
        if ("openai".equalsIgnoreCase(oracleProvider)) {
            if (oracleApiKey.isEmpty() || oracleApiKey.get().isBlank()) {
                log.warn("OpenAI oracle selected without lexicon-enrichment.oracle.api-key, falling back to NoOp");
                return new NoOpOracleProvider();
            }
            OpenAiOracleProvider.Builder builder = OpenAiOracleProvider.builder()
                    .apiKey(oracleApiKey.get())
                    .timeout(timeout);
            oracleBaseUrl.ifPresent(builder::baseUrl);
            oracleModel.ifPresent(builder::model);
            return builder.build();
        }
        log.warn("Unknown oracle provider '{}', falling back to NoOp", oracleProvider);
        return new NoOpOracleProvider();
    }
}

package com.lexicon.enrichment.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.Batches;
import com.lexicon.enrichment.core.model.Cluster;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.core.model.LexicalKeys;
import com.lexicon.enrichment.core.model.LexicalRecord;
import com.lexicon.enrichment.dedup.DuplicateClusterer;
import com.lexicon.enrichment.executor.ExecutionReport;
import com.lexicon.enrichment.executor.RateLimitedBatchExecutor;
import com.lexicon.enrichment.executor.ResilientOracle;
import com.lexicon.enrichment.executor.SubBatchHandler;
import com.lexicon.enrichment.knowledge.HighlightRepository;
import com.lexicon.enrichment.knowledge.LexicalRecordRepository;
import com.lexicon.enrichment.logging.LogContext;
import com.lexicon.enrichment.metrics.MetricsService;
import com.lexicon.enrichment.oracle.HighlightPromptBuilder;
import com.lexicon.enrichment.oracle.InvalidOracleResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Condenses raw idiom records into highlights.
 *
 * <p>Records whose key already has a highlight, or whose id is a source id of any highlight, are skipped. The rest are sorted by key, chunked, clustered,
 * and each batch of clusters is condensed by the oracle. A highlight keeps the ids of every record of its
 * cluster as source ids.</p>
 */
public class HighlightCleaningPipeline implements Pipeline {
    private static final Logger log = LoggerFactory.getLogger(HighlightCleaningPipeline.class);

    public static final String NAME = "highlight-cleaning";
    public static final int DEFAULT_CLUSTERS_PER_CALL = 10;
    static final int DEFAULT_RELEVANCE = 5;
    private static final int READ_PAGE_SIZE = 1000;

    private final LexicalRecordRepository records;
    private final HighlightRepository highlights;
    private final DuplicateClusterer clusterer;
    private final HighlightPromptBuilder promptBuilder;
    private final ResilientOracle oracle;
    private final RateLimitedBatchExecutor executor;
    private final MetricsService metrics;
    private final int clustersPerCall;

    public HighlightCleaningPipeline(LexicalRecordRepository records, HighlightRepository highlights,
                                     DuplicateClusterer clusterer, ResilientOracle oracle,
                                     RateLimitedBatchExecutor executor, MetricsService metrics) {
        this(records, highlights, clusterer, new HighlightPromptBuilder(), oracle, executor, metrics,
                DEFAULT_CLUSTERS_PER_CALL);
    }

    public HighlightCleaningPipeline(LexicalRecordRepository records, HighlightRepository highlights,
                                     DuplicateClusterer clusterer, HighlightPromptBuilder promptBuilder,
                                     ResilientOracle oracle, RateLimitedBatchExecutor executor,
                                     MetricsService metrics, int clustersPerCall) {
        if (clustersPerCall < 1) {
            throw new IllegalArgumentException("clustersPerCall must be >= 1");
        }
        this.records = Objects.requireNonNull(records, "records is required");
        this.highlights = Objects.requireNonNull(highlights, "highlights is required");
        this.clusterer = Objects.requireNonNull(clusterer, "clusterer is required");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder is required");
        this.oracle = Objects.requireNonNull(oracle, "oracle is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clustersPerCall = clustersPerCall;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RunSummary run(int limit, RunContext context) {
        Instant start = Instant.now();
        RunLog runLog = context.getLog();
        try (LogContext ignored = LogContext.forRun(context.getRunId(), NAME)) {
            Set<String> existingKeys = highlights.findAllKeys();
            Set<String> condensedIds = highlights.findAllSourceIds();
            List<LexicalRecord> pending = loadUnprocessed(limit, existingKeys, condensedIds);
            runLog.info("Found " + pending.size() + " unprocessed records (" + existingKeys.size()
                    + " keys already have a highlight, " + condensedIds.size() + " records already condensed)");

            List<Cluster> clusters = clusterAll(pending);
            context.setSelected(clusters.size());
            runLog.info("Grouped " + pending.size() + " records into " + clusters.size() + " clusters");
            if (clusters.isEmpty()) {
                context.setDetails("Nothing to do");
                return summary(context, ExecutionReport.empty(), start);
            }

            context.setDetails("Cleaning " + clusters.size() + " clusters");
            ExecutionReport report = executor.execute(clusters, clustersPerCall, new Handler(context),
                    context.getBudget());
            RunSummary summary = summary(context, report, start);
            context.setDetails("Written " + summary.completed() + ", failed " + summary.failed()
                    + ", deferred " + summary.deferred());
            if (report.aborted()) {
                runLog.error("Run aborted: " + report.abortMessage() + " (" + context.getDetails() + ")");
                return summary;
            }
            if (report.deferredItems() > 0) {
                runLog.warning("Call budget exhausted, " + report.deferredItems() + " clusters left for a later run");
            }
            runLog.success("Run finished: " + context.getDetails());
            return summary;
        }
    }

    List<LexicalRecord> loadUnprocessed(int limit, Set<String> existingKeys, Set<String> condensedIds) {
        List<LexicalRecord> pending = new ArrayList<>();
        PageRequest request = PageRequest.first(READ_PAGE_SIZE);
        while (pending.size() < limit) {
            Page<LexicalRecord> page = records.findAll(request);
            for (LexicalRecord record : page.content()) {
                boolean processed = existingKeys.contains(record.normalizedKey()) || condensedIds.contains(record.id());
                if (!processed && pending.size() < limit) {
                    pending.add(record);
                }
            }
            if (!page.hasNext()) {
                break;
            }
            request = request.next();
        }
        return pending;
    }

    List<Cluster> clusterAll(List<LexicalRecord> pending) {
        List<LexicalRecord> sorted = new ArrayList<>(pending);
        sorted.sort(Comparator.comparing(LexicalRecord::normalizedKey).thenComparing(LexicalRecord::id));
        List<Cluster> clusters = new ArrayList<>();
        for (List<LexicalRecord> chunk : Batches.partition(sorted, clusterer.getPolicy().maxChunkSize())) {
            for (Cluster cluster : clusterer.cluster(chunk)) {
                metrics.recordClusterSize(cluster.size());
                clusters.add(cluster);
            }
        }
        return clusters;
    }

    private RunSummary summary(RunContext context, ExecutionReport report, Instant start) {
        return new RunSummary(context.getRunId(), NAME, context.getSelected(), context.getCompleted(),
                context.getFailed(), report.deferredItems(), report.aborted(), report.abortMessage(),
                Duration.between(start, Instant.now()));
    }

    private final class Handler implements SubBatchHandler<Cluster> {
        private final RunContext context;

        Handler(RunContext context) {
            this.context = context;
        }

        @Override
        public void handle(List<Cluster> batch) {
            String prompt = promptBuilder.build(batch);
            context.tracePrompt(prompt);
            JsonNode answer = oracle.complete(prompt, (attempt, delay, failure) ->
                    context.getLog().warning("Rate limit hit. Retrying in "
                            + Math.round(delay.toMillis() / 1000.0) + "s (attempt " + attempt + ")"));
            JsonNode entries = answer.isArray() ? answer : answer.path("entries");
            if (!entries.isArray()) {
                throw new InvalidOracleResponseException("Oracle answer has no entries array");
            }

            Map<String, Cluster> byKey = new HashMap<>();
            batch.forEach(c -> byKey.put(c.representativeKey(), c));
            Set<String> written = new HashSet<>();
            for (JsonNode entry : entries) {
                Optional<Highlight> highlight = toHighlight(entry, byKey);
                if (highlight.isEmpty()) {
                    continue;
                }
                HighlightRepository.UpsertResult result = highlights.upsert(highlight.get());
                metrics.recordHighlightUpsert(result.outcome().metricName());
                written.add(keyOf(entry));
            }
            int missing = (int) batch.stream().filter(c -> !written.contains(c.representativeKey())).count();
            context.recordCompleted(batch.size() - missing);
            if (missing > 0) {
                context.recordFailed(missing);
                context.getLog().warning(missing + " clusters of the batch got no usable entry");
            }
        }

        @Override
        public void onFailure(List<Cluster> batch, Throwable cause) {
            context.recordFailed(batch.size());
            context.getLog().error("Batch of " + batch.size() + " clusters failed: " + cause.getMessage());
        }

        private Optional<Highlight> toHighlight(JsonNode entry, Map<String, Cluster> byKey) {
            String term = text(entry, "term");
            Cluster cluster = byKey.get(keyOf(entry));
            if (term == null || cluster == null) {
                log.warn("highlight.entry_skipped term='{}' key='{}' reason=unknown record", term, keyOf(entry));
                return Optional.empty();
            }
            JsonNode score = entry.path("relevance_score");
            int relevance = score.isNumber() ? (int) Math.round(score.asDouble()) : DEFAULT_RELEVANCE;
            relevance = Math.max(Highlight.MIN_RELEVANCE, Math.min(Highlight.MAX_RELEVANCE, relevance));
            List<String> tags = new ArrayList<>();
            entry.path("tags").forEach(tag -> {
                if (tag.isTextual() && !tag.asText().isBlank()) {
                    tags.add(tag.asText().trim());
                }
            });
            String category = text(entry, "feature_type");
            String sourceTable = cluster.primary().sourceTable();
            return Optional.of(new Highlight(term,
                    text(entry, "gloss"),
                    Objects.requireNonNullElse(text(entry, "explanation"), cluster.primary().explanationOrEmpty()),
                    category != null ? category : "general",
                    relevance,
                    tags,
                    sourceTable != null ? sourceTable : "mixed",
                    cluster.memberIds()));
        }

        private String keyOf(JsonNode entry) {
            String key = text(entry, "original_key");
            return key != null ? key : LexicalKeys.of(text(entry, "term"));
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}

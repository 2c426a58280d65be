package com.lexicon.enrichment.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexicon.enrichment.context.ContextAssembler;
import com.lexicon.enrichment.context.EnrichmentContext;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.core.model.WorkItem;
import com.lexicon.enrichment.core.model.WorkStatus;
import com.lexicon.enrichment.executor.ExecutionReport;
import com.lexicon.enrichment.executor.RateLimitedBatchExecutor;
import com.lexicon.enrichment.executor.ResilientOracle;
import com.lexicon.enrichment.executor.SubBatchHandler;
import com.lexicon.enrichment.ledger.JobLedger;
import com.lexicon.enrichment.ledger.WorkOrdering;
import com.lexicon.enrichment.logging.LogContext;
import com.lexicon.enrichment.metrics.MetricsService;
import com.lexicon.enrichment.metrics.NoOpMetricsService;
import com.lexicon.enrichment.oracle.EnrichmentPromptBuilder;
import com.lexicon.enrichment.persist.PersistResult;
import com.lexicon.enrichment.persist.ResultPersister;
import com.lexicon.enrichment.persist.ResultValidator;
import com.lexicon.enrichment.persist.ValidatedBatch;
import com.lexicon.enrichment.tracing.NoOpTracingService;
import com.lexicon.enrichment.tracing.Span;
import com.lexicon.enrichment.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Corrects, translates and annotates pending work items.
 *
 * <p>A run resets stale items, selects up to {@code limit} pending items, and hands them to the batch executor.
 * Each sub-batch is claimed, given context, sent to the oracle, validated and persisted item by item.</p>
 */
public class EnrichmentPipeline implements Pipeline {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentPipeline.class);

    public static final String NAME = "enrichment";

    private final JobLedger ledger;
    private final ContextAssembler contextAssembler;
    private final EnrichmentPromptBuilder promptBuilder;
    private final ResilientOracle oracle;
    private final ResultValidator validator;
    private final ResultPersister persister;
    private final RateLimitedBatchExecutor executor;
    private final WorkOrdering ordering;
    private final MetricsService metrics;
    private final TracingService tracing;

    private EnrichmentPipeline(Builder builder) {
        this.ledger = Objects.requireNonNull(builder.ledger, "ledger is required");
        this.contextAssembler = Objects.requireNonNull(builder.contextAssembler, "contextAssembler is required");
        this.promptBuilder = builder.promptBuilder != null ? builder.promptBuilder : new EnrichmentPromptBuilder();
        this.oracle = Objects.requireNonNull(builder.oracle, "oracle is required");
        this.validator = builder.validator != null ? builder.validator : new ResultValidator();
        this.persister = Objects.requireNonNull(builder.persister, "persister is required");
        this.executor = Objects.requireNonNull(builder.executor, "executor is required");
        this.ordering = builder.ordering != null ? builder.ordering : WorkOrdering.PARENT_THEN_SEQUENCE;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.tracing = builder.tracing != null ? builder.tracing : new NoOpTracingService();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RunSummary run(int limit, RunContext context) {
        Instant start = Instant.now();
        RunLog runLog = context.getLog();
        try (LogContext ignored = LogContext.forRun(context.getRunId(), NAME);
             Span span = tracing.startSpan(TracingService.RUN_SPAN, Map.of("pipeline", NAME))) {
            span.setAttribute("limit", limit);

            int reset = ledger.resetStale();
            if (reset > 0) {
                runLog.info("Reset " + reset + " stale or failed items to pending");
            }

            List<WorkItem> items = ledger.selectPending(limit, ordering);
            context.setSelected(items.size());
            runLog.info("Selected " + items.size() + " pending items (limit " + limit + ")");
            if (items.isEmpty()) {
                context.setDetails("Nothing to do");
                span.setStatus(Span.SpanStatus.OK);
                return summary(context, ExecutionReport.empty(), start);
            }

            List<Highlight> knownHighlights = contextAssembler.loadKnownHighlights();
            context.setDetails("Processing " + items.size() + " items");

            ExecutionReport report = executor.execute(items, new Handler(context, knownHighlights),
                    context.getBudget());

            if (report.deferredItems() > 0 && !report.aborted()) {
                runLog.warning("Call budget exhausted, " + report.deferredItems() + " items stay pending");
            }
            RunSummary summary = summary(context, report, start);
            context.setDetails("Completed " + summary.completed() + ", failed " + summary.failed()
                    + ", deferred " + summary.deferred());
            if (report.aborted()) {
                runLog.error("Run aborted: " + report.abortMessage() + " (" + context.getDetails() + ")");
                span.setStatus(Span.SpanStatus.ERROR);
            } else {
                runLog.success("Run finished: " + context.getDetails());
                span.setStatus(Span.SpanStatus.OK);
            }
            return summary;
        }
    }

    private RunSummary summary(RunContext context, ExecutionReport report, Instant start) {
        return new RunSummary(context.getRunId(), NAME, context.getSelected(), context.getCompleted(),
                context.getFailed(), report.deferredItems(), report.aborted(), report.abortMessage(),
                Duration.between(start, Instant.now()));
    }

    /**
     * Processes one sub-batch on an executor thread.
     */
    private final class Handler implements SubBatchHandler<WorkItem> {
        private final RunContext context;
        private final List<Highlight> knownHighlights;

        Handler(RunContext context, List<Highlight> knownHighlights) {
            this.context = context;
            this.knownHighlights = knownHighlights;
        }

        @Override
        public void handle(List<WorkItem> batch) {
            String batchId = UUID.randomUUID().toString();
            try (LogContext ignored = LogContext.forBatch(context.getRunId(), batchId)) {
                ledger.markProcessing(batch.stream().map(WorkItem::getId).toList());

                EnrichmentContext enrichmentContext = contextAssembler.assemble(batch, knownHighlights);
                String prompt = promptBuilder.build(enrichmentContext);
                context.tracePrompt(prompt);

                JsonNode answer = oracle.complete(prompt, (attempt, delay, failure) ->
                        context.getLog().warning("Rate limit hit. Retrying in "
                                + Math.round(delay.toMillis() / 1000.0) + "s (attempt " + attempt + ")"));
                ValidatedBatch validated = validator.validate(answer, batch);

                try (Span span = tracing.startSpan(TracingService.PERSIST_SPAN)) {
                    span.setAttribute("items", batch.size());
                    for (WorkItem item : batch) {
                        Optional<String> failure = validated.failure(item.getId());
                        PersistResult result = failure.isPresent()
                                ? persister.fail(item, failure.get())
                                : persister.persist(item, validated.results().get(item.getId()));
                        if (result.completed()) {
                            context.recordCompleted(1);
                        } else {
                            context.recordFailed(1);
                            context.getLog().warning("Item " + item.getId() + " failed: " + result.error());
                        }
                    }
                }
                log.debug("batch.done size={}", batch.size());
            }
        }

        @Override
        public void onFailure(List<WorkItem> batch, Throwable cause) {
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            context.getLog().error("Batch of " + batch.size() + " items failed: " + message);
            for (WorkItem item : batch) {
                Optional<WorkItem> current = ledger.get(item.getId());
                if (current.isPresent() && (current.get().getStatus() == WorkStatus.PROCESSING
                        || current.get().getStatus() == WorkStatus.PENDING)) {
                    ledger.markError(item.getId(), message);
                    metrics.incrementWorkItem(WorkStatus.ERROR);
                    context.recordFailed(1);
                }
            }
        }
    }

    public static class Builder {
        private JobLedger ledger;
        private ContextAssembler contextAssembler;
        private EnrichmentPromptBuilder promptBuilder;
        private ResilientOracle oracle;
        private ResultValidator validator;
        private ResultPersister persister;
        private RateLimitedBatchExecutor executor;
        private WorkOrdering ordering;
        private MetricsService metrics;
        private TracingService tracing;

        public Builder ledger(JobLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder contextAssembler(ContextAssembler contextAssembler) {
            this.contextAssembler = contextAssembler;
            return this;
        }

        public Builder promptBuilder(EnrichmentPromptBuilder promptBuilder) {
            this.promptBuilder = promptBuilder;
            return this;
        }

        public Builder oracle(ResilientOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        public Builder validator(ResultValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder persister(ResultPersister persister) {
            this.persister = persister;
            return this;
        }

        public Builder executor(RateLimitedBatchExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder ordering(WorkOrdering ordering) {
            this.ordering = ordering;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public EnrichmentPipeline build() {
            return new EnrichmentPipeline(this);
        }
    }
}

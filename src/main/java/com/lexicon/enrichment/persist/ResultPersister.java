package com.lexicon.enrichment.persist;

import com.lexicon.enrichment.core.model.*;
import com.lexicon.enrichment.knowledge.ConceptRepository;
import com.lexicon.enrichment.knowledge.HighlightRepository;
import com.lexicon.enrichment.knowledge.HighlightRepository.UpsertOutcome;
import com.lexicon.enrichment.knowledge.HighlightRepository.UpsertResult;
import com.lexicon.enrichment.knowledge.TranslationRepository;
import com.lexicon.enrichment.ledger.JobLedger;
import com.lexicon.enrichment.ledger.LedgerException;
import com.lexicon.enrichment.logging.LogContext;
import com.lexicon.enrichment.metrics.MetricsService;
import com.lexicon.enrichment.resolution.ResolutionCascade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Writes a validated result and moves its work item to a terminal state.
 *
 * <p>Order: translations (replacing earlier rows of the item), highlights (never downgrading),
 * cross-references resolved from the item's parent concept, then {@code markCompleted}.
 * A write failure moves the item to ERROR instead. Ledger failures propagate.</p>
 */
public class ResultPersister {
    private static final Logger log = LoggerFactory.getLogger(ResultPersister.class);

    private final TranslationRepository translations;
    private final HighlightRepository highlights;
    private final ConceptRepository concepts;
    private final ResolutionCascade cascade;
    private final JobLedger ledger;
    private final MetricsService metrics;

    public ResultPersister(TranslationRepository translations, HighlightRepository highlights,
                           ConceptRepository concepts, ResolutionCascade cascade, JobLedger ledger,
                           MetricsService metrics) {
        this.translations = Objects.requireNonNull(translations, "translations is required");
        this.highlights = Objects.requireNonNull(highlights, "highlights is required");
        this.concepts = Objects.requireNonNull(concepts, "concepts is required");
        this.cascade = Objects.requireNonNull(cascade, "cascade is required");
        this.ledger = Objects.requireNonNull(ledger, "ledger is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public PersistResult persist(WorkItem item, EnrichedResult result) {
        if (!item.getId().equals(result.workItemId())) {
            throw new IllegalArgumentException("Result of " + result.workItemId() + " passed for " + item.getId());
        }
        try (LogContext ignored = LogContext.forWorkItem(item.getId())) {
            try {
                translations.replaceForWorkItem(item.getId(), result.translations());

                int highlightsWritten = 0;
                for (Highlight highlight : result.highlights()) {
                    if (upsertHighlight(highlight)) {
                        highlightsWritten++;
                    }
                }

                int created = 0;
                int unresolved = 0;
                for (CrossReference reference : result.crossReferences()) {
                    Optional<Boolean> outcome = link(item, reference);
                    if (outcome.isEmpty()) {
                        unresolved++;
                    } else if (outcome.get()) {
                        created++;
                    }
                }

                ledger.markCompleted(item.getId());
                metrics.incrementWorkItem(WorkStatus.COMPLETED);
                log.debug("persist.completed translations={} highlights={} relations={} unresolved={}",
                        result.translations().size(), highlightsWritten, created, unresolved);
                return new PersistResult(item.getId(), true, result.translations().size(), highlightsWritten,
                        created, unresolved, null);
            } catch (LedgerException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("persist.failed error={}", e.getMessage(), e);
                return fail(item, "Write failed: " + e.getMessage());
            }
        }
    }

    /**
     * Moves an item to ERROR without writing anything for it.
     */
    public PersistResult fail(WorkItem item, String message) {
        String error = message != null && !message.isBlank() ? message : "Unknown error";
        ledger.markError(item.getId(), error);
        metrics.incrementWorkItem(WorkStatus.ERROR);
        return PersistResult.failed(item.getId(), error);
    }

    private boolean upsertHighlight(Highlight highlight) {
        UpsertResult upsert = highlights.upsert(highlight);
        metrics.recordHighlightUpsert(upsert.outcome().metricName());
        if (upsert.outcome() == UpsertOutcome.REPLACED && upsert.previousGloss() != null
                && !upsert.previousGloss().equalsIgnoreCase(Objects.requireNonNullElse(highlight.gloss(), ""))) {
            log.warn("highlight.key_collision key='{}' previousGloss='{}' newGloss='{}' previousRelevance={} newRelevance={}",
                    highlight.normalizedKey(), upsert.previousGloss(), highlight.gloss(),
                    upsert.previousRelevance(), highlight.relevance());
        }
        return upsert.outcome() != UpsertOutcome.KEPT_EXISTING;
    }

    /**
     * @return empty when the reference could not be linked, otherwise whether a new edge was created
     */
    private Optional<Boolean> link(WorkItem item, CrossReference reference) {
        if (item.getParentId() == null) {
            log.debug("persist.reference_skipped target='{}' reason=no parent concept", reference.targetTerm());
            return Optional.empty();
        }
        Optional<String> target = cascade.resolve(reference.targetTerm());
        if (target.isEmpty()) {
            return Optional.empty();
        }
        if (target.get().equals(item.getParentId())) {
            log.debug("persist.reference_skipped target='{}' reason=self reference", reference.targetTerm());
            return Optional.of(false);
        }
        return Optional.of(concepts.createRelation(Relation.builder()
                .sourceConceptId(item.getParentId())
                .targetConceptId(target.get())
                .type(reference.relationType())
                .note(reference.note())
                .origin(item.getId())
                .build()));
    }
}

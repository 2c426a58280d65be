package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.graph.CypherExecutor;
import com.lexicon.enrichment.graph.GraphRows;
import com.lexicon.enrichment.graph.InputSanitizer;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Highlight store backed by FalkorDB. The never-downgrade rule is evaluated inside a single statement.
 */
public class GraphHighlightRepository implements HighlightRepository {

    private final CypherExecutor executor;

    public GraphHighlightRepository(CypherExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    @Override
    public UpsertResult upsert(Highlight highlight) {
        InputSanitizer.validateTerm(highlight.keyTerm());
        InputSanitizer.sanitizeForCypher(highlight.explanation());
        List<Map<String, Object>> rows = executor.upsertHighlight(highlight.normalizedKey(), highlight.keyTerm(),
                highlight.gloss(), highlight.explanation(), highlight.category(), highlight.relevance(),
                highlight.tags(), highlight.sourceTable(), highlight.sourceIds());
        if (rows.isEmpty()) {
            throw new IllegalStateException("Highlight upsert returned no row for key '" + highlight.normalizedKey() + "'");
        }
        Map<String, Object> row = rows.get(0);
        Object previous = row.get("previousRelevance");
        if (previous == null) {
            return UpsertResult.inserted();
        }
        Integer previousRelevance = ((Number) previous).intValue();
        UpsertOutcome outcome = Boolean.TRUE.equals(row.get("replace"))
                ? UpsertOutcome.REPLACED
                : UpsertOutcome.KEPT_EXISTING;
        return new UpsertResult(outcome, previousRelevance, GraphRows.string(row, "previousGloss"));
    }

    @Override
    public Optional<Highlight> findByKey(String normalizedKey) {
        List<Map<String, Object>> rows = executor.findHighlightByKey(normalizedKey);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToHighlight(rows.get(0)));
    }

    @Override
    public List<Highlight> findByMinRelevance(int minRelevance) {
        return executor.findHighlightsByMinRelevance(minRelevance).stream().map(this::mapToHighlight).toList();
    }

    @Override
    public Set<String> findAllKeys() {
        return executor.findHighlightKeys().stream()
                .map(row -> GraphRows.string(row, "key"))
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Page<Highlight> findAll(PageRequest request) {
        return new Page<>(executor.findHighlights(request.offset(), request.limit()).stream()
                .map(this::mapToHighlight)
                .toList(), request);
    }

    @Override
    public long count() {
        return executor.countHighlights();
    }

    private Highlight mapToHighlight(Map<String, Object> row) {
        return new Highlight(
                GraphRows.string(row, "keyTerm"),
                GraphRows.string(row, "gloss"),
                GraphRows.string(row, "explanation"),
                GraphRows.string(row, "category"),
                GraphRows.integer(row, "relevance", Highlight.MIN_RELEVANCE),
                GraphRows.strings(row, "tags"),
                GraphRows.string(row, "sourceTable"),
                GraphRows.strings(row, "sourceIds"));
    }
}

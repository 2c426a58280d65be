package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.TranslationRecord;
import com.lexicon.enrichment.graph.CypherExecutor;
import com.lexicon.enrichment.graph.GraphRows;
import com.lexicon.enrichment.graph.InputSanitizer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Translation store backed by FalkorDB. Replacement is a delete followed by a create.
 */
public class GraphTranslationRepository implements TranslationRepository {

    private final CypherExecutor executor;

    public GraphTranslationRepository(CypherExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    @Override
    public void replaceForWorkItem(String workItemId, List<TranslationRecord> records) {
        List<Map<String, Object>> rows = records.stream()
                .map(r -> {
                    if (!workItemId.equals(r.workItemId())) {
                        throw new IllegalArgumentException("Record of " + r.workItemId() + " passed for " + workItemId);
                    }
                    InputSanitizer.sanitizeForCypher(r.cleanedText());
                    InputSanitizer.sanitizeForCypher(r.translation());
                    InputSanitizer.sanitizeForCypher(r.notes());
                    return CypherExecutor.params(
                            "workItemId", r.workItemId(),
                            "variant", r.variant(),
                            "cleanedText", r.cleanedText(),
                            "translation", r.translation(),
                            "confidence", r.confidence(),
                            "notes", r.notes());
                })
                .toList();
        executor.deleteTranslations(workItemId);
        if (!rows.isEmpty()) {
            executor.createTranslations(rows);
        }
    }

    @Override
    public List<TranslationRecord> findByWorkItem(String workItemId) {
        return executor.findTranslationsByWorkItem(workItemId).stream().map(this::mapToRecord).toList();
    }

    @Override
    public Page<TranslationRecord> findAll(PageRequest request) {
        return new Page<>(executor.findTranslations(request.offset(), request.limit()).stream()
                .map(this::mapToRecord)
                .toList(), request);
    }

    @Override
    public long count() {
        return executor.countTranslations();
    }

    private TranslationRecord mapToRecord(Map<String, Object> row) {
        return new TranslationRecord(
                GraphRows.string(row, "workItemId"),
                Objects.requireNonNullElse(GraphRows.string(row, "cleanedText"), ""),
                Objects.requireNonNullElse(GraphRows.string(row, "translation"), ""),
                GraphRows.decimal(row, "confidence", 0.0),
                GraphRows.string(row, "notes"),
                GraphRows.string(row, "variant"));
    }
}

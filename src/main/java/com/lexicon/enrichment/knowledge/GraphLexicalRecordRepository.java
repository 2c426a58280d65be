package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.LexicalRecord;
import com.lexicon.enrichment.graph.CypherExecutor;
import com.lexicon.enrichment.graph.GraphRows;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Raw record store backed by FalkorDB.
 */
public class GraphLexicalRecordRepository implements LexicalRecordRepository {

    private final CypherExecutor executor;

    public GraphLexicalRecordRepository(CypherExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    @Override
    public void saveAll(Collection<LexicalRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        executor.mergeLexicalRecords(records.stream()
                .map(r -> CypherExecutor.params(
                        "id", r.id(),
                        "term", r.term(),
                        "gloss", r.gloss(),
                        "explanation", r.explanation(),
                        "featureType", r.featureType(),
                        "sourceTable", r.sourceTable()))
                .toList());
    }

    @Override
    public Page<LexicalRecord> findAll(PageRequest request) {
        return new Page<>(executor.findLexicalRecords(request.offset(), request.limit()).stream()
                .map(this::mapToRecord)
                .toList(), request);
    }

    @Override
    public long count() {
        return executor.countLexicalRecords();
    }

    private LexicalRecord mapToRecord(Map<String, Object> row) {
        return new LexicalRecord(
                GraphRows.string(row, "id"),
                GraphRows.string(row, "term"),
                GraphRows.string(row, "gloss"),
                GraphRows.string(row, "explanation"),
                GraphRows.string(row, "featureType"),
                GraphRows.string(row, "sourceTable"));
    }
}

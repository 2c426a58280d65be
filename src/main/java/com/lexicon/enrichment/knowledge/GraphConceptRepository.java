package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.core.model.*;
import com.lexicon.enrichment.graph.CypherExecutor;
import com.lexicon.enrichment.graph.GraphRows;
import com.lexicon.enrichment.graph.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * Concept store backed by FalkorDB.
 */
public class GraphConceptRepository implements ConceptRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphConceptRepository.class);

    private final CypherExecutor executor;

    public GraphConceptRepository(CypherExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    @Override
    public Concept upsert(Concept concept) {
        InputSanitizer.validateTerm(concept.getLabel());
        InputSanitizer.sanitizeForCypher(concept.getDefinition());
        InputSanitizer.sanitizeForCypher(concept.getNotes());
        String storedId = executor.upsertConcept(concept.getId(), concept.naturalKey(), concept.getLabel(),
                concept.getPartOfSpeech(), concept.getDefinition(), concept.getSenseId(), concept.getNotes());
        log.debug("concept.upserted naturalKey='{}' id={}", concept.naturalKey(), storedId);
        return concept.toBuilder().id(storedId).build();
    }

    @Override
    public Optional<Concept> findById(String id) {
        List<Map<String, Object>> rows = executor.findConceptById(id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToConcept(rows.get(0)));
    }

    @Override
    public Optional<Concept> findByNaturalKey(String naturalKey) {
        List<Map<String, Object>> rows = executor.findConceptByNaturalKey(naturalKey);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToConcept(rows.get(0)));
    }

    @Override
    public void linkTerm(TermLink link) {
        InputSanitizer.validateTerm(link.text());
        executor.linkTerm(link.text(), LexicalKeys.of(link.text()), link.language().code(), link.conceptId(),
                link.pronunciation(), link.gender(), link.pluralForm(), link.etymology(), link.note(),
                link.sourceName());
    }

    @Override
    public boolean createRelation(Relation relation) {
        InputSanitizer.validateRelationType(relation.getType());
        InputSanitizer.sanitizeForCypher(relation.getNote());
        String storedId = executor.mergeRelation(relation.getId(), relation.getSourceConceptId(),
                relation.getTargetConceptId(), relation.getType(), relation.getNote(), relation.getOrigin(),
                relation.getCreatedAt().toEpochMilli());
        if (storedId == null) {
            throw new IllegalArgumentException("Both ends of a relation must exist: " + relation);
        }
        return storedId.equals(relation.getId());
    }

    @Override
    public List<Relation> findRelationsFrom(String conceptId) {
        return executor.findRelationsFrom(conceptId).stream()
                .map(row -> Relation.builder()
                        .id(GraphRows.string(row, "id"))
                        .sourceConceptId(GraphRows.string(row, "sourceId"))
                        .targetConceptId(GraphRows.string(row, "targetId"))
                        .type(GraphRows.string(row, "type"))
                        .note(GraphRows.string(row, "note"))
                        .origin(GraphRows.string(row, "origin"))
                        .createdAt(Instant.ofEpochMilli(GraphRows.longValue(row, "createdAt", 0)))
                        .build())
                .toList();
    }

    @Override
    public long count() {
        return executor.countConcepts();
    }

    @Override
    public Optional<String> findIdByLabel(String label) {
        List<Map<String, Object>> rows = executor.findConceptIdByLabel(label);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(GraphRows.string(rows.get(0), "id"));
    }

    @Override
    public Optional<String> findIdBySourceTerm(String term) {
        List<Map<String, Object>> rows = executor.findConceptIdByTerm(term, Language.SOURCE.code());
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(GraphRows.string(rows.get(0), "id"));
    }

    @Override
    public Map<String, List<TermSense>> lookupSenses(Collection<String> words) {
        if (words.isEmpty()) {
            return Map.of();
        }
        Map<String, List<TermSense>> senses = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findSensesByNormalizedTerms(words, Language.SOURCE.code())) {
            senses.computeIfAbsent(GraphRows.string(row, "word"), k -> new ArrayList<>()).add(new TermSense(
                    GraphRows.string(row, "term"),
                    GraphRows.string(row, "conceptId"),
                    GraphRows.string(row, "conceptLabel"),
                    GraphRows.string(row, "partOfSpeech"),
                    GraphRows.string(row, "definition"),
                    GraphRows.string(row, "pronunciation"),
                    GraphRows.string(row, "gender"),
                    GraphRows.string(row, "pluralForm"),
                    GraphRows.string(row, "etymology"),
                    GraphRows.string(row, "note")));
        }
        return senses;
    }

    private Concept mapToConcept(Map<String, Object> row) {
        return Concept.builder()
                .id(GraphRows.string(row, "id"))
                .label(GraphRows.string(row, "label"))
                .partOfSpeech(GraphRows.string(row, "partOfSpeech"))
                .definition(GraphRows.string(row, "definition"))
                .senseId(GraphRows.string(row, "senseId"))
                .notes(GraphRows.string(row, "notes"))
                .build();
    }
}

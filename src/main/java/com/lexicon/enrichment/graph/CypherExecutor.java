package com.lexicon.enrichment.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cypher statements for the ledger and the knowledge base.
 *
 * <p>Graph layout:</p>
 * <pre>
 * (:WorkItem)                                    ledger rows
 * (:Term {text, language})-[:DENOTES]->(:Concept) dictionary
 * (:Concept)-[:RELATED {type}]->(:Concept)        cross-references
 * (:Highlight {key})                              one node per normalized key term
 * (:Translation {workItemId, variant})            enrichment output
 * (:LexicalRecord {id})                           raw idiom records
 * </pre>
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    private static final String WORK_ITEM_COLUMNS = """
            w.id AS id, w.sourceText AS sourceText, w.targetHint AS targetHint, w.parentId AS parentId,
            w.sequenceNumber AS sequenceNumber, w.kind AS kind, w.note AS note, w.status AS status,
            w.errorMessage AS errorMessage, w.updatedAt AS updatedAt
            """;

    private static final String CONCEPT_COLUMNS = """
            c.id AS id, c.label AS label, c.partOfSpeech AS partOfSpeech, c.definition AS definition,
            c.senseId AS senseId, c.notes AS notes
            """;

    private static final String HIGHLIGHT_COLUMNS = """
            h.keyTerm AS keyTerm, h.gloss AS gloss, h.explanation AS explanation, h.category AS category,
            h.relevance AS relevance, h.tags AS tags, h.sourceTable AS sourceTable, h.sourceIds AS sourceIds
            """;

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    // ========== Ledger ==========

    public long resetStaleWorkItems(long now) {
        String query = """
                MATCH (w:WorkItem)
                WHERE w.status IN ['processing', 'error']
                SET w.status = 'pending', w.errorMessage = null, w.updatedAt = $now
                RETURN count(w) AS updated
                """;
        return GraphRows.count(connection.query(query, Map.of("now", now)), "updated");
    }

    public long resetAllWorkItems(long now) {
        String query = """
                MATCH (w:WorkItem)
                WHERE w.status <> 'pending'
                SET w.status = 'pending', w.errorMessage = null, w.updatedAt = $now
                RETURN count(w) AS updated
                """;
        return GraphRows.count(connection.query(query, Map.of("now", now)), "updated");
    }

    /**
     * Pending items in the given order. The order clause comes from a fixed enum, never from input.
     */
    public List<Map<String, Object>> findPendingWorkItems(String orderClause, int offset, int limit) {
        String query = "MATCH (w:WorkItem) WHERE w.status = 'pending' RETURN " + WORK_ITEM_COLUMNS
                + " ORDER BY " + orderClause + " SKIP $offset LIMIT $limit";
        return connection.query(query, Map.of("offset", offset, "limit", limit));
    }

    public long markWorkItemsProcessing(Collection<String> ids, long now) {
        String query = """
                MATCH (w:WorkItem)
                WHERE w.id IN $ids AND w.status = 'pending'
                SET w.status = 'processing', w.updatedAt = $now
                RETURN count(w) AS updated
                """;
        return GraphRows.count(connection.query(query, Map.of("ids", List.copyOf(ids), "now", now)), "updated");
    }

    public long markWorkItemCompleted(String id, long now) {
        String query = """
                MATCH (w:WorkItem {id: $id})
                WHERE w.status = 'processing'
                SET w.status = 'completed', w.errorMessage = null, w.updatedAt = $now
                RETURN count(w) AS updated
                """;
        return GraphRows.count(connection.query(query, Map.of("id", id, "now", now)), "updated");
    }

    public long markWorkItemError(String id, String message, long now) {
        String query = """
                MATCH (w:WorkItem {id: $id})
                WHERE w.status IN ['pending', 'processing']
                SET w.status = 'error', w.errorMessage = $message, w.updatedAt = $now
                RETURN count(w) AS updated
                """;
        return GraphRows.count(connection.query(query, params("id", id, "message", message, "now", now)), "updated");
    }

    /**
     * Creates work items that do not exist yet; existing items keep their state.
     */
    public void mergeWorkItems(List<Map<String, Object>> rows) {
        String query = """
                UNWIND $rows AS row
                MERGE (w:WorkItem {id: row.id})
                ON CREATE SET w.sourceText = row.sourceText, w.targetHint = row.targetHint,
                              w.parentId = row.parentId, w.sequenceNumber = row.sequenceNumber,
                              w.kind = row.kind, w.note = row.note, w.status = 'pending',
                              w.updatedAt = row.updatedAt
                """;
        connection.execute(query, Map.of("rows", rows));
        log.debug("Merged {} work items", rows.size());
    }

    public List<Map<String, Object>> findWorkItemById(String id) {
        String query = "MATCH (w:WorkItem {id: $id}) RETURN " + WORK_ITEM_COLUMNS;
        return connection.query(query, Map.of("id", id));
    }

    public List<Map<String, Object>> findWorkItemsByParent(String parentId, int fromSequence, int toSequence) {
        String query = "MATCH (w:WorkItem) WHERE w.parentId = $parentId"
                + " AND w.sequenceNumber >= $fromSequence AND w.sequenceNumber <= $toSequence"
                + " RETURN " + WORK_ITEM_COLUMNS + " ORDER BY w.sequenceNumber, w.id";
        return connection.query(query, Map.of(
                "parentId", parentId,
                "fromSequence", fromSequence,
                "toSequence", toSequence
        ));
    }

    public List<Map<String, Object>> countWorkItemsByStatus() {
        return connection.query("MATCH (w:WorkItem) RETURN w.status AS status, count(w) AS total");
    }

    // ========== Concepts & Terms ==========

    /**
     * Upserts a concept by natural key and returns the id of the stored node.
     */
    public String upsertConcept(String id, String naturalKey, String label, String partOfSpeech,
                                String definition, String senseId, String notes) {
        String query = """
                MERGE (c:Concept {naturalKey: $naturalKey})
                ON CREATE SET c.id = $id
                SET c.label = $label, c.partOfSpeech = $partOfSpeech, c.definition = $definition,
                    c.senseId = $senseId, c.notes = $notes
                RETURN c.id AS id
                """;
        List<Map<String, Object>> rows = connection.query(query, params(
                "id", id,
                "naturalKey", naturalKey,
                "label", label,
                "partOfSpeech", partOfSpeech,
                "definition", definition,
                "senseId", senseId,
                "notes", notes
        ));
        return rows.isEmpty() ? id : GraphRows.string(rows.get(0), "id");
    }

    public List<Map<String, Object>> findConceptById(String id) {
        return connection.query("MATCH (c:Concept {id: $id}) RETURN " + CONCEPT_COLUMNS, Map.of("id", id));
    }

    public List<Map<String, Object>> findConceptByNaturalKey(String naturalKey) {
        return connection.query("MATCH (c:Concept {naturalKey: $naturalKey}) RETURN " + CONCEPT_COLUMNS,
                Map.of("naturalKey", naturalKey));
    }

    public List<Map<String, Object>> findConceptIdByLabel(String label) {
        String query = """
                MATCH (c:Concept)
                WHERE c.label = $label
                RETURN c.id AS id
                ORDER BY c.id
                LIMIT 1
                """;
        return connection.query(query, Map.of("label", label));
    }

    public List<Map<String, Object>> findConceptIdByTerm(String text, String language) {
        String query = """
                MATCH (t:Term {text: $text, language: $language})-[:DENOTES]->(c:Concept)
                RETURN c.id AS id
                ORDER BY c.id
                LIMIT 1
                """;
        return connection.query(query, Map.of("text", text, "language", language));
    }

    public void linkTerm(String text, String normalizedText, String language, String conceptId,
                         String pronunciation, String gender, String pluralForm,
                         String etymology, String note, String sourceName) {
        String query = """
                MERGE (t:Term {text: $text, language: $language})
                ON CREATE SET t.normalizedText = $normalizedText
                WITH t
                MATCH (c:Concept {id: $conceptId})
                MERGE (t)-[d:DENOTES]->(c)
                SET d.pronunciation = $pronunciation, d.gender = $gender, d.pluralForm = $pluralForm,
                    d.etymology = $etymology, d.note = $note, d.sourceName = $sourceName
                """;
        connection.execute(query, params(
                "text", text,
                "normalizedText", normalizedText,
                "language", language,
                "conceptId", conceptId,
                "pronunciation", pronunciation,
                "gender", gender,
                "pluralForm", pluralForm,
                "etymology", etymology,
                "note", note,
                "sourceName", sourceName
        ));
    }

    /**
     * Senses of every term whose normalized text is in {@code words}, in one round trip.
     */
    public List<Map<String, Object>> findSensesByNormalizedTerms(Collection<String> words, String language) {
        String query = """
                MATCH (t:Term)-[d:DENOTES]->(c:Concept)
                WHERE t.language = $language AND t.normalizedText IN $words
                RETURN t.normalizedText AS word, t.text AS term, c.id AS conceptId, c.label AS conceptLabel,
                       c.partOfSpeech AS partOfSpeech, c.definition AS definition,
                       d.pronunciation AS pronunciation, d.gender AS gender, d.pluralForm AS pluralForm,
                       d.etymology AS etymology, d.note AS note
                ORDER BY word, conceptId
                """;
        return connection.query(query, Map.of("words", List.copyOf(words), "language", language));
    }

    public long countConcepts() {
        return GraphRows.count(connection.query("MATCH (c:Concept) RETURN count(c) AS total"), "total");
    }

    // ========== Relations ==========

    /**
     * Creates the edge unless one with the same type already connects the two concepts.
     *
     * @return the id of the edge that now exists
     */
    public String mergeRelation(String id, String sourceId, String targetId, String type,
                                String note, String origin, long createdAt) {
        String query = """
                MATCH (s:Concept {id: $sourceId}), (t:Concept {id: $targetId})
                MERGE (s)-[r:RELATED {type: $type}]->(t)
                ON CREATE SET r.id = $id, r.note = $note, r.origin = $origin, r.createdAt = $createdAt
                RETURN r.id AS id
                """;
        List<Map<String, Object>> rows = connection.query(query, params(
                "id", id,
                "sourceId", sourceId,
                "targetId", targetId,
                "type", type,
                "note", note,
                "origin", origin,
                "createdAt", createdAt
        ));
        return rows.isEmpty() ? null : GraphRows.string(rows.get(0), "id");
    }

    public List<Map<String, Object>> findRelationsFrom(String sourceId) {
        String query = """
                MATCH (s:Concept {id: $sourceId})-[r:RELATED]->(t:Concept)
                RETURN r.id AS id, s.id AS sourceId, t.id AS targetId, r.type AS type,
                       r.note AS note, r.origin AS origin, r.createdAt AS createdAt
                ORDER BY r.createdAt
                """;
        return connection.query(query, Map.of("sourceId", sourceId));
    }

    // ========== Highlights ==========

    /**
     * Writes the highlight unless the stored one has an equal or higher relevance.
     * Runs as one statement, so concurrent upserts of the same key cannot interleave.
     */
    public List<Map<String, Object>> upsertHighlight(String key, String keyTerm, String gloss, String explanation,
                                                     String category, int relevance, List<String> tags,
                                                     String sourceTable, List<String> sourceIds) {
        String query = """
                OPTIONAL MATCH (existing:Highlight {key: $key})
                WITH existing.relevance AS previousRelevance, existing.gloss AS previousGloss
                MERGE (h:Highlight {key: $key})
                WITH h, previousRelevance, previousGloss,
                     (previousRelevance IS NULL OR previousRelevance < $relevance) AS replace
                SET h.keyTerm = CASE WHEN replace THEN $keyTerm ELSE h.keyTerm END,
                    h.gloss = CASE WHEN replace THEN $gloss ELSE h.gloss END,
                    h.explanation = CASE WHEN replace THEN $explanation ELSE h.explanation END,
                    h.category = CASE WHEN replace THEN $category ELSE h.category END,
                    h.relevance = CASE WHEN replace THEN $relevance ELSE h.relevance END,
                    h.tags = CASE WHEN replace THEN $tags ELSE h.tags END,
                    h.sourceTable = CASE WHEN replace THEN $sourceTable ELSE h.sourceTable END,
                    h.sourceIds = CASE WHEN replace THEN $sourceIds ELSE h.sourceIds END
                RETURN previousRelevance, previousGloss, replace
                """;
        return connection.query(query, params(
                "key", key,
                "keyTerm", keyTerm,
                "gloss", gloss,
                "explanation", explanation,
                "category", category,
                "relevance", relevance,
                "tags", tags,
                "sourceTable", sourceTable,
                "sourceIds", sourceIds
        ));
    }

    public List<Map<String, Object>> findHighlightByKey(String key) {
        return connection.query("MATCH (h:Highlight {key: $key}) RETURN " + HIGHLIGHT_COLUMNS, Map.of("key", key));
    }

    public List<Map<String, Object>> findHighlightsByMinRelevance(int minRelevance) {
        String query = "MATCH (h:Highlight) WHERE h.relevance >= $minRelevance RETURN " + HIGHLIGHT_COLUMNS
                + " ORDER BY h.relevance DESC, h.key";
        return connection.query(query, Map.of("minRelevance", minRelevance));
    }

    public List<Map<String, Object>> findHighlightKeys() {
        return connection.query("MATCH (h:Highlight) RETURN h.key AS key");
    }

    public List<Map<String, Object>> findHighlights(int offset, int limit) {
        String query = "MATCH (h:Highlight) RETURN " + HIGHLIGHT_COLUMNS + " ORDER BY h.key SKIP $offset LIMIT $limit";
        return connection.query(query, Map.of("offset", offset, "limit", limit));
    }

    public long countHighlights() {
        return GraphRows.count(connection.query("MATCH (h:Highlight) RETURN count(h) AS total"), "total");
    }

    // ========== Translations ==========

    public void deleteTranslations(String workItemId) {
        connection.execute("MATCH (r:Translation {workItemId: $workItemId}) DELETE r", Map.of("workItemId", workItemId));
    }

    public void createTranslations(List<Map<String, Object>> rows) {
        String query = """
                UNWIND $rows AS row
                CREATE (r:Translation {
                    workItemId: row.workItemId,
                    variant: row.variant,
                    cleanedText: row.cleanedText,
                    translation: row.translation,
                    confidence: row.confidence,
                    notes: row.notes
                })
                """;
        connection.execute(query, Map.of("rows", rows));
    }

    public List<Map<String, Object>> findTranslationsByWorkItem(String workItemId) {
        String query = """
                MATCH (r:Translation {workItemId: $workItemId})
                RETURN r.workItemId AS workItemId, r.variant AS variant, r.cleanedText AS cleanedText,
                       r.translation AS translation, r.confidence AS confidence, r.notes AS notes
                ORDER BY r.variant
                """;
        return connection.query(query, Map.of("workItemId", workItemId));
    }

    public List<Map<String, Object>> findTranslations(int offset, int limit) {
        String query = """
                MATCH (r:Translation)
                RETURN r.workItemId AS workItemId, r.variant AS variant, r.cleanedText AS cleanedText,
                       r.translation AS translation, r.confidence AS confidence, r.notes AS notes
                ORDER BY r.workItemId, r.variant
                SKIP $offset LIMIT $limit
                """;
        return connection.query(query, Map.of("offset", offset, "limit", limit));
    }

    public long countTranslations() {
        return GraphRows.count(connection.query("MATCH (r:Translation) RETURN count(r) AS total"), "total");
    }

    // ========== Lexical records ==========

    public void mergeLexicalRecords(List<Map<String, Object>> rows) {
        String query = """
                UNWIND $rows AS row
                MERGE (l:LexicalRecord {id: row.id})
                SET l.term = row.term, l.gloss = row.gloss, l.explanation = row.explanation,
                    l.featureType = row.featureType, l.sourceTable = row.sourceTable
                """;
        connection.execute(query, Map.of("rows", rows));
    }

    public List<Map<String, Object>> findLexicalRecords(int offset, int limit) {
        String query = """
                MATCH (l:LexicalRecord)
                RETURN l.id AS id, l.term AS term, l.gloss AS gloss, l.explanation AS explanation,
                       l.featureType AS featureType, l.sourceTable AS sourceTable
                ORDER BY l.id
                SKIP $offset LIMIT $limit
                """;
        return connection.query(query, Map.of("offset", offset, "limit", limit));
    }

    public long countLexicalRecords() {
        return GraphRows.count(connection.query("MATCH (l:LexicalRecord) RETURN count(l) AS total"), "total");
    }

    /**
     * Builds a parameter map from alternating names and values. Unlike {@code Map.of}, values may be null.
     */
    public static Map<String, Object> params(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("params requires name/value pairs");
        }
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            params.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return params;
    }
}

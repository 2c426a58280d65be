package com.lexicon.enrichment.persist;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexicon.enrichment.core.model.*;
import com.lexicon.enrichment.oracle.InvalidOracleResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Checks an oracle answer against the batch contract and turns it into {@link EnrichedResult}s.
 *
 * <p>A missing {@code results} array invalidates the whole answer. Otherwise every item is judged on its own:
 * an item without a result, or with an expansion lacking cleaned text, best translation or a numeric confidence,
 * fails with a message. Malformed highlights and cross-references are dropped without failing the item.</p>
 */
public class ResultValidator {
    private static final Logger log = LoggerFactory.getLogger(ResultValidator.class);

    static final double DEFAULT_ALTERNATIVE_CONFIDENCE = 0.8;

    /**
     * @throws InvalidOracleResponseException if the answer has no {@code results} array
     */
    public ValidatedBatch validate(JsonNode answer, List<WorkItem> batch) {
        if (answer == null || !answer.isObject() || !answer.path("results").isArray()) {
            throw new InvalidOracleResponseException("Oracle answer has no results array");
        }
        Map<String, WorkItem> itemsById = new LinkedHashMap<>();
        batch.forEach(item -> itemsById.put(item.getId(), item));

        Map<String, JsonNode> resultsById = new HashMap<>();
        for (JsonNode result : answer.get("results")) {
            String id = text(result, "original_id");
            if (id == null || !itemsById.containsKey(id)) {
                log.warn("validation.unknown_result original_id={}", id);
                continue;
            }
            if (resultsById.putIfAbsent(id, result) != null) {
                log.warn("validation.duplicate_result original_id={}", id);
            }
        }

        Map<String, EnrichedResult> valid = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (WorkItem item : itemsById.values()) {
            try {
                valid.put(item.getId(), toEnrichedResult(item, resultsById.get(item.getId())));
            } catch (ResultValidationException e) {
                log.warn("validation.failed workItemId={} reason={}", item.getId(), e.getMessage());
                failures.put(item.getId(), e.getMessage());
            }
        }
        return new ValidatedBatch(valid, failures);
    }

    EnrichedResult toEnrichedResult(WorkItem item, JsonNode result) {
        String id = item.getId();
        if (result == null) {
            throw new ResultValidationException(id, "No result returned for this item");
        }
        JsonNode expansions = result.path("expansions");
        if (!expansions.isArray() || expansions.isEmpty()) {
            throw new ResultValidationException(id, "Result has no expansions");
        }

        List<TranslationRecord> translations = new ArrayList<>();
        List<Highlight> highlights = new ArrayList<>();
        List<CrossReference> references = new ArrayList<>();
        int alternativeIndex = 0;
        int expansionIndex = 0;
        for (JsonNode expansion : expansions) {
            expansionIndex++;
            String cleaned = text(expansion, "cleaned_text");
            String best = text(expansion, "best_translation");
            JsonNode confidence = expansion.path("confidence_score");
            if (cleaned == null) {
                throw new ResultValidationException(id, "Expansion " + expansionIndex + " has no cleaned_text");
            }
            if (best == null) {
                throw new ResultValidationException(id, "Expansion " + expansionIndex + " has no best_translation");
            }
            if (!confidence.isNumber()) {
                throw new ResultValidationException(id, "Expansion " + expansionIndex + " has no numeric confidence_score");
            }
            translations.add(new TranslationRecord(id, cleaned, best, confidence.asDouble(),
                    text(expansion, "notes"), TranslationRecord.BEST));

            for (JsonNode alternative : expansion.path("alternative_translations")) {
                String translation = text(alternative, "translation");
                if (translation == null) {
                    continue;
                }
                JsonNode score = alternative.path("confidence_score");
                translations.add(new TranslationRecord(id, cleaned, translation,
                        score.isNumber() ? score.asDouble() : DEFAULT_ALTERNATIVE_CONFIDENCE,
                        text(alternative, "notes"), TranslationRecord.alternative(++alternativeIndex)));
            }

            for (JsonNode highlight : expansion.path("discovered_highlights")) {
                toHighlight(item, highlight).ifPresent(highlights::add);
            }
            for (JsonNode reference : expansion.path("cross_references")) {
                toCrossReference(id, reference).ifPresent(references::add);
            }
        }
        return new EnrichedResult(id, translations, highlights, references);
    }

    private Optional<Highlight> toHighlight(WorkItem item, JsonNode node) {
        String phrase = text(node, "phrase");
        JsonNode relevance = node.path("relevance_score");
        if (phrase == null || !relevance.isNumber()) {
            log.warn("validation.highlight_skipped workItemId={} phrase='{}' reason=missing phrase or relevance",
                    item.getId(), phrase);
            return Optional.empty();
        }
        int score = (int) Math.round(relevance.asDouble());
        score = Math.max(Highlight.MIN_RELEVANCE, Math.min(Highlight.MAX_RELEVANCE, score));
        return Optional.of(new Highlight(phrase, text(node, "gloss"), text(node, "explanation"),
                text(node, "type"), score, List.of(), item.getKind().sourceTable(), List.of(item.getId())));
    }

    private Optional<CrossReference> toCrossReference(String workItemId, JsonNode node) {
        String target = text(node, "target_term");
        String type = Relation.normalizeType(text(node, "relation_type"));
        if (target == null || type == null) {
            log.warn("validation.reference_skipped workItemId={} target='{}'", workItemId, target);
            return Optional.empty();
        }
        return Optional.of(new CrossReference(target, type, text(node, "note")));
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

package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lexicon.enrichment.context.EnrichmentContext;
import com.lexicon.enrichment.context.ItemContext;
import com.lexicon.enrichment.core.model.Concept;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.core.model.TermSense;
import com.lexicon.enrichment.core.model.WorkItem;

import java.util.*;

/**
 * Renders the batch prompt for correcting, translating and annotating work items.
 * Only the JSON contract of the answer is fixed; the wording may change.
 */
public class EnrichmentPromptBuilder {

    static final int MAX_KNOWN_HIGHLIGHTS = 100;

    private final ObjectMapper objectMapper;

    public EnrichmentPromptBuilder() {
        this(new ObjectMapper());
    }

    public EnrichmentPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    public String build(EnrichmentContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert linguist for Heligolandic Frisian (Halunder) and German. ");
        prompt.append("Clean every source sentence below and translate it into natural German.\n\n");

        prompt.append("Instructions:\n");
        prompt.append("1. cleaned_text starts with a capital letter and ends with punctuation. So do all translations.\n");
        prompt.append("2. A sentence with slash alternatives (a/b/c) is expanded into one expansion per alternative.\n");
        prompt.append("3. best_translation is the most natural German rendering; literal renderings go to alternative_translations.\n");
        prompt.append("4. Report idioms and notable phrases as discovered_highlights with a relevance_score from 0 to 10.\n");
        prompt.append("5. Report references to other dictionary headwords as cross_references.\n\n");

        prompt.append("Dictionary context for individual words:\n");
        prompt.append(toJson(wordContext(context))).append("\n\n");

        prompt.append("Known idioms and cultural references:\n");
        prompt.append(toJson(knownHighlights(context))).append("\n\n");

        prompt.append("Items to process:\n");
        prompt.append(toJson(inputItems(context))).append("\n\n");

        prompt.append("Answer with a single JSON object. The results array follows the order of the items:\n");
        prompt.append("""
                {"results":[{"original_id":"<id of the item>","expansions":[{
                  "cleaned_text":"...","best_translation":"...","confidence_score":0.9,"notes":"...",
                  "alternative_translations":[{"translation":"...","confidence_score":0.8,"notes":"..."}],
                  "discovered_highlights":[{"phrase":"...","gloss":"...","explanation":"...","type":"idiom","relevance_score":8}],
                  "cross_references":[{"target_term":"...","relation_type":"see_also","note":"..."}]}]}]}
                """);
        return prompt.toString();
    }

    private ObjectNode wordContext(EnrichmentContext context) {
        Map<String, List<TermSense>> merged = new TreeMap<>();
        for (ItemContext item : context.items()) {
            merged.putAll(item.senses());
        }
        ObjectNode words = objectMapper.createObjectNode();
        merged.forEach((word, senses) -> {
            ArrayNode array = words.putArray(word);
            for (TermSense sense : senses) {
                ObjectNode node = array.addObject();
                node.put("term", sense.term());
                node.put("headword", sense.conceptLabel());
                putIfPresent(node, "part_of_speech", sense.partOfSpeech());
                putIfPresent(node, "definition", sense.definition());
                putIfPresent(node, "gender", sense.gender());
                putIfPresent(node, "plural", sense.pluralForm());
                putIfPresent(node, "pronunciation", sense.pronunciation());
                putIfPresent(node, "etymology", sense.etymology());
                putIfPresent(node, "note", sense.note());
            }
        });
        return words;
    }

    private ArrayNode knownHighlights(EnrichmentContext context) {
        Map<String, Highlight> unique = new LinkedHashMap<>();
        for (ItemContext item : context.items()) {
            for (Highlight highlight : item.highlights()) {
                unique.putIfAbsent(highlight.normalizedKey(), highlight);
            }
        }
        ArrayNode array = objectMapper.createArrayNode();
        unique.values().stream().limit(MAX_KNOWN_HIGHLIGHTS).forEach(h -> {
            ObjectNode node = array.addObject();
            node.put("phrase", h.keyTerm());
            putIfPresent(node, "gloss", h.gloss());
            putIfPresent(node, "explanation", h.explanation());
        });
        return array;
    }

    private ArrayNode inputItems(EnrichmentContext context) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ItemContext itemContext : context.items()) {
            WorkItem item = itemContext.item();
            ObjectNode node = array.addObject();
            node.put("original_id", item.getId());
            node.put("source_text", item.getSourceText());
            putIfPresent(node, "target_hint", item.getTargetHint());
            putIfPresent(node, "note", item.getNote());
            Concept parent = itemContext.parentConcept();
            if (parent != null) {
                ObjectNode headword = node.putObject("headword_context");
                headword.put("headword", parent.getLabel());
                putIfPresent(headword, "part_of_speech", parent.getPartOfSpeech());
                putIfPresent(headword, "definition", parent.getDefinition());
            }
            if (!itemContext.neighbours().isEmpty()) {
                ArrayNode neighbours = node.putArray("neighbouring_sentences");
                itemContext.neighbours().forEach(n -> neighbours.add(n.getSourceText()));
            }
        }
        return array;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null && !value.isBlank()) {
            node.put(field, value);
        }
    }

    private String toJson(Object node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render prompt context", e);
        }
    }
}

package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lexicon.enrichment.core.model.Cluster;

import java.util.List;
import java.util.Objects;

/**
 * Renders the prompt that condenses clusters of raw idiom records into highlights.
 */
public class HighlightPromptBuilder {

    private final ObjectMapper objectMapper;

    public HighlightPromptBuilder() {
        this(new ObjectMapper());
    }

    public HighlightPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    public String build(List<Cluster> clusters) {
        ArrayNode input = objectMapper.createArrayNode();
        for (Cluster cluster : clusters) {
            ObjectNode node = input.addObject();
            node.put("original_key", cluster.representativeKey());
            node.put("term", cluster.primary().term());
            if (cluster.primary().gloss() != null) {
                node.put("gloss", cluster.primary().gloss());
            }
            node.put("explanations", cluster.mergedExplanation());
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert linguist for Heligolandic Frisian (Halunder). ");
        prompt.append("The records below are translation aids that help a reader understand why a word is used.\n");
        prompt.append("For every record:\n");
        prompt.append("1. Condense the explanations (separated by ++) into one clean explanation of up to a few sentences. ");
        prompt.append("Drop duplicates and keep the most interesting facts.\n");
        prompt.append("2. Rate the relevance from 0 to 10. Cultural meaning and unexpected senses rate high, ");
        prompt.append("plain plural forms or direct translations rate low.\n");
        prompt.append("3. Pick tags from: cultural, idiom, grammar, false_friend, misspelling, etymology, person, ");
        prompt.append("place, building, date, maritime, food, tradition, archaic.\n\n");
        prompt.append("Records:\n");
        prompt.append(toJson(input)).append("\n\n");
        prompt.append("Answer with a single JSON object:\n");
        prompt.append("""
                {"entries":[{"original_key":"<original_key of the record>","term":"...","gloss":"...",
                  "explanation":"...","feature_type":"primary","relevance_score":5,"tags":["cultural"]}]}
                """);
        return prompt.toString();
    }

    private String toJson(Object node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render prompt input", e);
        }
    }
}

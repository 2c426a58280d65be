package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Pattern;

/**
 * Parsing of oracle answers, which are sometimes wrapped in markdown code fences.
 */
public final class JsonPayloads {

    private static final Pattern OPENING_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\s*```$");
    private static final int EXCERPT_LENGTH = 200;

    private JsonPayloads() {
    }

    public static String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        trimmed = OPENING_FENCE.matcher(trimmed).replaceFirst("");
        return CLOSING_FENCE.matcher(trimmed).replaceFirst("").trim();
    }

    /**
     * Parses the answer after stripping code fences.
     *
     * @throws InvalidOracleResponseException if the text is empty or not JSON
     */
    public static JsonNode parse(ObjectMapper mapper, String text) {
        String json = stripCodeFences(text);
        if (json.isEmpty()) {
            throw new InvalidOracleResponseException("Oracle returned an empty answer");
        }
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new InvalidOracleResponseException("Oracle returned an empty answer");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new InvalidOracleResponseException("Oracle returned invalid JSON: " + excerpt(json), e);
        }
    }

    static String excerpt(String text) {
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH) + "...";
    }
}

package com.lexicon.enrichment.persist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexicon.enrichment.core.model.*;
import com.lexicon.enrichment.oracle.InvalidOracleResponseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultValidator Tests")
class ResultValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResultValidator validator = new ResultValidator();

    private static final WorkItem W1 = WorkItem.builder().id("w1").sourceText("Dåt Hus es grot.").build();
    private static final WorkItem W2 = WorkItem.builder().id("w2").sourceText("Hi/Jü kumt.")
            .kind(WorkItemKind.DICTIONARY_EXAMPLE).build();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    @Nested
    @DisplayName("Whole answer")
    class WholeAnswer {

        @Test
        @DisplayName("Should reject an empty object")
        void emptyObject() throws Exception {
            JsonNode answer = json("{}");
            assertThrows(InvalidOracleResponseException.class, () -> validator.validate(answer, List.of(W1)));
        }

        @Test
        @DisplayName("Should reject a results field that is not an array")
        void resultsNotArray() throws Exception {
            JsonNode answer = json("{'results':{}}");
            assertThrows(InvalidOracleResponseException.class, () -> validator.validate(answer, List.of(W1)));
            assertThrows(InvalidOracleResponseException.class, () -> validator.validate(null, List.of(W1)));
        }
    }

    @Nested
    @DisplayName("Per item")
    class PerItem {

        @Test
        @DisplayName("Should map best and alternative translations across expansions")
        void translations() throws Exception {
            JsonNode answer = json("""
                    {'results':[{'original_id':'w2','expansions':[
                      {'cleaned_text':'Hi kumt.','best_translation':'Er kommt.','confidence_score':0.9,
                       'alternative_translations':[{'translation':'Er naht.'}]},
                      {'cleaned_text':'Jü kumt.','best_translation':'Sie kommt.','confidence_score':0.85,
                       'alternative_translations':[{'translation':'Sie naht.','confidence_score':0.5}]}]}]}
                    """);

            EnrichedResult result = validator.validate(answer, List.of(W2)).result("w2").orElseThrow();

            assertEquals(List.of("best", "alternative_1", "best", "alternative_2"),
                    result.translations().stream().map(TranslationRecord::variant).toList());
            assertEquals(ResultValidator.DEFAULT_ALTERNATIVE_CONFIDENCE, result.translations().get(1).confidence());
            assertEquals(0.5, result.translations().get(3).confidence());
        }

        @Test
        @DisplayName("Should fail only the item whose result is missing or incomplete")
        void perItemFailures() throws Exception {
            JsonNode answer = json("""
                    {'results':[{'original_id':'w1','expansions':[
                      {'cleaned_text':'Dåt Hus es grot.','best_translation':'','confidence_score':0.9}]},
                      {'original_id':'stray','expansions':[]}]}
                    """);

            ValidatedBatch batch = validator.validate(answer, List.of(W1, W2));

            assertTrue(batch.results().isEmpty());
            assertEquals("Expansion 1 has no best_translation", batch.failure("w1").orElseThrow());
            assertEquals("No result returned for this item", batch.failure("w2").orElseThrow());
        }

        @Test
        @DisplayName("Should require a numeric confidence")
        void numericConfidence() throws Exception {
            JsonNode answer = json("""
                    {'results':[{'original_id':'w1','expansions':[
                      {'cleaned_text':'Dåt Hus es grot.','best_translation':'Das Haus ist groß.','confidence_score':'high'}]}]}
                    """);

            assertEquals("Expansion 1 has no numeric confidence_score",
                    validator.validate(answer, List.of(W1)).failure("w1").orElseThrow());
        }

        @Test
        @DisplayName("Should clamp highlight relevance and drop malformed highlights and references")
        void highlightsAndReferences() throws Exception {
            JsonNode answer = json("""
                    {'results':[{'original_id':'w2','expansions':[
                      {'cleaned_text':'Hi kumt.','best_translation':'Er kommt.','confidence_score':0.9,
                       'discovered_highlights':[
                         {'phrase':'hi kumt','gloss':'er kommt','type':'idiom','relevance_score':14},
                         {'phrase':'no score'}],
                       'cross_references':[
                         {'target_term':'kum','relation_type':'See Also'},
                         {'target_term':'gung'}]}]}]}
                    """);

            EnrichedResult result = validator.validate(answer, List.of(W2)).result("w2").orElseThrow();

            assertEquals(1, result.highlights().size());
            Highlight highlight = result.highlights().get(0);
            assertEquals(10, highlight.relevance());
            assertEquals("dictionary_examples", highlight.sourceTable());
            assertEquals(List.of("w2"), highlight.sourceIds());
            assertEquals(List.of(new CrossReference("kum", "see_also", null)), result.crossReferences());
        }
    }
}

package com.lexicon.enrichment.bulk;

import com.lexicon.enrichment.core.model.*;
import com.lexicon.enrichment.knowledge.InMemoryConceptRepository;
import com.lexicon.enrichment.ledger.InMemoryJobLedger;
import com.lexicon.enrichment.ledger.WorkOrdering;
import com.lexicon.enrichment.resolution.ResolutionCascade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonDictionaryImporter Tests")
class JsonDictionaryImporterTest {

    private static final String DICTIONARY = """
            [
              {"headword": "Haus", "partOfSpeech": "noun", "germanDefinition": "Gebäude zum Wohnen",
               "usageNotes": ["häufig", "auch übertragen"],
               "translations": [{"term": "Hüs", "gender": "n", "plural": "Hüsen"}],
               "examples": [
                 {"halunder": "Dåt Hüs es grot.", "german": "Das Haus ist groß."},
                 {"halunder": "  "},
                 {"halunder": "Ik gung to Hüs.", "german": "Ich gehe nach Hause."}],
               "relations": [
                 {"targetTerm": "Hof", "type": "See Also"},
                 {"targetTerm": "Nowhere", "type": "synonym"},
                 {"targetTerm": "Hüs", "type": "synonym"}]},
              {"headword": "Hof", "translations": [{"term": "Hoow"}],
               "relations": [{"targetTerm": "Hüs", "type": "related"}, {"targetTerm": "Haus"}]},
              {"partOfSpeech": "noun"}
            ]
            """;

    private InMemoryConceptRepository concepts;
    private InMemoryJobLedger ledger;
    private JsonDictionaryImporter importer;

    @BeforeEach
    void setUp() {
        concepts = new InMemoryConceptRepository();
        ledger = new InMemoryJobLedger();
        importer = new JsonDictionaryImporter(concepts, ledger, ResolutionCascade.standard(concepts));
    }

    private String id(String label) {
        return concepts.findIdByLabel(label).orElseThrow();
    }

    @Nested
    @DisplayName("Two-pass import")
    class TwoPass {

        @Test
        @DisplayName("Should upsert concepts, link terms and enqueue examples")
        void firstPass() {
            ImportResult result = importer.importEntries(new StringReader(DICTIONARY), "halunder.json", null);

            assertEquals(3, result.totalEntries());
            assertEquals(2, result.conceptsUpserted());
            assertEquals(4, result.termsLinked());
            assertEquals(2, result.examplesEnqueued());
            Concept haus = concepts.findById(id("Haus")).orElseThrow();
            assertEquals("häufig; auch übertragen", haus.getNotes());
            assertEquals(id("Haus"), concepts.findIdBySourceTerm("Hüs").orElseThrow());

            List<WorkItem> examples = ledger.selectPending(10, WorkOrdering.PARENT_THEN_SEQUENCE);
            assertEquals(List.of(1, 2), examples.stream().map(WorkItem::getSequenceNumber).toList());
            WorkItem first = examples.get(0);
            assertEquals(WorkItemKind.DICTIONARY_EXAMPLE, first.getKind());
            assertEquals(id("Haus"), first.getParentId());
            assertEquals("Das Haus ist groß.", first.getTargetHint());
        }

        @Test
        @DisplayName("Should resolve relations to headwords that appear later in the file")
        void secondPass() {
            ImportResult result = importer.importEntries(new StringReader(DICTIONARY), "halunder.json", null);

            assertEquals(2, result.relationsCreated());
            assertEquals(1, result.relationsUnresolved());
            List<Relation> fromHaus = concepts.findRelationsFrom(id("Haus"));
            assertEquals(1, fromHaus.size());
            assertEquals(id("Hof"), fromHaus.get(0).getTargetConceptId());
            assertEquals("see_also", fromHaus.get(0).getType());
            assertEquals("halunder.json", fromHaus.get(0).getOrigin());
            assertEquals(id("Haus"), concepts.findRelationsFrom(id("Hof")).get(0).getTargetConceptId());
        }

        @Test
        @DisplayName("Should report entries without headword and relations without type")
        void errors() {
            ImportResult result = importer.importEntries(new StringReader(DICTIONARY), "halunder.json", null);

            assertEquals(2, result.errorCount());
            assertEquals(new ImportResult.ImportError(3, "", "Entry has no headword"), result.errors().get(0));
            assertEquals(new ImportResult.ImportError(2, "Hof", "Relation without target term or type"),
                    result.errors().get(1));
        }

        @Test
        @DisplayName("Should enqueue nothing new when the same file is imported twice")
        void idempotent() {
            importer.importEntries(new StringReader(DICTIONARY), "halunder.json", null);
            ImportResult again = importer.importEntries(new StringReader(DICTIONARY), "halunder.json", null);

            assertEquals(0, again.examplesEnqueued());
            assertEquals(0, again.relationsCreated());
            assertEquals(2, concepts.count());
            assertEquals(2, ledger.size());
        }

        @Test
        @DisplayName("Should report progress until completion")
        void progress() {
            List<String> messages = new ArrayList<>();

            importer.importEntries(new ByteArrayInputStream(DICTIONARY.getBytes(StandardCharsets.UTF_8)),
                    "halunder.json", (processed, total, message) -> messages.add(processed + "/" + total + " " + message));

            assertEquals("6/6 Import completed", messages.get(messages.size() - 1));
        }
    }

    @Nested
    @DisplayName("Input formats")
    class Formats {

        @Test
        @DisplayName("Should accept an object with an entries array inside code fences")
        void wrapped() {
            String content = "```json\n{\"entries\": [{\"headword\": \"Boot\", \"unknownField\": 1}]}\n```";

            ImportResult result = importer.importEntries(new StringReader(content), "boats.json", null);

            assertEquals(1, result.conceptsUpserted());
            assertFalse(result.hasErrors());
        }

        @Test
        @DisplayName("Should return an input-level error for malformed JSON")
        void malformed() {
            ImportResult result = importer.importEntries(new StringReader("[{\"headword\": "), "broken.json", null);

            assertEquals(0, result.totalEntries());
            assertEquals(0, result.errors().get(0).entryNumber());
            assertTrue(result.errors().get(0).message().startsWith("Invalid dictionary JSON"));
        }

        @Test
        @DisplayName("Should reject JSON that is not a list of entries")
        void notAList() {
            ImportResult result = importer.importEntries(new StringReader("\"Haus\""), "odd.json", null);

            assertEquals("Dictionary file must contain a JSON array of entries", result.errors().get(0).message());
        }
    }
}

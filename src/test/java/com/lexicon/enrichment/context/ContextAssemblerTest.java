package com.lexicon.enrichment.context;

import com.lexicon.enrichment.core.model.*;
import com.lexicon.enrichment.knowledge.ConceptRepository;
import com.lexicon.enrichment.knowledge.InMemoryHighlightRepository;
import com.lexicon.enrichment.ledger.InMemoryJobLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ContextAssembler Tests")
class ContextAssemblerTest {

    @Mock
    private ConceptRepository concepts;

    private InMemoryHighlightRepository highlights;
    private InMemoryJobLedger ledger;

    @BeforeEach
    void setUp() {
        highlights = new InMemoryHighlightRepository();
        ledger = spy(new InMemoryJobLedger());
    }

    private static WorkItem item(String id, String text, String parentId, int sequence) {
        return WorkItem.builder().id(id).sourceText(text).parentId(parentId).sequenceNumber(sequence).build();
    }

    private static Highlight highlight(String key, int relevance) {
        return new Highlight(key, "gloss of " + key, null, "idiom", relevance, List.of(), "idioms", List.of());
    }

    @Test
    @DisplayName("Should look up senses for the whole batch in one call")
    void oneSenseLookupPerBatch() {
        when(concepts.lookupSenses(anyCollection())).thenReturn(Map.of(
                "hus", List.of(TermSense.of("Hus", "c-house", "Haus"))));
        ContextAssembler assembler = new ContextAssembler(concepts, highlights, ledger, ContextOptions.withoutWindow());

        EnrichmentContext context = assembler.assemble(List.of(
                item("a", "Dåt Hus es grot.", null, 0),
                item("b", "Hus en Hof.", null, 0),
                item("c", "Nix.", null, 0)), List.of());

        verify(concepts, times(1)).lookupSenses(anyCollection());
        assertEquals(3, context.size());
        assertEquals(Map.of("hus", List.of(TermSense.of("Hus", "c-house", "Haus"))),
                context.find("a").orElseThrow().senses());
        assertTrue(context.find("c").orElseThrow().senses().isEmpty());
    }

    @Test
    @DisplayName("Should attach known highlights found in the sentence, case-insensitively")
    void matchesHighlights() {
        when(concepts.lookupSenses(anyCollection())).thenReturn(Map.of());
        highlights.upsert(highlight("Wat'n Wedder", 8));
        highlights.upsert(highlight("rum gung", 9));
        highlights.upsert(highlight("ful Sünn", 3));
        ContextAssembler assembler = new ContextAssembler(concepts, highlights, ledger, ContextOptions.withoutWindow());

        List<Highlight> known = assembler.loadKnownHighlights();
        EnrichmentContext context = assembler.assemble(List.of(item("a", "WAT'N WEDDER vondoog!", null, 0)), known);

        assertEquals(2, known.size());
        assertEquals(List.of("Wat'n Wedder"),
                context.find("a").orElseThrow().highlights().stream().map(Highlight::keyTerm).toList());
    }

    @Test
    @DisplayName("Should fetch each parent concept once and attach neighbouring sentences")
    void parentAndNeighbours() {
        Concept parent = Concept.builder().id("c1").label("Haus").build();
        when(concepts.lookupSenses(anyCollection())).thenReturn(Map.of());
        when(concepts.findById("c1")).thenReturn(Optional.of(parent));
        ledger.enqueue(List.of(
                item("s1", "Iaars.", "c1", 1),
                item("s2", "Dan.", "c1", 2),
                item("s3", "Noch.", "c1", 3),
                item("s4", "Leest.", "c1", 4),
                item("s5", "Fiar wech.", "c1", 7)));
        ContextAssembler assembler = new ContextAssembler(concepts, highlights, ledger, ContextOptions.defaults());

        EnrichmentContext context = assembler.assemble(List.of(
                ledger.get("s2").orElseThrow(), ledger.get("s3").orElseThrow()), List.of());

        verify(concepts, times(1)).findById("c1");
        ItemContext s2 = context.find("s2").orElseThrow();
        assertEquals(Optional.of(parent), s2.parent());
        assertEquals(List.of("s1", "s3", "s4"), s2.neighbours().stream().map(WorkItem::getId).toList());
    }

    @Test
    @DisplayName("Should read the ledger once per parent and slice each item's window from it")
    void oneNeighbourReadPerParent() {
        when(concepts.lookupSenses(anyCollection())).thenReturn(Map.of());
        when(concepts.findById(anyString())).thenReturn(Optional.empty());
        ledger.enqueue(List.of(
                item("s1", "Iaars.", "c1", 1),
                item("s2", "Dan.", "c1", 2),
                item("s3", "Noch.", "c1", 3),
                item("s4", "Leest.", "c1", 4),
                item("s5", "Fiar wech.", "c1", 7),
                item("t1", "Een.", "c2", 1),
                item("t2", "Twee.", "c2", 2)));
        ContextAssembler assembler = new ContextAssembler(concepts, highlights, ledger, ContextOptions.defaults());

        EnrichmentContext context = assembler.assemble(List.of(
                ledger.get("s2").orElseThrow(),
                ledger.get("s3").orElseThrow(),
                ledger.get("t2").orElseThrow()), List.of());

        verify(ledger, times(1)).findByParent("c1", 0, 5);
        verify(ledger, times(1)).findByParent(eq("c2"), anyInt(), anyInt());
        verify(ledger, times(2)).findByParent(anyString(), anyInt(), anyInt());
        assertEquals(List.of("s1", "s3", "s4"),
                context.find("s2").orElseThrow().neighbours().stream().map(WorkItem::getId).toList());
        assertEquals(List.of("s1", "s2", "s4"),
                context.find("s3").orElseThrow().neighbours().stream().map(WorkItem::getId).toList());
        assertEquals(List.of("t1"),
                context.find("t2").orElseThrow().neighbours().stream().map(WorkItem::getId).toList());
    }

    @Test
    @DisplayName("Should skip neighbours and parent for items without a parent")
    void noParent() {
        when(concepts.lookupSenses(anyCollection())).thenReturn(Map.of());
        ContextAssembler assembler = new ContextAssembler(concepts, highlights, ledger, ContextOptions.defaults());

        ItemContext context = assembler.assemble(List.of(item("a", "Hus.", null, 0)), List.of())
                .find("a").orElseThrow();

        assertTrue(context.parent().isEmpty());
        assertTrue(context.neighbours().isEmpty());
        verify(concepts, never()).findById(any());
    }

    @Test
    @DisplayName("Should tokenize into unique lower-case words")
    void tokenizer() {
        assertEquals(List.of("wat'n", "wedder", "wat", "2"), WordTokenizer.tokenize("Wat'n Wedder, wat? WEDDER 2!"));
        assertTrue(WordTokenizer.tokenize("  ").isEmpty());
    }
}

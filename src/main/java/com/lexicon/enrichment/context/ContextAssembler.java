package com.lexicon.enrichment.context;

import com.lexicon.enrichment.core.model.Concept;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.core.model.TermSense;
import com.lexicon.enrichment.core.model.WorkItem;
import com.lexicon.enrichment.knowledge.ConceptRepository;
import com.lexicon.enrichment.knowledge.HighlightRepository;
import com.lexicon.enrichment.ledger.JobLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the read-only context sent to the oracle with a batch of work items.
 *
 * <p>Dictionary senses are fetched with a single {@link DictionaryLookup#lookupSenses} call per batch.
 * Neighbouring sentences are read once per parent. Known highlights are loaded once per run through {@link #loadKnownHighlights()} and matched by
 * case-insensitive substring.</p>
 */
public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final ConceptRepository concepts;
    private final HighlightRepository highlights;
    private final JobLedger ledger;
    private final ContextOptions options;

    public ContextAssembler(ConceptRepository concepts, HighlightRepository highlights, JobLedger ledger,
                            ContextOptions options) {
        this.concepts = Objects.requireNonNull(concepts, "concepts is required");
        this.highlights = Objects.requireNonNull(highlights, "highlights is required");
        this.ledger = Objects.requireNonNull(ledger, "ledger is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    public ContextOptions getOptions() {
        return options;
    }

    /**
     * Highlights relevant enough to be shown to the oracle as known phrases.
     */
    public List<Highlight> loadKnownHighlights() {
        List<Highlight> known = highlights.findByMinRelevance(options.minHighlightRelevance());
        log.info("context.highlights_loaded count={} minRelevance={}", known.size(), options.minHighlightRelevance());
        return known;
    }

    public EnrichmentContext assemble(List<WorkItem> batch, List<Highlight> knownHighlights) {
        Set<String> words = WordTokenizer.tokenizeAll(batch.stream().map(WorkItem::getSourceText).toList());
        Map<String, List<TermSense>> senses = words.isEmpty() ? Map.of() : concepts.lookupSenses(words);
        log.debug("context.senses words={} matched={}", words.size(), senses.size());

        Map<String, List<WorkItem>> siblings = loadSiblings(batch);
        Map<String, Optional<Concept>> parents = new HashMap<>();
        List<ItemContext> items = new ArrayList<>(batch.size());
        for (WorkItem item : batch) {
            Map<String, List<TermSense>> itemSenses = new LinkedHashMap<>();
            for (String word : WordTokenizer.tokenize(item.getSourceText())) {
                List<TermSense> found = senses.get(word);
                if (found != null) {
                    itemSenses.put(word, found);
                }
            }
            Concept parent = null;
            if (item.getParentId() != null) {
                parent = parents.computeIfAbsent(item.getParentId(), concepts::findById).orElse(null);
            }
            items.add(new ItemContext(item, itemSenses, matchHighlights(item.getSourceText(), knownHighlights),
                    parent, neighbours(item, siblings)));
        }
        return new EnrichmentContext(items);
    }

    static List<Highlight> matchHighlights(String text, List<Highlight> known) {
        if (text == null || known.isEmpty()) {
            return List.of();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        return known.stream()
                .filter(h -> haystack.contains(h.keyTerm().toLowerCase(Locale.ROOT)))
                .toList();
    }

    /**
     * One ledger read per parent, covering the windows of all of its items in the batch.
     */
    private Map<String, List<WorkItem>> loadSiblings(List<WorkItem> batch) {
        if (!options.hasWindow()) {
            return Map.of();
        }
        Map<String, SequenceRange> ranges = new LinkedHashMap<>();
        for (WorkItem item : batch) {
            if (item.getParentId() != null) {
                ranges.merge(item.getParentId(), window(item), SequenceRange::span);
            }
        }
        Map<String, List<WorkItem>> siblings = new HashMap<>();
        ranges.forEach((parentId, range) -> siblings.put(parentId, ledger.findByParent(parentId, range.from(), range.to())));
        log.debug("context.neighbours parents={} items={}", ranges.size(), batch.size());
        return siblings;
    }

    private List<WorkItem> neighbours(WorkItem item, Map<String, List<WorkItem>> siblings) {
        List<WorkItem> candidates = item.getParentId() != null ? siblings.get(item.getParentId()) : null;
        if (candidates == null) {
            return List.of();
        }
        SequenceRange window = window(item);
        return candidates.stream()
                .filter(n -> window.contains(n.getSequenceNumber()))
                .filter(n -> !n.getId().equals(item.getId()))
                .toList();
    }

    private SequenceRange window(WorkItem item) {
        return new SequenceRange(Math.max(0, item.getSequenceNumber() - options.windowBefore()),
                item.getSequenceNumber() + options.windowAfter());
    }

    private record SequenceRange(int from, int to) {

        SequenceRange span(SequenceRange other) {
            return new SequenceRange(Math.min(from, other.from), Math.max(to, other.to));
        }

        boolean contains(int sequence) {
            return sequence >= from && sequence <= to;
        }
    }
}

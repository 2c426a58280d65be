package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.Highlight;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Highlights keyed by normalized key term.
 *
 * <p>Upserts never downgrade: a stored highlight is replaced only by one with a strictly higher relevance.
 * Keys carry no sense information, so homonyms overwrite each other; callers see the previous gloss in the
 * {@link UpsertResult} and can report the collision.</p>
 */
public interface HighlightRepository {

    enum UpsertOutcome {
        INSERTED,
        REPLACED,
        KEPT_EXISTING;

        public String metricName() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    /**
     * @param outcome           what the upsert did
     * @param previousRelevance relevance stored before the upsert, null if the key was new
     * @param previousGloss     gloss stored before the upsert, null if the key was new
     */
    record UpsertResult(UpsertOutcome outcome, Integer previousRelevance, String previousGloss) {

        public static UpsertResult inserted() {
            return new UpsertResult(UpsertOutcome.INSERTED, null, null);
        }
    }

    /**
     * Whether a candidate with {@code candidateRelevance} may replace a stored highlight.
     */
    static boolean supersedes(Integer storedRelevance, int candidateRelevance) {
        return storedRelevance == null || candidateRelevance > storedRelevance;
    }

    UpsertResult upsert(Highlight highlight);

    Optional<Highlight> findByKey(String normalizedKey);

    /**
     * Highlights with at least the given relevance, most relevant first.
     */
    List<Highlight> findByMinRelevance(int minRelevance);

    Set<String> findAllKeys();

    Page<Highlight> findAll(PageRequest request);

    /**
     * Ids of every record already condensed into some highlight, whatever key it was stored under.
     */
    default Set<String> findAllSourceIds() {
        Set<String> ids = new HashSet<>();
        PageRequest request = PageRequest.first(1000);
        while (true) {
            Page<Highlight> page = findAll(request);
            page.content().forEach(h -> ids.addAll(h.sourceIds()));
            if (!page.hasNext()) {
                return ids;
            }
            request = request.next();
        }
    }

    long count();
}

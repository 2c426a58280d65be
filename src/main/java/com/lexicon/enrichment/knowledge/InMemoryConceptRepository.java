package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.core.model.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory concept store for tests and single-process use.
 */
public class InMemoryConceptRepository implements ConceptRepository {

    private final Map<String, Concept> conceptsById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByNaturalKey = new ConcurrentHashMap<>();
    private final Map<String, TermLink> termLinks = new ConcurrentHashMap<>();
    private final Map<String, Relation> relationsByEdge = new ConcurrentHashMap<>();

    @Override
    public synchronized Concept upsert(Concept concept) {
        String existingId = idsByNaturalKey.get(concept.naturalKey());
        Concept stored = existingId != null ? concept.toBuilder().id(existingId).build() : concept;
        conceptsById.put(stored.getId(), stored);
        idsByNaturalKey.put(stored.naturalKey(), stored.getId());
        return stored;
    }

    @Override
    public Optional<Concept> findById(String id) {
        return Optional.ofNullable(conceptsById.get(id));
    }

    @Override
    public Optional<Concept> findByNaturalKey(String naturalKey) {
        return Optional.ofNullable(idsByNaturalKey.get(naturalKey)).map(conceptsById::get);
    }

    @Override
    public void linkTerm(TermLink link) {
        if (!conceptsById.containsKey(link.conceptId())) {
            throw new IllegalArgumentException("Unknown concept: " + link.conceptId());
        }
        termLinks.put(link.language().code() + "|" + link.text() + "|" + link.conceptId(), link);
    }

    @Override
    public boolean createRelation(Relation relation) {
        if (!conceptsById.containsKey(relation.getSourceConceptId())
                || !conceptsById.containsKey(relation.getTargetConceptId())) {
            throw new IllegalArgumentException("Both ends of a relation must exist: " + relation);
        }
        return relationsByEdge.putIfAbsent(relation.edgeKey(), relation) == null;
    }

    @Override
    public List<Relation> findRelationsFrom(String conceptId) {
        return relationsByEdge.values().stream()
                .filter(r -> r.getSourceConceptId().equals(conceptId))
                .sorted(Comparator.comparing(Relation::getCreatedAt))
                .toList();
    }

    @Override
    public long count() {
        return conceptsById.size();
    }

    @Override
    public Optional<String> findIdByLabel(String label) {
        return conceptsById.values().stream()
                .filter(c -> c.getLabel().equals(label))
                .map(Concept::getId)
                .sorted()
                .findFirst();
    }

    @Override
    public Optional<String> findIdBySourceTerm(String term) {
        return termLinks.values().stream()
                .filter(l -> l.language() == Language.SOURCE && l.text().equals(term))
                .map(TermLink::conceptId)
                .sorted()
                .findFirst();
    }

    @Override
    public Map<String, List<TermSense>> lookupSenses(Collection<String> words) {
        Set<String> wanted = new HashSet<>(words);
        Map<String, List<TermSense>> senses = new TreeMap<>();
        for (TermLink link : termLinks.values()) {
            String word = LexicalKeys.of(link.text());
            if (link.language() != Language.SOURCE || !wanted.contains(word)) {
                continue;
            }
            Concept concept = conceptsById.get(link.conceptId());
            senses.computeIfAbsent(word, k -> new ArrayList<>()).add(new TermSense(
                    link.text(), concept.getId(), concept.getLabel(), concept.getPartOfSpeech(),
                    concept.getDefinition(), link.pronunciation(), link.gender(), link.pluralForm(),
                    link.etymology(), link.note()));
        }
        senses.values().forEach(list -> list.sort(Comparator.comparing(TermSense::conceptId)));
        return senses;
    }
}

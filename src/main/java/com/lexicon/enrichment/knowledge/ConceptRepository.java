package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.context.DictionaryLookup;
import com.lexicon.enrichment.core.model.Concept;
import com.lexicon.enrichment.core.model.Relation;
import com.lexicon.enrichment.core.model.TermLink;
import com.lexicon.enrichment.resolution.ConceptLookup;

import java.util.List;
import java.util.Optional;

/**
 * Canonical concepts, the terms that denote them and the relations between them.
 */
public interface ConceptRepository extends ConceptLookup, DictionaryLookup {

    /**
     * Inserts or updates a concept by {@link Concept#naturalKey()}.
     *
     * @return the stored concept; its id is the existing one when the key was already present
     */
    Concept upsert(Concept concept);

    Optional<Concept> findById(String id);

    Optional<Concept> findByNaturalKey(String naturalKey);

    /**
     * Upserts the term by (text, language) and links it to its concept.
     */
    void linkTerm(TermLink link);

    /**
     * Creates the relation unless an edge of the same type already joins the two concepts.
     *
     * @return true if a new edge was created
     */
    boolean createRelation(Relation relation);

    List<Relation> findRelationsFrom(String conceptId);

    long count();
}

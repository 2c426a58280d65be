package com.lexicon.enrichment.resolution;

import java.util.List;
import java.util.Optional;

/**
 * The standard strategies, in cascade order.
 */
public final class ResolutionStrategies {

    public static final String EXACT = "exact";
    public static final String CLEANED = "cleaned";
    public static final String ALTERNATION = "alternation";
    public static final String DESUFFIX = "desuffix";
    public static final String FIRST_WORD = "first-word";
    public static final String CROSS_LANGUAGE = "cross-language";

    private ResolutionStrategies() {
    }

    /**
     * exact, cleaned, alternation, desuffix, first-word, cross-language.
     */
    public static List<ResolutionStrategy> standard(ConceptLookup lookup, ReferenceCleaner cleaner) {
        return List.of(
                exact(lookup),
                cleaned(lookup, cleaner),
                alternation(lookup, cleaner),
                desuffix(lookup, cleaner),
                firstWord(lookup, cleaner),
                crossLanguage(lookup, cleaner)
        );
    }

    public static ResolutionStrategy exact(ConceptLookup lookup) {
        return ResolutionStrategy.of(EXACT, term -> byLabel(lookup, term));
    }

    public static ResolutionStrategy cleaned(ConceptLookup lookup, ReferenceCleaner cleaner) {
        return ResolutionStrategy.of(CLEANED, term -> {
            String cleaned = cleaner.clean(term);
            return cleaned.equals(term) ? Optional.empty() : byLabel(lookup, cleaned);
        });
    }

    public static ResolutionStrategy alternation(ConceptLookup lookup, ReferenceCleaner cleaner) {
        return ResolutionStrategy.of(ALTERNATION, term -> firstMatch(lookup, cleaner.alternatives(cleaner.clean(term))));
    }

    public static ResolutionStrategy desuffix(ConceptLookup lookup, ReferenceCleaner cleaner) {
        return ResolutionStrategy.of(DESUFFIX, term -> firstMatch(lookup, cleaner.desuffixed(cleaner.clean(term))));
    }

    public static ResolutionStrategy firstWord(ConceptLookup lookup, ReferenceCleaner cleaner) {
        return ResolutionStrategy.of(FIRST_WORD, term ->
                cleaner.firstWord(cleaner.clean(term)).flatMap(word -> byLabel(lookup, word)));
    }

    public static ResolutionStrategy crossLanguage(ConceptLookup lookup, ReferenceCleaner cleaner) {
        return ResolutionStrategy.of(CROSS_LANGUAGE, term -> {
            Optional<ResolutionStrategy.Match> raw = lookup.findIdBySourceTerm(term.trim())
                    .map(id -> new ResolutionStrategy.Match(term.trim(), id));
            if (raw.isPresent()) {
                return raw;
            }
            String cleaned = cleaner.clean(term);
            if (cleaned.isEmpty() || cleaned.equals(term.trim())) {
                return Optional.empty();
            }
            return lookup.findIdBySourceTerm(cleaned).map(id -> new ResolutionStrategy.Match(cleaned, id));
        });
    }

    private static Optional<ResolutionStrategy.Match> byLabel(ConceptLookup lookup, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        return lookup.findIdByLabel(candidate).map(id -> new ResolutionStrategy.Match(candidate, id));
    }

    private static Optional<ResolutionStrategy.Match> firstMatch(ConceptLookup lookup, List<String> candidates) {
        for (String candidate : candidates) {
            Optional<ResolutionStrategy.Match> match = byLabel(lookup, candidate);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }
}

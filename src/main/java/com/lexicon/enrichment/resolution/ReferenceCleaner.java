package com.lexicon.enrichment.resolution;

import com.lexicon.enrichment.core.model.Language;
import com.lexicon.enrichment.rules.NormalizationEngine;
import com.lexicon.enrichment.rules.ReferenceCleaningRules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Produces the candidate forms the cascade tries for a canonical-language reference.
 */
public class ReferenceCleaner {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[\\s,]+");
    private static final List<String> INFLECTION_SUFFIXES = List.of("en", "er", "e", "n", "s");
    private static final int MIN_STEM_LENGTH = 2;
    private static final int MIN_FIRST_WORD_LENGTH = 3;

    private final NormalizationEngine engine;

    public ReferenceCleaner() {
        this(ReferenceCleaningRules.canonicalLabelEngine());
    }

    public ReferenceCleaner(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Strips footnote markers, trailing punctuation, asides and reflexive markers.
     * {@code "Haus²"} becomes {@code "Haus"}.
     */
    public String clean(String term) {
        return engine.normalize(term, Language.CANONICAL);
    }

    /**
     * Alternatives of a slash form, left side first.
     *
     * <p>{@code "Hund/Katze"} yields {@code Hund, Katze}. A left side ending in a hyphen shares the tail of the
     * right side: {@code "Haupt-/Nebeneingang"} yields {@code Haupteingang} (and the other tails of
     * {@code Nebeneingang} combined with {@code Haupt}, longest first), then {@code Nebeneingang}.</p>
     */
    public List<String> alternatives(String cleaned) {
        int slash = cleaned.indexOf('/');
        if (slash < 0) {
            return List.of();
        }
        String left = cleaned.substring(0, slash).trim();
        String right = cleaned.substring(slash + 1).trim();
        Set<String> candidates = new LinkedHashSet<>();
        if (left.endsWith("-") && !right.isEmpty()) {
            String prefix = left.substring(0, left.length() - 1).trim();
            if (!prefix.isEmpty()) {
                for (int cut = 1; cut < right.length() - 1; cut++) {
                    candidates.add(prefix + right.substring(cut));
                }
            }
        } else if (!left.isEmpty()) {
            candidates.add(left);
        }
        if (!right.isEmpty()) {
            candidates.add(right);
        }
        return new ArrayList<>(candidates);
    }

    /**
     * Stems obtained by removing one inflectional ending, tried in the order -en, -er, -e, -n, -s.
     */
    public List<String> desuffixed(String cleaned) {
        List<String> stems = new ArrayList<>();
        for (String suffix : INFLECTION_SUFFIXES) {
            if (cleaned.endsWith(suffix) && cleaned.length() - suffix.length() >= MIN_STEM_LENGTH) {
                String stem = cleaned.substring(0, cleaned.length() - suffix.length());
                if (!stems.contains(stem)) {
                    stems.add(stem);
                }
            }
        }
        return stems;
    }

    /**
     * The first word of a multi-word reference, if it is long enough to be meaningful.
     */
    public Optional<String> firstWord(String cleaned) {
        String[] words = WORD_SEPARATOR.split(cleaned.trim());
        if (words.length == 0) {
            return Optional.empty();
        }
        String first = words[0];
        if (first.length() >= MIN_FIRST_WORD_LENGTH && !first.equals(cleaned)) {
            return Optional.of(first);
        }
        return Optional.empty();
    }
}

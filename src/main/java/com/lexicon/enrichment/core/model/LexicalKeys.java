package com.lexicon.enrichment.core.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalized lookup keys for terms: case-folded, trimmed, inner whitespace collapsed.
 */
public final class LexicalKeys {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private LexicalKeys() {
    }

    /**
     * Returns the normalized key of a term, or an empty string for null input.
     */
    public static String of(String term) {
        if (term == null) {
            return "";
        }
        return WHITESPACE.matcher(term.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}

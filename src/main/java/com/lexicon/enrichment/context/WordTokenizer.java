package com.lexicon.enrichment.context;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits source text into unique lower-cased words, in order of first occurrence.
 */
public final class WordTokenizer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}0-9']+");

    private WordTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> words = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return List.copyOf(words);
    }

    /**
     * Unique words of all texts, in order of first occurrence.
     */
    public static Set<String> tokenizeAll(Collection<String> texts) {
        Set<String> words = new LinkedHashSet<>();
        for (String text : texts) {
            words.addAll(tokenize(text));
        }
        return words;
    }
}

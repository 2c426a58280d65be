package com.lexicon.enrichment.core.model;

/**
 * The two languages of the corpus.
 */
public enum Language {
    /** The corpus language (Halunder). */
    SOURCE("hal"),
    /** The canonical label language (German). */
    CANONICAL("de");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Language fromCode(String code) {
        for (Language language : values()) {
            if (language.code.equalsIgnoreCase(code)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown language code: " + code);
    }
}

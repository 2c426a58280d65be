package com.lexicon.enrichment.core.model;

import java.util.Objects;

/**
 * One translation row produced for a work item.
 *
 * @param workItemId  the work item the row was produced for
 * @param cleanedText corrected source-language text
 * @param translation canonical-language translation
 * @param confidence  confidence score reported by the oracle, 0.0 to 1.0
 * @param notes       translator notes, may be null
 * @param variant     {@code best} or {@code alternative_N}
 */
public record TranslationRecord(
        String workItemId,
        String cleanedText,
        String translation,
        double confidence,
        String notes,
        String variant
) {
    public static final String BEST = "best";

    public TranslationRecord {
        Objects.requireNonNull(workItemId, "workItemId is required");
        Objects.requireNonNull(cleanedText, "cleanedText is required");
        Objects.requireNonNull(translation, "translation is required");
        Objects.requireNonNull(variant, "variant is required");
    }

    public static String alternative(int index) {
        return "alternative_" + index;
    }

    public boolean isBest() {
        return BEST.equals(variant);
    }
}

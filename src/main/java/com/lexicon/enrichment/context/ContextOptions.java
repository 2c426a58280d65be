package com.lexicon.enrichment.context;

/**
 * @param minHighlightRelevance known highlights below this relevance are not attached
 * @param windowBefore          neighbouring items of the same parent attached before the item
 * @param windowAfter           neighbouring items of the same parent attached after the item
 */
public record ContextOptions(int minHighlightRelevance, int windowBefore, int windowAfter) {

    public ContextOptions {
        if (minHighlightRelevance < 0 || minHighlightRelevance > 10) {
            throw new IllegalArgumentException("minHighlightRelevance must be between 0 and 10");
        }
        if (windowBefore < 0 || windowAfter < 0) {
            throw new IllegalArgumentException("window sizes must be >= 0");
        }
    }

    public static ContextOptions defaults() {
        return new ContextOptions(6, 2, 2);
    }

    public static ContextOptions withoutWindow() {
        return new ContextOptions(6, 0, 0);
    }

    public boolean hasWindow() {
        return windowBefore > 0 || windowAfter > 0;
    }
}

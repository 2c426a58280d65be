package com.lexicon.enrichment.bulk;

/**
 * @param translations translation rows exported
 * @param highlights   highlights exported
 */
public record ExportResult(long translations, long highlights) {

    @Override
    public String toString() {
        return "ExportResult{translations=" + translations + ", highlights=" + highlights + '}';
    }
}

package com.lexicon.enrichment.bulk;

/**
 * Progress of a bulk operation.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records processed so far
     * @param total     total records, or -1 if unknown
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}

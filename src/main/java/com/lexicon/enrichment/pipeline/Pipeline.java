package com.lexicon.enrichment.pipeline;

/**
 * A batch job started through a {@link PipelineRunner}.
 */
public interface Pipeline {

    String getName();

    /**
     * Runs to completion on the calling thread.
     *
     * @param limit maximum number of input items
     */
    RunSummary run(int limit, RunContext context);
}

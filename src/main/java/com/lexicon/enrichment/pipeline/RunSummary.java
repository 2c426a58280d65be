package com.lexicon.enrichment.pipeline;

import java.time.Duration;

/**
 * Final counters of a run.
 *
 * @param runId     the run
 * @param pipeline  pipeline name
 * @param selected  items selected for the run
 * @param completed items that ended successfully
 * @param failed    items that ended in error
 * @param deferred  items left for a later run because the call budget ran out or the run aborted
 * @param aborted   whether a run-level failure stopped the run
 * @param abortReason message of the run-level failure, null unless aborted
 * @param elapsed   wall-clock time of the run
 */
public record RunSummary(
        String runId,
        String pipeline,
        int selected,
        int completed,
        int failed,
        int deferred,
        boolean aborted,
        String abortReason,
        Duration elapsed
) {
}

package com.lexicon.enrichment.pipeline;

import java.util.List;

/**
 * Snapshot of a pipeline's state for the control surface.
 *
 * @param runId           id of the current or last run, null before the first run
 * @param status          run status
 * @param percentComplete processed items over selected items, 0 to 100
 * @param details         short human-readable state
 * @param lastError       last run-level error, may be null
 * @param logs            most recent run log lines
 */
public record RunProgress(
        String runId,
        RunStatus status,
        int percentComplete,
        String details,
        String lastError,
        List<String> logs
) {
    public RunProgress {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }

    public static RunProgress idle() {
        return new RunProgress(null, RunStatus.IDLE, 0, "Idle", null, List.of());
    }
}

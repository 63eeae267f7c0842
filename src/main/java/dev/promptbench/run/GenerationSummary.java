package dev.promptbench.run;

import java.time.Duration;

/** Outcome of one generate call. */
public record GenerationSummary(
        /** prompts answered successfully during the run */
        int generatedCount,
        /** prompts recorded with an error marker during the run */
        int failedCount,
        /** dispatched prompts left unrecorded because the run timed out or was cancelled */
        int pendingCount,
        Duration elapsed) {

    public boolean isComplete() {
        return pendingCount == 0;
    }
}

package dev.promptbench.run;

import java.time.Duration;

/** Outcome of one evaluate call. */
public record EvaluationSummary(
        /** verdicts written during the run */
        int evaluatedCount,
        /** responses the judge could not score; these are not persisted */
        int skippedCount,
        /** responses left unjudged because the run timed out or was cancelled */
        int pendingCount,
        Duration elapsed) {

    public boolean isComplete() {
        return pendingCount == 0;
    }
}

package dev.promptbench.run;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Options of a generate call.
 *
 * @param force supersede responses already recorded for the pair
 * @param timeout bound of the whole run; the configured run timeout when empty
 */
public record GenerateOptions(boolean force, @Nonnull Optional<Duration> timeout) {
    public static GenerateOptions defaults() {
        return new GenerateOptions(false, Optional.empty());
    }

    public static GenerateOptions forced() {
        return new GenerateOptions(true, Optional.empty());
    }

    public GenerateOptions withTimeout(Duration timeout) {
        return new GenerateOptions(force, Optional.of(timeout));
    }
}

package dev.promptbench.stats;

import dev.promptbench.store.Pair;
import dev.promptbench.store.PairState;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Everything reported about one pair. */
public record PairStats(
        @Nonnull Pair pair,
        @Nonnull PairState state,
        int promptCount,
        /** successful responses */
        int responseCount,
        /** responses recorded with an error marker */
        int errorCount,
        /** empty when the pair has no successful response */
        @Nonnull Optional<LatencyStats> latency,
        @Nonnull EvalCounts evalCounts) {}

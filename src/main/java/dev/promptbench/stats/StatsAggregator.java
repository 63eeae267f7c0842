package dev.promptbench.stats;

import dev.promptbench.catalog.PairResolver;
import dev.promptbench.store.EvaluationResult;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairState;
import dev.promptbench.store.PromptResponse;
import dev.promptbench.store.ResponseStore;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Derives latency and verdict statistics from the rows stored for a pair. */
public final class StatsAggregator {
    private final @Nonnull PairResolver pairResolver;
    private final @Nonnull ResponseStore store;

    public StatsAggregator(@Nonnull PairResolver pairResolver, @Nonnull ResponseStore store) {
        this.pairResolver = Objects.requireNonNull(pairResolver);
        this.store = Objects.requireNonNull(store);
    }

    public Optional<LatencyStats> computeLatency(@Nonnull Pair pair) {
        return latencyOf(store.snapshot(pair).responses().values());
    }

    public EvalCounts computeEvalCounts(@Nonnull Pair pair) {
        return countsOf(store.snapshot(pair).evaluations().values());
    }

    /**
     * State, row counts, latency and verdict counts of a pair, all read from one snapshot.
     *
     * @throws dev.promptbench.catalog.InvalidPairException if the pair is unknown
     */
    public PairStats computeStats(@Nonnull Pair pair) {
        var promptSet = pairResolver.resolve(pair);
        var snapshot = store.snapshot(pair);
        return new PairStats(
                pair,
                PairState.derive(promptSet.promptCount(), snapshot),
                promptSet.promptCount(),
                (int) snapshot.successCount(),
                (int) snapshot.errorCount(),
                latencyOf(snapshot.responses().values()),
                countsOf(snapshot.evaluations().values()));
    }

    public PairState computeState(@Nonnull Pair pair) {
        var promptSet = pairResolver.resolve(pair);
        return PairState.derive(promptSet.promptCount(), store.snapshot(pair));
    }

    static Optional<LatencyStats> latencyOf(Collection<PromptResponse> responses) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        int count = 0;
        for (var response : responses) {
            if (response.isError() || response.latencySeconds().isEmpty()) {
                continue;
            }
            double latency = response.latencySeconds().get();
            min = Math.min(min, latency);
            max = Math.max(max, latency);
            sum += latency;
            count++;
        }
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(new LatencyStats(min, sum / count, max, count));
    }

    static EvalCounts countsOf(Collection<EvaluationResult> evaluations) {
        int okTrue = 0;
        int otherTrue = 0;
        for (var evaluation : evaluations) {
            if (evaluation.ok()) {
                okTrue++;
            }
            if (evaluation.other()) {
                otherTrue++;
            }
        }
        int total = evaluations.size();
        return new EvalCounts(okTrue, total - okTrue, otherTrue, total - otherTrue);
    }
}

package dev.promptbench.store;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.annotation.Nonnull;

/**
 * A consistent point-in-time read of everything stored for one pair, keyed by prompt index.
 */
public record PairSnapshot(
        @Nonnull Pair pair,
        @Nonnull SortedMap<Integer, PromptResponse> responses,
        @Nonnull SortedMap<Integer, EvaluationResult> evaluations) {
    public PairSnapshot {
        responses = Collections.unmodifiableSortedMap(new TreeMap<>(responses));
        evaluations = Collections.unmodifiableSortedMap(new TreeMap<>(evaluations));
    }

    public static PairSnapshot empty(Pair pair) {
        return new PairSnapshot(pair, new TreeMap<>(), new TreeMap<>());
    }

    public static PairSnapshot of(
            Pair pair,
            Map<Integer, PromptResponse> responses,
            Map<Integer, EvaluationResult> evaluations) {
        return new PairSnapshot(pair, new TreeMap<>(responses), new TreeMap<>(evaluations));
    }

    public long successCount() {
        return responses.values().stream().filter(r -> !r.isError()).count();
    }

    public long errorCount() {
        return responses.values().stream().filter(PromptResponse::isError).count();
    }

    /** successful responses which have no verdict yet */
    public long unevaluatedCount() {
        return responses.values().stream()
                .filter(r -> !r.isError() && !evaluations.containsKey(r.promptIndex()))
                .count();
    }
}

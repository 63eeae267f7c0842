package dev.promptbench.store;

import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nonnull;

/** A judge model's two independent verdicts on one stored response. */
public record EvaluationResult(
        @Nonnull Pair pair,
        int promptIndex,
        @Nonnull String judgeModelId,
        boolean ok,
        boolean other,
        @Nonnull Instant createdAt) {
    public EvaluationResult {
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(judgeModelId, "judgeModelId");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static EvaluationResult of(
            Pair pair, int promptIndex, String judgeModelId, boolean ok, boolean other) {
        return new EvaluationResult(pair, promptIndex, judgeModelId, ok, other, Instant.now());
    }
}

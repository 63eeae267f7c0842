package dev.promptbench.store;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Outcome of generating a response for one prompt of a pair.
 *
 * <p>Exactly one of {@code text} and {@code errorMarker} is present. Only successful responses
 * carry a latency.
 */
public record PromptResponse(
        @Nonnull Pair pair,
        int promptIndex,
        @Nonnull Optional<String> text,
        @Nonnull Optional<String> errorMarker,
        @Nonnull Optional<Double> latencySeconds,
        @Nonnull Instant createdAt) {
    public PromptResponse {
        Objects.requireNonNull(pair, "pair");
        if (promptIndex < 0) {
            throw new IllegalArgumentException("prompt index must not be negative: " + promptIndex);
        }
        if (text.isPresent() == errorMarker.isPresent()) {
            throw new IllegalArgumentException("exactly one of text and error marker is required");
        }
        if (errorMarker.isPresent() && latencySeconds.isPresent()) {
            throw new IllegalArgumentException("failed responses do not carry a latency");
        }
    }

    public static PromptResponse success(
            Pair pair, int promptIndex, String text, double latencySeconds) {
        return new PromptResponse(
                pair,
                promptIndex,
                Optional.of(text),
                Optional.empty(),
                Optional.of(latencySeconds),
                Instant.now());
    }

    public static PromptResponse failure(Pair pair, int promptIndex, String errorMarker) {
        return new PromptResponse(
                pair,
                promptIndex,
                Optional.empty(),
                Optional.of(errorMarker),
                Optional.empty(),
                Instant.now());
    }

    public boolean isError() {
        return errorMarker.isPresent();
    }
}

package dev.promptbench.store;

import java.util.Objects;
import javax.annotation.Nonnull;

/** A (prompt set, model) combination under test. */
public record Pair(@Nonnull String promptSetId, @Nonnull String modelId) {
    public Pair {
        Objects.requireNonNull(promptSetId, "promptSetId");
        Objects.requireNonNull(modelId, "modelId");
    }

    public static Pair of(String promptSetId, String modelId) {
        return new Pair(promptSetId, modelId);
    }

    @Override
    public String toString() {
        return promptSetId + "/" + modelId;
    }
}

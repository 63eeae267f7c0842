package dev.promptbench.catalog;

import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A named, immutable collection of prompts produced from a source file by a generation function.
 *
 * <p>{@code promptCount} fixes the valid prompt indices to {@code [0, promptCount)}.
 */
public record PromptSet(
        @Nonnull String id,
        @Nonnull Instant createdAt,
        @Nonnull String sourceFileRef,
        @Nonnull String promptFuncName,
        int promptCount) {
    public PromptSet {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(sourceFileRef, "sourceFileRef");
        Objects.requireNonNull(promptFuncName, "promptFuncName");
        if (promptCount < 0) {
            throw new IllegalArgumentException("prompt count must not be negative: " + promptCount);
        }
    }

    public boolean containsIndex(int promptIndex) {
        return promptIndex >= 0 && promptIndex < promptCount;
    }
}

package dev.promptbench.provider;

import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;

/** A model's answer to one prompt and how long the call took. */
public record Completion(@Nonnull String text, @Nonnull Duration latency) {
    public Completion {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(latency, "latency");
    }
}

package dev.promptbench.compare;

import dev.promptbench.store.Pair;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Result of selecting or deselecting a pair. */
public record ToggleResult(
        /** the pair pushed out of the selection to make room, if any */
        @Nonnull Optional<Pair> evicted) {
    static final ToggleResult NONE = new ToggleResult(Optional.empty());
}

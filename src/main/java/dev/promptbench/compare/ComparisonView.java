package dev.promptbench.compare;

import dev.promptbench.store.EvaluationResult;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PromptResponse;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Two pairs' results side by side, matched by prompt index. */
public record ComparisonView(@Nonnull Pair left, @Nonnull Pair right, @Nonnull List<Row> rows) {

    /** One prompt index of both pairs. */
    public record Row(int promptIndex, @Nonnull Side left, @Nonnull Side right) {}

    /**
     * One pair's result at an index. {@code present} is false when the index lies outside the
     * pair's prompt set; then every other component is empty.
     */
    public record Side(
            boolean present,
            @Nonnull Optional<String> promptText,
            @Nonnull Optional<PromptResponse> response,
            @Nonnull Optional<EvaluationResult> evaluation) {
        static final Side ABSENT = new Side(false, Optional.empty(), Optional.empty(), Optional.empty());
    }
}

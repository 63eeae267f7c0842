package dev.promptbench.catalog;

import dev.promptbench.store.Pair;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;

/** Checks pairs against the prompt set and model catalogs. */
public final class PairResolver {
    private final @Nonnull PromptSetCatalog promptSets;
    private final @Nonnull ModelCatalog models;

    public PairResolver(@Nonnull PromptSetCatalog promptSets, @Nonnull ModelCatalog models) {
        this.promptSets = Objects.requireNonNull(promptSets);
        this.models = Objects.requireNonNull(models);
    }

    /**
     * Look up the prompt set of a pair.
     *
     * @throws InvalidPairException if the prompt set or the model is unknown
     */
    public PromptSet resolve(@Nonnull Pair pair) {
        var promptSet =
                promptSets
                        .get(pair.promptSetId())
                        .orElseThrow(
                                () ->
                                        new InvalidPairException(
                                                "unknown prompt set: " + pair.promptSetId()));
        if (!models.contains(pair.modelId())) {
            throw new InvalidPairException("unknown model: " + pair.modelId());
        }
        return promptSet;
    }

    public String promptText(@Nonnull PromptSet promptSet, int promptIndex) {
        return promptSets.promptText(promptSet, promptIndex);
    }

    /** Every prompt set paired with every model, prompt sets in catalog order. */
    public List<Pair> allPairs() {
        return promptSets.list().stream()
                .flatMap(set -> models.list().stream().map(model -> Pair.of(set.id(), model)))
                .toList();
    }
}

package dev.promptbench.run;

import dev.promptbench.PromptBenchException;
import dev.promptbench.store.Pair;
import lombok.Getter;

/** Thrown when a pair already has an active run of the requested kind. */
public class AlreadyInProgressException extends PromptBenchException {
    @Getter private final Pair pair;
    @Getter private final RunRegistry.RunKind runKind;

    public AlreadyInProgressException(Pair pair, RunRegistry.RunKind runKind) {
        super("%s run already in progress for %s".formatted(runKind.label(), pair));
        this.pair = pair;
        this.runKind = runKind;
    }
}

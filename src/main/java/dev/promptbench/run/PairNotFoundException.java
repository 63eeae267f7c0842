package dev.promptbench.run;

import dev.promptbench.PromptBenchException;
import dev.promptbench.store.Pair;
import lombok.Getter;

/** Thrown when cancelling a pair that has no active run. */
public class PairNotFoundException extends PromptBenchException {
    @Getter private final Pair pair;

    public PairNotFoundException(Pair pair) {
        super("no active run for " + pair);
        this.pair = pair;
    }
}

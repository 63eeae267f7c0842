package dev.promptbench.run;

import dev.promptbench.PromptBenchException;
import dev.promptbench.store.Pair;
import lombok.Getter;

/** Thrown when a pair is evaluated before every prompt has a response. */
public class NotGeneratedException extends PromptBenchException {
    @Getter private final Pair pair;

    public NotGeneratedException(Pair pair) {
        super("responses for %s have not been generated".formatted(pair));
        this.pair = pair;
    }
}

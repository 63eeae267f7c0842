package dev.promptbench.compare;

import dev.promptbench.PromptBenchException;

/** Thrown when a comparison is requested without two generated pairs selected. */
public class IncompleteSelectionException extends PromptBenchException {
    public IncompleteSelectionException(String message) {
        super(message);
    }
}

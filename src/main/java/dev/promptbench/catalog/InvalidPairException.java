package dev.promptbench.catalog;

import dev.promptbench.PromptBenchException;

/** Thrown when a prompt set id or model id is not known to the catalogs. */
public class InvalidPairException extends PromptBenchException {
    public InvalidPairException(String message) {
        super(message);
    }
}

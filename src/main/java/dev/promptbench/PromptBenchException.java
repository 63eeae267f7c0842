package dev.promptbench;

import javax.annotation.Nullable;

/**
 * Base class of every call-level failure raised by promptbench.
 *
 * <p>Only structural misuse is surfaced this way (bad identifiers, wrong pair state, concurrent
 * runs, incomplete comparison selections). Provider failures during a run are recorded as data
 * and never escape as exceptions.
 */
public class PromptBenchException extends RuntimeException {
    public PromptBenchException(String message) {
        super(message);
    }

    public PromptBenchException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}

package dev.promptbench.provider;

/**
 * Asks a judge model to classify a stored response. The rubric behind the two verdicts belongs
 * to the implementation.
 */
@FunctionalInterface
public interface JudgeClient {
    /**
     * @throws ProviderException if the judge call fails or its answer cannot be understood
     * @throws InterruptedException if the calling run is cancelled while waiting
     */
    Verdict score(String judgeModelId, String promptText, String responseText)
            throws ProviderException, InterruptedException;
}

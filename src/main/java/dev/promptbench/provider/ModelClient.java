package dev.promptbench.provider;

/** Requests a single completion from an external model provider. One call per attempt. */
@FunctionalInterface
public interface ModelClient {
    /**
     * @throws ProviderException if the provider fails to produce a completion
     * @throws InterruptedException if the calling run is cancelled while waiting
     */
    Completion complete(String modelId, String promptText)
            throws ProviderException, InterruptedException;
}

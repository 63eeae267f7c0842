package dev.promptbench.provider.openai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import dev.promptbench.config.PromptBenchConfig;
import dev.promptbench.provider.Completion;
import dev.promptbench.provider.ModelClient;
import dev.promptbench.provider.ProviderException;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/** {@link ModelClient} backed by the OpenAI chat completions API. */
@Slf4j
public class OpenAIModelClient implements ModelClient {
    static final String LENGTH_EXCEEDED_SUFFIX = "\n\n[error: maximum length exceeded]";

    private final @Nonnull OpenAIClient openAIClient;
    private final double temperature;
    private final long maxTokens;

    public OpenAIModelClient(@Nonnull OpenAIClient openAIClient, double temperature, long maxTokens) {
        this.openAIClient = Objects.requireNonNull(openAIClient);
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public static OpenAIModelClient of(PromptBenchConfig config) {
        return new OpenAIModelClient(
                createOpenAIClient(config), config.temperature(), config.maxTokens());
    }

    @Override
    public Completion complete(String modelId, String promptText)
            throws ProviderException, InterruptedException {
        var request =
                ChatCompletionCreateParams.builder()
                        .model(modelId)
                        .addUserMessage(promptText)
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .build();
        long start = System.nanoTime();
        try {
            var response = openAIClient.chat().completions().create(request);
            var latency = Duration.ofNanos(System.nanoTime() - start);
            return new Completion(extractText(response), latency);
        } catch (OpenAIException e) {
            if (Thread.interrupted()) {
                throw new InterruptedException("completion request interrupted");
            }
            throw OpenAIErrors.classify(e);
        }
    }

    private static String extractText(ChatCompletion response) throws ProviderException {
        if (response.choices().isEmpty()) {
            throw new ProviderException(
                    ProviderException.Kind.MALFORMED_RESPONSE,
                    "no choices in completion " + response.id());
        }
        if (response.choices().size() > 1) {
            log.debug("multiple choices in completion: {}", response.choices().size());
        }
        var choice = response.choices().get(0);
        var text = choice.message().content().orElse("");
        if (ChatCompletion.Choice.FinishReason.LENGTH.equals(choice.finishReason())) {
            text += LENGTH_EXCEEDED_SUFFIX;
        }
        return text.strip();
    }

    static OpenAIClient createOpenAIClient(PromptBenchConfig config) {
        return OpenAIOkHttpClient.builder()
                .apiKey(
                        config.openAiApiKey()
                                .orElseThrow(
                                        () ->
                                                new IllegalStateException(
                                                        "OPENAI_API_KEY is required for the OpenAI clients")))
                .baseUrl(config.openAiBaseUrl())
                .timeout(config.requestTimeout())
                // retries are owned by the run's RetryPolicy
                .maxRetries(0)
                .build();
    }
}

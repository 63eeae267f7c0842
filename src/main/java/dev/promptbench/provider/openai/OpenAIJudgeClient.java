package dev.promptbench.provider.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIException;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import dev.promptbench.config.PromptBenchConfig;
import dev.promptbench.json.PromptBenchJsonMapper;
import dev.promptbench.provider.JudgeClient;
import dev.promptbench.provider.ProviderException;
import dev.promptbench.provider.ProviderException.Kind;
import dev.promptbench.provider.Verdict;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * {@link JudgeClient} backed by the OpenAI chat completions API.
 *
 * <p>The caller supplies the rubric as system instructions. The judge is asked to answer with a
 * JSON object holding the two boolean verdicts {@code ok} and {@code other}.
 */
public class OpenAIJudgeClient implements JudgeClient {
    static final String ANSWER_FORMAT =
            "Answer with only a JSON object of the form {\"ok\": true|false, \"other\": true|false}.";

    private final @Nonnull OpenAIClient openAIClient;
    private final @Nonnull String rubric;

    public OpenAIJudgeClient(@Nonnull OpenAIClient openAIClient, @Nonnull String rubric) {
        this.openAIClient = Objects.requireNonNull(openAIClient);
        this.rubric = Objects.requireNonNull(rubric);
    }

    public static OpenAIJudgeClient of(PromptBenchConfig config, String rubric) {
        return new OpenAIJudgeClient(OpenAIModelClient.createOpenAIClient(config), rubric);
    }

    @Override
    public Verdict score(String judgeModelId, String promptText, String responseText)
            throws ProviderException, InterruptedException {
        var request =
                ChatCompletionCreateParams.builder()
                        .model(judgeModelId)
                        .addSystemMessage(rubric + "\n\n" + ANSWER_FORMAT)
                        .addUserMessage(
                                "<prompt>\n%s\n</prompt>\n\n<response>\n%s\n</response>"
                                        .formatted(promptText, responseText))
                        .temperature(0.0)
                        .build();
        String answer;
        try {
            var response = openAIClient.chat().completions().create(request);
            if (response.choices().isEmpty()) {
                throw new ProviderException(
                        Kind.MALFORMED_RESPONSE, "no choices in judge response " + response.id());
            }
            answer = response.choices().get(0).message().content().orElse("");
        } catch (OpenAIException e) {
            if (Thread.interrupted()) {
                throw new InterruptedException("judge request interrupted");
            }
            throw OpenAIErrors.classify(e);
        }
        return parseVerdict(answer);
    }

    /** Reads the verdict object out of a judge answer, tolerating prose or code fences around it. */
    static Verdict parseVerdict(String answer) throws ProviderException {
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ProviderException(
                    Kind.MALFORMED_RESPONSE, "judge answer holds no JSON object: " + answer);
        }
        try {
            var node = PromptBenchJsonMapper.get().readTree(answer.substring(start, end + 1));
            var ok = node.get("ok");
            var other = node.get("other");
            if (ok == null || other == null || !ok.isBoolean() || !other.isBoolean()) {
                throw new ProviderException(
                        Kind.MALFORMED_RESPONSE,
                        "judge answer lacks boolean ok/other fields: " + answer);
            }
            return new Verdict(ok.booleanValue(), other.booleanValue());
        } catch (JsonProcessingException e) {
            throw new ProviderException(
                    Kind.MALFORMED_RESPONSE, "judge answer is not valid JSON: " + answer, e);
        }
    }
}

package dev.promptbench.config;

import dev.promptbench.PromptBenchUtils;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Configuration for promptbench with sane defaults.
 *
 * <p>Every setting can be supplied through an environment variable, and any of them can be
 * overridden during config construction.
 */
@Getter
@Accessors(fluent = true)
public final class PromptBenchConfig extends BaseConfig {
    /** number of provider calls a single run may have in flight */
    private final int workerPoolSize = getConfig("PROMPTBENCH_WORKER_POOL_SIZE", 8);

    private final int maxAttempts = getConfig("PROMPTBENCH_MAX_ATTEMPTS", 3);
    private final Duration initialBackoff =
            Duration.ofMillis(getConfig("PROMPTBENCH_INITIAL_BACKOFF_MS", 500L));
    private final double backoffMultiplier = getConfig("PROMPTBENCH_BACKOFF_MULTIPLIER", 2.0);
    private final Duration maxBackoff =
            Duration.ofMillis(getConfig("PROMPTBENCH_MAX_BACKOFF_MS", 10_000L));

    /** fraction of each backoff delay that is randomized, between 0 and 1 */
    private final double backoffJitter = getConfig("PROMPTBENCH_BACKOFF_JITTER", 0.2);

    /** upper bound of a whole generate or evaluate run */
    private final Duration runTimeout =
            Duration.ofMillis(getConfig("PROMPTBENCH_RUN_TIMEOUT_MS", 600_000L));

    /** upper bound of a single provider request */
    private final Duration requestTimeout =
            Duration.ofMillis(getConfig("PROMPTBENCH_REQUEST_TIMEOUT_MS", 60_000L));

    private final List<String> models =
            PromptBenchUtils.parseCsv(getConfig("PROMPTBENCH_MODELS", ""));
    private final Optional<String> defaultJudgeModel =
            Optional.ofNullable(getConfig("PROMPTBENCH_DEFAULT_JUDGE_MODEL", null, String.class));
    private final Optional<String> openAiApiKey =
            Optional.ofNullable(getConfig("OPENAI_API_KEY", null, String.class));
    private final String openAiBaseUrl = getConfig("OPENAI_BASE_URL", "https://api.openai.com/v1");
    private final double temperature = getConfig("PROMPTBENCH_TEMPERATURE", 0.25);
    private final long maxTokens = getConfig("PROMPTBENCH_MAX_TOKENS", 1000L);
    private final boolean debug = getConfig("PROMPTBENCH_DEBUG", false);

    public static PromptBenchConfig fromEnvironment() {
        return of();
    }

    public static PromptBenchConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new PromptBenchConfig(overridesMap);
    }

    private PromptBenchConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (workerPoolSize < 1) {
            throw new IllegalStateException("worker pool size must be positive: " + workerPoolSize);
        }
        if (maxAttempts < 1) {
            throw new IllegalStateException("max attempts must be positive: " + maxAttempts);
        }
        if (runTimeout.isNegative() || runTimeout.isZero()) {
            throw new IllegalStateException("run timeout must be positive: " + runTimeout);
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalStateException("request timeout must be positive: " + requestTimeout);
        }
        if (backoffJitter < 0.0 || backoffJitter > 1.0) {
            throw new IllegalStateException("backoff jitter must be within [0, 1]: " + backoffJitter);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder workerPoolSize(int value) {
            envOverrides.put("PROMPTBENCH_WORKER_POOL_SIZE", String.valueOf(value));
            return this;
        }

        public Builder maxAttempts(int value) {
            envOverrides.put("PROMPTBENCH_MAX_ATTEMPTS", String.valueOf(value));
            return this;
        }

        public Builder initialBackoff(Duration value) {
            envOverrides.put("PROMPTBENCH_INITIAL_BACKOFF_MS", String.valueOf(value.toMillis()));
            return this;
        }

        public Builder backoffMultiplier(double value) {
            envOverrides.put("PROMPTBENCH_BACKOFF_MULTIPLIER", String.valueOf(value));
            return this;
        }

        public Builder maxBackoff(Duration value) {
            envOverrides.put("PROMPTBENCH_MAX_BACKOFF_MS", String.valueOf(value.toMillis()));
            return this;
        }

        public Builder backoffJitter(double value) {
            envOverrides.put("PROMPTBENCH_BACKOFF_JITTER", String.valueOf(value));
            return this;
        }

        public Builder runTimeout(Duration value) {
            envOverrides.put("PROMPTBENCH_RUN_TIMEOUT_MS", String.valueOf(value.toMillis()));
            return this;
        }

        public Builder requestTimeout(Duration value) {
            envOverrides.put("PROMPTBENCH_REQUEST_TIMEOUT_MS", String.valueOf(value.toMillis()));
            return this;
        }

        public Builder models(List<String> value) {
            envOverrides.put("PROMPTBENCH_MODELS", String.join(",", value));
            return this;
        }

        public Builder defaultJudgeModel(String value) {
            envOverrides.put("PROMPTBENCH_DEFAULT_JUDGE_MODEL", value != null ? value : NULL_OVERRIDE);
            return this;
        }

        public Builder openAiApiKey(String value) {
            envOverrides.put("OPENAI_API_KEY", value != null ? value : NULL_OVERRIDE);
            return this;
        }

        public Builder openAiBaseUrl(String value) {
            envOverrides.put("OPENAI_BASE_URL", value);
            return this;
        }

        public Builder temperature(double value) {
            envOverrides.put("PROMPTBENCH_TEMPERATURE", String.valueOf(value));
            return this;
        }

        public Builder maxTokens(long value) {
            envOverrides.put("PROMPTBENCH_MAX_TOKENS", String.valueOf(value));
            return this;
        }

        public Builder debug(boolean value) {
            envOverrides.put("PROMPTBENCH_DEBUG", String.valueOf(value));
            return this;
        }

        public PromptBenchConfig build() {
            return new PromptBenchConfig(envOverrides);
        }
    }
}

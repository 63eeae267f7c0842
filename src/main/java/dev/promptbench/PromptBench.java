package dev.promptbench;

import dev.promptbench.catalog.ModelCatalog;
import dev.promptbench.catalog.PairResolver;
import dev.promptbench.catalog.PromptSetCatalog;
import dev.promptbench.compare.ComparisonSelector;
import dev.promptbench.config.PromptBenchConfig;
import dev.promptbench.provider.JudgeClient;
import dev.promptbench.provider.ModelClient;
import dev.promptbench.provider.openai.OpenAIJudgeClient;
import dev.promptbench.provider.openai.OpenAIModelClient;
import dev.promptbench.run.EvaluationOrchestrator;
import dev.promptbench.run.EvaluationSummary;
import dev.promptbench.run.GenerateOptions;
import dev.promptbench.run.GenerationOrchestrator;
import dev.promptbench.run.GenerationSummary;
import dev.promptbench.run.PairNotFoundException;
import dev.promptbench.run.RetryPolicy;
import dev.promptbench.run.RunRegistry;
import dev.promptbench.stats.PairStats;
import dev.promptbench.stats.StatsAggregator;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairState;
import dev.promptbench.store.ResponseStore;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Main entry point of promptbench.
 *
 * <p>A PromptBench instance generates responses for (prompt set, model) pairs, has them judged,
 * and reports statistics and side-by-side comparisons over the stored results. Instances are
 * independent of each other; each owns its own run registry.
 *
 * @see #builder()
 * @see PromptBenchConfig
 */
@Slf4j
public class PromptBench {
    static final String TRACER_NAME = "promptbench";

    /**
     * Rubric given to the OpenAI judge when none is configured. {@code ok} grades the response,
     * {@code other} flags responses that do not address the prompt at all.
     */
    public static final String DEFAULT_RUBRIC =
            "You grade a model's response to a prompt. Set \"ok\" to true when the response is"
                    + " correct, complete and appropriate for the prompt. Set \"other\" to true when"
                    + " the response does not attempt the prompt at all, for example a refusal or an"
                    + " unrelated answer.";

    @Getter
    @Accessors(fluent = true)
    private final PromptBenchConfig config;

    private final PairResolver pairResolver;
    private final ResponseStore store;
    private final GenerationOrchestrator generationOrchestrator;
    private final EvaluationOrchestrator evaluationOrchestrator;
    private final StatsAggregator statsAggregator;
    private final RunRegistry runRegistry = new RunRegistry();

    /** Create an instance with OpenAI-backed clients and an in-memory store. */
    public static PromptBench of(PromptBenchConfig config, PromptSetCatalog promptSets) {
        return builder().config(config).promptSets(promptSets).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private PromptBench(
            PromptBenchConfig config,
            PairResolver pairResolver,
            ResponseStore store,
            ModelClient modelClient,
            JudgeClient judgeClient,
            Tracer tracer) {
        this.config = config;
        this.pairResolver = pairResolver;
        this.store = store;
        var retryPolicy = RetryPolicy.of(config);
        this.generationOrchestrator =
                new GenerationOrchestrator(
                        pairResolver,
                        store,
                        modelClient,
                        retryPolicy,
                        runRegistry,
                        tracer,
                        config.workerPoolSize(),
                        config.runTimeout());
        this.evaluationOrchestrator =
                new EvaluationOrchestrator(
                        pairResolver,
                        store,
                        judgeClient,
                        retryPolicy,
                        runRegistry,
                        tracer,
                        config.workerPoolSize(),
                        config.runTimeout());
        this.statsAggregator = new StatsAggregator(pairResolver, store);
    }

    public GenerationSummary generate(@Nonnull String promptSetId, @Nonnull String modelId) {
        return generate(promptSetId, modelId, GenerateOptions.defaults());
    }

    /**
     * Generate the responses of a pair.
     *
     * @throws dev.promptbench.catalog.InvalidPairException if the pair is unknown
     * @throws dev.promptbench.run.AlreadyInProgressException if the pair is already generating
     */
    public GenerationSummary generate(
            @Nonnull String promptSetId, @Nonnull String modelId, @Nonnull GenerateOptions options) {
        return generationOrchestrator.generate(Pair.of(promptSetId, modelId), options);
    }

    /**
     * Evaluate a pair with the configured default judge model.
     *
     * @throws IllegalStateException if no default judge model is configured
     */
    public EvaluationSummary evaluate(@Nonnull String promptSetId, @Nonnull String modelId) {
        var judgeModelId =
                config.defaultJudgeModel()
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "no judge model given and"
                                                        + " PROMPTBENCH_DEFAULT_JUDGE_MODEL is not"
                                                        + " set"));
        return evaluate(promptSetId, modelId, judgeModelId);
    }

    public EvaluationSummary evaluate(
            @Nonnull String promptSetId, @Nonnull String modelId, @Nonnull String judgeModelId) {
        return evaluationOrchestrator.evaluate(
                Pair.of(promptSetId, modelId), judgeModelId, Optional.empty());
    }

    /**
     * Judge the pair's unjudged responses.
     *
     * @throws dev.promptbench.catalog.InvalidPairException if the pair is unknown
     * @throws dev.promptbench.run.NotGeneratedException if the pair is not fully generated
     * @throws dev.promptbench.run.AlreadyInProgressException if the pair is already evaluating
     */
    public EvaluationSummary evaluate(
            @Nonnull String promptSetId,
            @Nonnull String modelId,
            @Nonnull String judgeModelId,
            @Nonnull Duration timeout) {
        return evaluationOrchestrator.evaluate(
                Pair.of(promptSetId, modelId), judgeModelId, Optional.of(timeout));
    }

    public PairState getPairState(@Nonnull String promptSetId, @Nonnull String modelId) {
        return statsAggregator.computeState(Pair.of(promptSetId, modelId));
    }

    public PairStats getStats(@Nonnull String promptSetId, @Nonnull String modelId) {
        return statsAggregator.computeStats(Pair.of(promptSetId, modelId));
    }

    /**
     * Cancel the active generate and evaluate runs of a pair. Results already written are kept;
     * results still in flight are discarded.
     *
     * @throws dev.promptbench.catalog.InvalidPairException if the pair is unknown
     * @throws PairNotFoundException if the pair has no active run
     */
    public void cancel(@Nonnull String promptSetId, @Nonnull String modelId) {
        var pair = Pair.of(promptSetId, modelId);
        pairResolver.resolve(pair);
        int cancelled = runRegistry.cancel(pair);
        if (cancelled == 0) {
            throw new PairNotFoundException(pair);
        }
        log.info("cancelled {} run(s) of {}", cancelled, pair);
    }

    /** Stats of every prompt set paired with every model. */
    public List<PairStats> overview() {
        return pairResolver.allPairs().stream().map(statsAggregator::computeStats).toList();
    }

    /** Start a new comparison session with an empty selection. */
    public ComparisonSelector comparisonSession() {
        return new ComparisonSelector(pairResolver, store);
    }

    public static class Builder {
        private @Nullable PromptBenchConfig config;
        private @Nullable PromptSetCatalog promptSets;
        private @Nullable ModelCatalog models;
        private @Nullable ResponseStore store;
        private @Nullable ModelClient modelClient;
        private @Nullable JudgeClient judgeClient;
        private @Nullable Tracer tracer;

        private Builder() {}

        public Builder config(@Nonnull PromptBenchConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder promptSets(@Nonnull PromptSetCatalog promptSets) {
            this.promptSets = Objects.requireNonNull(promptSets);
            return this;
        }

        /** Models that may be paired with a prompt set. Defaults to the configured models. */
        public Builder models(@Nonnull ModelCatalog models) {
            this.models = Objects.requireNonNull(models);
            return this;
        }

        public Builder store(@Nonnull ResponseStore store) {
            this.store = Objects.requireNonNull(store);
            return this;
        }

        public Builder modelClient(@Nonnull ModelClient modelClient) {
            this.modelClient = Objects.requireNonNull(modelClient);
            return this;
        }

        public Builder judgeClient(@Nonnull JudgeClient judgeClient) {
            this.judgeClient = Objects.requireNonNull(judgeClient);
            return this;
        }

        public Builder tracer(@Nonnull Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }

        /**
         * @throws IllegalStateException if no prompt set catalog was given, or if an OpenAI client
         *     is needed and no API key is configured
         */
        public PromptBench build() {
            if (promptSets == null) {
                throw new IllegalStateException("a prompt set catalog is required");
            }
            var config = this.config != null ? this.config : PromptBenchConfig.fromEnvironment();
            if (config.debug()) {
                log.info(
                        "creating promptbench: workers={}, attempts={}, run timeout={}, models={}",
                        config.workerPoolSize(),
                        config.maxAttempts(),
                        config.runTimeout(),
                        config.models());
            }
            var models = this.models != null ? this.models : ModelCatalog.of(config.models());
            return new PromptBench(
                    config,
                    new PairResolver(promptSets, models),
                    store != null ? store : ResponseStore.inMemory(),
                    modelClient != null ? modelClient : OpenAIModelClient.of(config),
                    judgeClient != null
                            ? judgeClient
                            : OpenAIJudgeClient.of(config, DEFAULT_RUBRIC),
                    tracer != null ? tracer : GlobalOpenTelemetry.getTracer(TRACER_NAME));
        }
    }
}

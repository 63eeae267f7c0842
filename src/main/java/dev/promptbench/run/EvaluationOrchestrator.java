package dev.promptbench.run;

import static dev.promptbench.run.RunAttributes.*;

import dev.promptbench.catalog.PairResolver;
import dev.promptbench.catalog.PromptSet;
import dev.promptbench.provider.JudgeClient;
import dev.promptbench.provider.ProviderException;
import dev.promptbench.provider.Verdict;
import dev.promptbench.store.EvaluationResult;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairState;
import dev.promptbench.store.PromptResponse;
import dev.promptbench.store.ResponseStore;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Submits every generated response of a pair that has no verdict yet to a judge model.
 *
 * <p>Responses are never re-judged. A response the judge cannot score is skipped and left for a
 * later run.
 */
@Slf4j
public final class EvaluationOrchestrator {
    private final @Nonnull PairResolver pairResolver;
    private final @Nonnull ResponseStore store;
    private final @Nonnull JudgeClient judgeClient;
    private final @Nonnull RetryPolicy retryPolicy;
    private final @Nonnull RunRegistry runRegistry;
    private final @Nonnull Tracer tracer;
    private final int workerPoolSize;
    private final @Nonnull Duration defaultTimeout;

    public EvaluationOrchestrator(
            @Nonnull PairResolver pairResolver,
            @Nonnull ResponseStore store,
            @Nonnull JudgeClient judgeClient,
            @Nonnull RetryPolicy retryPolicy,
            @Nonnull RunRegistry runRegistry,
            @Nonnull Tracer tracer,
            int workerPoolSize,
            @Nonnull Duration defaultTimeout) {
        this.pairResolver = Objects.requireNonNull(pairResolver);
        this.store = Objects.requireNonNull(store);
        this.judgeClient = Objects.requireNonNull(judgeClient);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.runRegistry = Objects.requireNonNull(runRegistry);
        this.tracer = Objects.requireNonNull(tracer);
        this.workerPoolSize = workerPoolSize;
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout);
    }

    /**
     * Judge the pair's unjudged responses.
     *
     * @param timeout bound of the whole run; the configured run timeout when empty
     * @throws dev.promptbench.catalog.InvalidPairException if the pair is unknown
     * @throws NotGeneratedException if some prompt of the pair has no response yet
     * @throws AlreadyInProgressException if the pair is already being evaluated
     */
    public EvaluationSummary evaluate(
            @Nonnull Pair pair, @Nonnull String judgeModelId, @Nonnull Optional<Duration> timeout) {
        Objects.requireNonNull(judgeModelId, "judgeModelId");
        if (judgeModelId.isBlank()) {
            throw new IllegalArgumentException("judge model id must not be blank");
        }
        var promptSet = pairResolver.resolve(pair);
        try (var run = runRegistry.register(pair, RunRegistry.RunKind.EVALUATION)) {
            var snapshot = store.snapshot(pair);
            if (PairState.derive(promptSet.promptCount(), snapshot) == PairState.NOT_GENERATED) {
                throw new NotGeneratedException(pair);
            }
            var eligible =
                    snapshot.responses().values().stream()
                            .filter(r -> !r.isError())
                            .filter(r -> !snapshot.evaluations().containsKey(r.promptIndex()))
                            .toList();
            var runTimeout = timeout.orElse(defaultTimeout);
            log.info(
                    "evaluating {} responses of {} with judge {} (timeout={})",
                    eligible.size(),
                    pair,
                    judgeModelId,
                    runTimeout);

            var span =
                    tracer.spanBuilder("evaluate")
                            .setAttribute(PROMPT_SET_ID, pair.promptSetId())
                            .setAttribute(MODEL_ID, pair.modelId())
                            .setAttribute(JUDGE_MODEL_ID, judgeModelId)
                            .setAttribute(DISPATCHED, (long) eligible.size())
                            .startSpan();
            try {
                return dispatch(pair, promptSet, judgeModelId, eligible, runTimeout, span, run);
            } finally {
                span.end();
            }
        }
    }

    private EvaluationSummary dispatch(
            Pair pair,
            PromptSet promptSet,
            String judgeModelId,
            List<PromptResponse> eligible,
            Duration timeout,
            Span span,
            RunRegistry.ActiveRun run) {
        long start = System.nanoTime();
        var evaluated = new AtomicInteger();
        var skipped = new AtomicInteger();
        TaskGroup.Outcome outcome;
        try (var ignored = span.makeCurrent();
                var group =
                        new TaskGroup(
                                "evaluate-" + pair,
                                Math.max(1, Math.min(workerPoolSize, eligible.size())))) {
            run.attach(group);
            for (var response : eligible) {
                group.spawn(
                        () -> {
                            var verdict =
                                    judgeOne(
                                            span,
                                            judgeModelId,
                                            response,
                                            pairResolver.promptText(
                                                    promptSet, response.promptIndex()));
                            group.commit(
                                    () -> {
                                        if (verdict.isEmpty()) {
                                            skipped.incrementAndGet();
                                            return;
                                        }
                                        var result =
                                                EvaluationResult.of(
                                                        pair,
                                                        response.promptIndex(),
                                                        judgeModelId,
                                                        verdict.get().ok(),
                                                        verdict.get().other());
                                        if (store.putEvaluationIfCurrent(result, response)) {
                                            evaluated.incrementAndGet();
                                        } else {
                                            log.debug(
                                                    "discarding verdict on superseded response"
                                                            + " {}[{}]",
                                                    pair,
                                                    response.promptIndex());
                                            skipped.incrementAndGet();
                                        }
                                    });
                        });
            }
            outcome = group.join(timeout);
        }
        var summary =
                new EvaluationSummary(
                        evaluated.get(),
                        skipped.get(),
                        eligible.size() - evaluated.get() - skipped.get(),
                        Duration.ofNanos(System.nanoTime() - start));
        span.setAttribute(OUTCOME, outcome.name());
        span.setAttribute("promptbench.evaluated", (long) summary.evaluatedCount());
        span.setAttribute("promptbench.skipped", (long) summary.skippedCount());
        span.setAttribute(PENDING, (long) summary.pendingCount());
        log.info("evaluation of {} finished {}: {}", pair, outcome, summary);
        return summary;
    }

    private Optional<Verdict> judgeOne(
            Span span, String judgeModelId, PromptResponse response, String promptText)
            throws InterruptedException {
        var pair = response.pair();
        var responseText = response.text().orElseThrow();
        try {
            return Optional.of(
                    retryPolicy.call(
                            "judge %s[%d]".formatted(pair, response.promptIndex()),
                            () -> judgeClient.score(judgeModelId, promptText, responseText)));
        } catch (ProviderException e) {
            log.warn(
                    "evaluation of {}[{}] skipped: {}",
                    pair,
                    response.promptIndex(),
                    e.toErrorMarker());
            span.addEvent(
                    PROVIDER_FAILURE_EVENT,
                    Attributes.of(
                            PROMPT_INDEX,
                            (long) response.promptIndex(),
                            FAILURE_KIND,
                            e.getKind().name()));
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error(
                    "judge client failed unexpectedly on {}[{}]",
                    pair,
                    response.promptIndex(),
                    e);
            span.addEvent(
                    PROVIDER_FAILURE_EVENT,
                    Attributes.of(
                            PROMPT_INDEX,
                            (long) response.promptIndex(),
                            FAILURE_KIND,
                            ProviderException.Kind.API_ERROR.name()));
            return Optional.empty();
        }
    }
}

package dev.promptbench.run;

import static dev.promptbench.run.RunAttributes.*;

import dev.promptbench.PromptBenchUtils;
import dev.promptbench.catalog.PairResolver;
import dev.promptbench.catalog.PromptSet;
import dev.promptbench.provider.ModelClient;
import dev.promptbench.provider.ProviderException;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairState;
import dev.promptbench.store.PromptResponse;
import dev.promptbench.store.ResponseStore;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates one response per prompt of a pair by calling the pair's model concurrently.
 *
 * <p>Provider failures are recorded as error markers on their prompt index and never fail the
 * call. A pair that already has a response for every prompt is left untouched unless generation
 * is forced.
 */
@Slf4j
public final class GenerationOrchestrator {
    private final @Nonnull PairResolver pairResolver;
    private final @Nonnull ResponseStore store;
    private final @Nonnull ModelClient modelClient;
    private final @Nonnull RetryPolicy retryPolicy;
    private final @Nonnull RunRegistry runRegistry;
    private final @Nonnull Tracer tracer;
    private final int workerPoolSize;
    private final @Nonnull Duration defaultTimeout;
    private final Map<Pair, GenerationSummary> completedRuns = new ConcurrentHashMap<>();

    public GenerationOrchestrator(
            @Nonnull PairResolver pairResolver,
            @Nonnull ResponseStore store,
            @Nonnull ModelClient modelClient,
            @Nonnull RetryPolicy retryPolicy,
            @Nonnull RunRegistry runRegistry,
            @Nonnull Tracer tracer,
            int workerPoolSize,
            @Nonnull Duration defaultTimeout) {
        this.pairResolver = Objects.requireNonNull(pairResolver);
        this.store = Objects.requireNonNull(store);
        this.modelClient = Objects.requireNonNull(modelClient);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.runRegistry = Objects.requireNonNull(runRegistry);
        this.tracer = Objects.requireNonNull(tracer);
        this.workerPoolSize = workerPoolSize;
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout);
    }

    /**
     * Generate the missing responses of a pair, or every response when {@code options.force()}.
     *
     * @throws dev.promptbench.catalog.InvalidPairException if the pair is unknown
     * @throws AlreadyInProgressException if the pair is already being generated
     */
    public GenerationSummary generate(@Nonnull Pair pair, @Nonnull GenerateOptions options) {
        var promptSet = pairResolver.resolve(pair);
        try (var run = runRegistry.register(pair, RunRegistry.RunKind.GENERATION)) {
            var snapshot = store.snapshot(pair);
            var state = PairState.derive(promptSet.promptCount(), snapshot);
            if (!options.force() && state.isAtLeast(PairState.GENERATED)) {
                log.debug("{} is already {}, nothing to generate", pair, state);
                return completedRuns.getOrDefault(
                        pair,
                        new GenerationSummary(
                                (int) snapshot.successCount(),
                                (int) snapshot.errorCount(),
                                0,
                                Duration.ZERO));
            }

            var indices = new ArrayList<Integer>();
            for (int i = 0; i < promptSet.promptCount(); i++) {
                if (options.force() || !snapshot.responses().containsKey(i)) {
                    indices.add(i);
                }
            }
            var timeout = options.timeout().orElse(defaultTimeout);
            log.info(
                    "generating {} of {} responses for {} (force={}, timeout={})",
                    indices.size(),
                    promptSet.promptCount(),
                    pair,
                    options.force(),
                    timeout);

            var span =
                    tracer.spanBuilder("generate")
                            .setAttribute(PROMPT_SET_ID, pair.promptSetId())
                            .setAttribute(MODEL_ID, pair.modelId())
                            .setAttribute(DISPATCHED, (long) indices.size())
                            .setAttribute("promptbench.force", options.force())
                            .startSpan();
            try {
                return dispatch(pair, promptSet, indices, options, timeout, span, run);
            } finally {
                span.end();
            }
        }
    }

    private GenerationSummary dispatch(
            Pair pair,
            PromptSet promptSet,
            List<Integer> indices,
            GenerateOptions options,
            Duration timeout,
            Span span,
            RunRegistry.ActiveRun run) {
        long start = System.nanoTime();
        var generated = new AtomicInteger();
        var failed = new AtomicInteger();
        TaskGroup.Outcome outcome;
        try (var ignored = span.makeCurrent();
                var group =
                        new TaskGroup(
                                "generate-" + pair,
                                Math.max(1, Math.min(workerPoolSize, indices.size())))) {
            run.attach(group);
            for (int index : indices) {
                group.spawn(
                        () -> {
                            var response =
                                    generateOne(
                                            span,
                                            pair,
                                            index,
                                            pairResolver.promptText(promptSet, index));
                            group.commit(
                                    () -> {
                                        if (options.force()) {
                                            store.replaceResponse(response);
                                        } else if (!store.putResponseIfAbsent(response)) {
                                            return;
                                        }
                                        (response.isError() ? failed : generated)
                                                .incrementAndGet();
                                    });
                        });
            }
            outcome = group.join(timeout);
        }
        var summary =
                new GenerationSummary(
                        generated.get(),
                        failed.get(),
                        indices.size() - generated.get() - failed.get(),
                        Duration.ofNanos(System.nanoTime() - start));
        span.setAttribute(OUTCOME, outcome.name());
        span.setAttribute("promptbench.generated", (long) summary.generatedCount());
        span.setAttribute("promptbench.failed", (long) summary.failedCount());
        span.setAttribute(PENDING, (long) summary.pendingCount());

        // a run cut short may leave a pair complete from older rows; only whole runs are cached
        if (outcome == TaskGroup.Outcome.COMPLETED
                && summary.isComplete()
                && PairState.derive(promptSet.promptCount(), store.snapshot(pair))
                        .isAtLeast(PairState.GENERATED)) {
            completedRuns.put(pair, summary);
        }
        log.info("generation of {} finished {}: {}", pair, outcome, summary);
        return summary;
    }

    private PromptResponse generateOne(Span span, Pair pair, int index, String promptText)
            throws InterruptedException {
        try {
            var completion =
                    retryPolicy.call(
                            "completion %s[%d]".formatted(pair, index),
                            () -> modelClient.complete(pair.modelId(), promptText));
            return PromptResponse.success(
                    pair, index, completion.text(), PromptBenchUtils.toSeconds(completion.latency()));
        } catch (ProviderException e) {
            log.warn("generation of {}[{}] failed: {}", pair, index, e.toErrorMarker());
            span.addEvent(
                    PROVIDER_FAILURE_EVENT,
                    Attributes.of(PROMPT_INDEX, (long) index, FAILURE_KIND, e.getKind().name()));
            return PromptResponse.failure(pair, index, e.toErrorMarker());
        } catch (RuntimeException e) {
            log.error("model client failed unexpectedly on {}[{}]", pair, index, e);
            span.addEvent(
                    PROVIDER_FAILURE_EVENT,
                    Attributes.of(
                            PROMPT_INDEX,
                            (long) index,
                            FAILURE_KIND,
                            ProviderException.Kind.API_ERROR.name()));
            return PromptResponse.failure(
                    pair,
                    index,
                    new ProviderException(ProviderException.Kind.API_ERROR, String.valueOf(e), e)
                            .toErrorMarker());
        }
    }
}

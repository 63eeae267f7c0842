package dev.promptbench;

import static org.junit.jupiter.api.Assertions.*;

import dev.promptbench.catalog.ModelCatalog;
import dev.promptbench.catalog.PairResolver;
import dev.promptbench.catalog.PromptSetCatalog;
import dev.promptbench.config.PromptBenchConfig;
import dev.promptbench.provider.JudgeClient;
import dev.promptbench.provider.ModelClient;
import dev.promptbench.run.EvaluationOrchestrator;
import dev.promptbench.run.GenerationOrchestrator;
import dev.promptbench.run.RetryPolicy;
import dev.promptbench.run.RunRegistry;
import dev.promptbench.store.EvaluationResult;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairSnapshot;
import dev.promptbench.store.PromptResponse;
import dev.promptbench.store.ResponseStore;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Wires the run components against in-memory catalogs, an in-memory store and a test tracer. */
@Getter
@Accessors(fluent = true)
public final class TestHarness {
    public static final String MODEL_A = "model-a";
    public static final String MODEL_B = "model-b";
    public static final String JUDGE = "judge-1";

    private final PromptBenchConfig config;
    private final PromptSetCatalog.InMemoryImpl promptSets = new PromptSetCatalog.InMemoryImpl();
    private final ModelCatalog models = ModelCatalog.of(MODEL_A, MODEL_B);
    private final ResponseStore store = ResponseStore.inMemory();
    private final PairResolver pairResolver = new PairResolver(promptSets, models);
    private final RunRegistry runRegistry = new RunRegistry();
    private final SdkTracerProvider tracerProvider;

    @Getter(AccessLevel.NONE)
    private final @Nonnull InMemorySpanExporter spanExporter;

    public TestHarness() {
        this(createTestConfig());
    }

    public TestHarness(PromptBenchConfig config) {
        this.config = config;
        this.spanExporter = InMemorySpanExporter.create();
        this.tracerProvider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                        .build();
    }

    public Tracer tracer() {
        return tracerProvider.get("promptbench-test");
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(config);
    }

    public GenerationOrchestrator generationOrchestrator(ModelClient modelClient) {
        return generationOrchestrator(modelClient, store);
    }

    public GenerationOrchestrator generationOrchestrator(
            ModelClient modelClient, ResponseStore store) {
        return new GenerationOrchestrator(
                pairResolver,
                store,
                modelClient,
                retryPolicy(),
                runRegistry,
                tracer(),
                config.workerPoolSize(),
                config.runTimeout());
    }

    public EvaluationOrchestrator evaluationOrchestrator(JudgeClient judgeClient) {
        return evaluationOrchestrator(judgeClient, store);
    }

    public EvaluationOrchestrator evaluationOrchestrator(
            JudgeClient judgeClient, ResponseStore store) {
        return new EvaluationOrchestrator(
                pairResolver,
                store,
                judgeClient,
                retryPolicy(),
                runRegistry,
                tracer(),
                config.workerPoolSize(),
                config.runTimeout());
    }

    /**
     * The harness store, except that the first snapshot of {@code pair} cancels the pair's runs.
     * A run reads that snapshot right after registering, before any task is dispatched.
     */
    public ResponseStore cancellingOnFirstSnapshot(Pair pair) {
        var cancelled = new AtomicBoolean();
        return new ResponseStore() {
            @Override
            public PairSnapshot snapshot(@Nonnull Pair requested) {
                if (requested.equals(pair) && cancelled.compareAndSet(false, true)) {
                    assertEquals(1, runRegistry.cancel(pair));
                }
                return store.snapshot(requested);
            }

            @Override
            public boolean putResponseIfAbsent(@Nonnull PromptResponse response) {
                return store.putResponseIfAbsent(response);
            }

            @Override
            public void replaceResponse(@Nonnull PromptResponse response) {
                store.replaceResponse(response);
            }

            @Override
            public boolean putEvaluationIfCurrent(
                    @Nonnull EvaluationResult evaluation, @Nonnull PromptResponse judged) {
                return store.putEvaluationIfCurrent(evaluation, judged);
            }
        };
    }

    /** flush all pending spans and return all spans which have been exported so far */
    public List<SpanData> awaitExportedSpans() {
        assertTrue(tracerProvider.forceFlush().join(10, TimeUnit.SECONDS).isSuccess());
        return spanExporter.getFinishedSpanItems();
    }

    public static PromptBenchConfig createTestConfig() {
        return PromptBenchConfig.builder()
                .workerPoolSize(4)
                .maxAttempts(3)
                .initialBackoff(Duration.ofMillis(1))
                .maxBackoff(Duration.ofMillis(5))
                .backoffJitter(0.0)
                .runTimeout(Duration.ofSeconds(10))
                .models(List.of(MODEL_A, MODEL_B))
                .defaultJudgeModel(JUDGE)
                // NOTE: not a real key, the OpenAI client is never reached from these tests
                .openAiApiKey("test-key")
                .build();
    }
}

package dev.promptbench.run;

import static dev.promptbench.TestHarness.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.promptbench.TestHarness;
import dev.promptbench.provider.JudgeClient;
import dev.promptbench.provider.ProviderException;
import dev.promptbench.provider.ProviderException.Kind;
import dev.promptbench.provider.Verdict;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairState;
import dev.promptbench.store.PromptResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EvaluationOrchestratorTest {
    private static final Pair PAIR = Pair.of("arith", MODEL_A);

    private TestHarness harness;
    private AtomicInteger judgeCalls;

    @BeforeEach
    void beforeEach() {
        harness = new TestHarness();
        harness.promptSets().add("arith", List.of("2+2?", "3+3?", "4+4?"));
        judgeCalls = new AtomicInteger();
    }

    /** Stores two answers and one error marker for the pair. */
    private void storeGeneratedPair() {
        var store = harness.store();
        store.putResponseIfAbsent(PromptResponse.success(PAIR, 0, "4", 0.2));
        store.putResponseIfAbsent(PromptResponse.failure(PAIR, 1, "TIMEOUT: request timed out"));
        store.putResponseIfAbsent(PromptResponse.success(PAIR, 2, "9", 0.4));
    }

    /** Marks the answer "4" as correct and everything else as wrong. */
    private JudgeClient arithmeticJudge() {
        return (judgeModelId, prompt, response) -> {
            judgeCalls.incrementAndGet();
            return new Verdict(response.equals("4"), false);
        };
    }

    @Test
    void judgesEverySuccessfulResponse() {
        storeGeneratedPair();

        var summary =
                harness.evaluationOrchestrator(arithmeticJudge())
                        .evaluate(PAIR, JUDGE, Optional.empty());

        assertEquals(2, summary.evaluatedCount());
        assertEquals(0, summary.skippedCount());
        assertTrue(summary.isComplete());
        assertEquals(2, judgeCalls.get());
        var evaluations = harness.store().evaluations(PAIR);
        assertEquals(List.of(0, 2), evaluations.stream().map(e -> e.promptIndex()).toList());
        assertTrue(evaluations.get(0).ok());
        assertFalse(evaluations.get(1).ok());
        assertEquals(JUDGE, evaluations.get(0).judgeModelId());
        assertEquals(PairState.EVALUATED, PairState.derive(3, harness.store().snapshot(PAIR)));
    }

    @Test
    void judgedResponsesAreNotJudgedAgain() {
        storeGeneratedPair();
        var orchestrator = harness.evaluationOrchestrator(arithmeticJudge());
        orchestrator.evaluate(PAIR, JUDGE, Optional.empty());

        var second = orchestrator.evaluate(PAIR, JUDGE, Optional.empty());

        assertEquals(0, second.evaluatedCount());
        assertEquals(2, judgeCalls.get());
    }

    @Test
    void notGeneratedPairIsRejectedWithoutWrites() {
        harness.store().putResponseIfAbsent(PromptResponse.success(PAIR, 0, "4", 0.2));
        var orchestrator = harness.evaluationOrchestrator(arithmeticJudge());

        assertThrows(
                NotGeneratedException.class,
                () -> orchestrator.evaluate(PAIR, JUDGE, Optional.empty()));
        assertEquals(0, judgeCalls.get());
        assertTrue(harness.store().evaluations(PAIR).isEmpty());
        assertFalse(harness.runRegistry().isActive(PAIR, RunRegistry.RunKind.EVALUATION));
    }

    @Test
    void failedVerdictsAreSkippedAndPickedUpLater() {
        storeGeneratedPair();
        var broken = new AtomicBoolean(true);
        JudgeClient judge =
                (judgeModelId, prompt, response) -> {
                    if (broken.get() && prompt.equals("4+4?")) {
                        throw new ProviderException(Kind.MALFORMED_RESPONSE, "not json");
                    }
                    return new Verdict(true, true);
                };
        var orchestrator = harness.evaluationOrchestrator(judge);

        var first = orchestrator.evaluate(PAIR, JUDGE, Optional.empty());

        assertEquals(1, first.evaluatedCount());
        assertEquals(1, first.skippedCount());
        assertEquals(PairState.GENERATED, PairState.derive(3, harness.store().snapshot(PAIR)));

        broken.set(false);
        var second = orchestrator.evaluate(PAIR, JUDGE, Optional.empty());

        assertEquals(1, second.evaluatedCount());
        assertEquals(PairState.EVALUATED, PairState.derive(3, harness.store().snapshot(PAIR)));
    }

    @Test
    void concurrentEvaluateOnSamePairIsRejected() throws Exception {
        storeGeneratedPair();
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        JudgeClient blocking =
                (judgeModelId, prompt, response) -> {
                    entered.countDown();
                    release.await();
                    return new Verdict(true, false);
                };
        var orchestrator = harness.evaluationOrchestrator(blocking);
        var executor = Executors.newSingleThreadExecutor();
        try {
            var first = executor.submit(() -> orchestrator.evaluate(PAIR, JUDGE, Optional.empty()));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertThrows(
                    AlreadyInProgressException.class,
                    () -> orchestrator.evaluate(PAIR, JUDGE, Optional.empty()));

            release.countDown();
            assertEquals(2, first.get(5, TimeUnit.SECONDS).evaluatedCount());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void timedOutEvaluationDiscardsLateVerdictsAndIsResumed() throws Exception {
        storeGeneratedPair();
        var release = new CountDownLatch(1);
        var lateVerdictReturned = new CountDownLatch(1);
        var slowCalls = new AtomicInteger();
        JudgeClient judge =
                (judgeModelId, prompt, response) -> {
                    if (prompt.equals("4+4?") && slowCalls.incrementAndGet() == 1) {
                        // ignores interruption, so this verdict arrives after the run timed out
                        while (release.getCount() > 0) {
                            try {
                                release.await();
                            } catch (InterruptedException e) {
                                continue;
                            }
                        }
                        lateVerdictReturned.countDown();
                    }
                    return new Verdict(true, false);
                };
        var orchestrator = harness.evaluationOrchestrator(judge);

        var partial = orchestrator.evaluate(PAIR, JUDGE, Optional.of(Duration.ofMillis(300)));

        assertEquals(1, partial.evaluatedCount());
        assertEquals(1, partial.pendingCount());
        assertFalse(partial.isComplete());

        release.countDown();
        assertTrue(lateVerdictReturned.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse(harness.store().snapshot(PAIR).evaluations().containsKey(2));
        assertEquals(PairState.GENERATED, PairState.derive(3, harness.store().snapshot(PAIR)));

        var resumed = orchestrator.evaluate(PAIR, JUDGE, Optional.empty());

        assertEquals(1, resumed.evaluatedCount());
        assertEquals(2, slowCalls.get());
        assertEquals(PairState.EVALUATED, PairState.derive(3, harness.store().snapshot(PAIR)));
    }

    @Test
    void cancelBeforeDispatchLeavesEveryResponsePending() {
        storeGeneratedPair();
        var orchestrator =
                harness.evaluationOrchestrator(
                        arithmeticJudge(), harness.cancellingOnFirstSnapshot(PAIR));

        var summary = orchestrator.evaluate(PAIR, JUDGE, Optional.empty());

        assertEquals(0, summary.evaluatedCount());
        assertEquals(2, summary.pendingCount());
        assertEquals(0, judgeCalls.get());
        assertTrue(harness.store().evaluations(PAIR).isEmpty());
        assertFalse(harness.runRegistry().isActive(PAIR, RunRegistry.RunKind.EVALUATION));
        var span = harness.awaitExportedSpans().get(0);
        assertEquals("CANCELLED", span.getAttributes().get(RunAttributes.OUTCOME));
    }

    @Test
    void blankJudgeIsRejected() {
        storeGeneratedPair();
        var orchestrator = harness.evaluationOrchestrator(arithmeticJudge());
        assertThrows(
                IllegalArgumentException.class,
                () -> orchestrator.evaluate(PAIR, " ", Optional.empty()));
    }

    @Test
    void runIsRecordedAsSpan() {
        storeGeneratedPair();
        harness.evaluationOrchestrator(arithmeticJudge()).evaluate(PAIR, JUDGE, Optional.empty());

        var span = harness.awaitExportedSpans().get(0);
        assertEquals("evaluate", span.getName());
        assertEquals(JUDGE, span.getAttributes().get(RunAttributes.JUDGE_MODEL_ID));
        assertEquals(2L, span.getAttributes().get(RunAttributes.DISPATCHED));
        assertEquals(0L, span.getAttributes().get(RunAttributes.PENDING));
    }
}
